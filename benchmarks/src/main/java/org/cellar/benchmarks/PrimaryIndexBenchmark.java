package org.cellar.benchmarks;

import org.cellar.core.highlight.Highlighter;
import org.cellar.core.index.InMemoryIndexStorage;
import org.cellar.core.index.PrimaryIndexStore;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.query.Filter;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vector.FieldWeights;
import org.cellar.core.vector.SearchVectorBuilder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for the embedded primary index
 * Tests: vector build, upsert, ranked query, filtered query, highlighting
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class PrimaryIndexBenchmark {

	@Param({"1000", "10000", "50000"})
	private int catalogSize;

	private TextAnalyzer textAnalyzer;
	private AnalysisProfile english;
	private SearchVectorBuilder vectorBuilder;
	private FieldWeights weights;
	private PrimaryIndexStore primaryIndex;
	private Highlighter highlighter;
	private List<CatalogRecord> records;
	private CatalogRecord probe;

	private SearchQuery rankedQuery;
	private SearchQuery filteredQuery;

	@Setup(Level.Trial)
	public void setup() {
		System.out.println("=== Primary Index Benchmark Setup (catalogSize=" + catalogSize + ") ===");

		textAnalyzer = new TextAnalyzer();
		english = AnalysisProfile.english(AnalysisProfile.defaultStopWords());
		vectorBuilder = new SearchVectorBuilder(textAnalyzer, english);
		weights = SyntheticCatalog.SCHEMA.fieldWeights();
		highlighter = new Highlighter(textAnalyzer, english);

		records = SyntheticCatalog.generate(catalogSize, 42L);
		primaryIndex = new PrimaryIndexStore(new InMemoryIndexStorage(), SyntheticCatalog.SCHEMA, textAnalyzer, english);
		for (CatalogRecord record : records) {
			primaryIndex.index(record.id(), record, vectorBuilder.build(record, weights));
		}
		probe = records.get(catalogSize / 2);

		rankedQuery = SearchQuery.builder().text("merlot cherry tannins").limit(20).build();
		filteredQuery = SearchQuery.builder()
				.text("chewy structured")
				.filter(Filter.equalTo("country", "Italy"))
				.filter(Filter.range("points", 90.0, null))
				.limit(20)
				.build();

		System.out.println("Index ready: " + primaryIndex.getStats());
	}

	/**
	 * Benchmark: Build the search vector of one record
	 */
	@Benchmark
	public void buildVector(Blackhole blackhole) {
		blackhole.consume(vectorBuilder.build(probe, weights));
	}

	/**
	 * Benchmark: Re-index an existing record (stale postings removed)
	 */
	@Benchmark
	public void reindexRecord() {
		primaryIndex.index(probe.id(), probe, vectorBuilder.build(probe, weights));
	}

	/**
	 * Benchmark: Ranked free-text query
	 */
	@Benchmark
	public void rankedQuery(Blackhole blackhole) {
		blackhole.consume(primaryIndex.query(rankedQuery));
	}

	/**
	 * Benchmark: Free-text query with keyword and range filters
	 */
	@Benchmark
	public void filteredQuery(Blackhole blackhole) {
		blackhole.consume(primaryIndex.query(filteredQuery));
	}

	/**
	 * Benchmark: Highlight one description
	 */
	@Benchmark
	public void highlightDescription(Blackhole blackhole) {
		blackhole.consume(highlighter.highlight(probe.text("description"), List.of("cherry tannins"), "<mark>", "</mark>"));
	}
}
