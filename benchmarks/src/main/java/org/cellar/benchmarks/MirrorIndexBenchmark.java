package org.cellar.benchmarks;

import org.apache.lucene.store.ByteBuffersDirectory;
import org.cellar.core.highlight.HighlightMarkers;
import org.cellar.core.mirror.BulkReindexReport;
import org.cellar.core.mirror.LuceneMirrorEngine;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.cellar.core.mirror.RetryPolicy;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.query.Filter;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for the Lucene mirror index
 * Tests: batched reindex by batch size, single upsert, query with and without highlighting
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class MirrorIndexBenchmark {

	@Param({"100", "500", "2000"})
	private int batchSize;

	private TextAnalyzer textAnalyzer;
	private AnalysisProfile english;
	private AnalysisProfile vocabularyProfile;
	private List<CatalogRecord> records;
	private LuceneMirrorEngine engine;
	private MirrorSynchronizer mirror;
	private SearchQuery query;

	@Setup(Level.Trial)
	public void setup() throws IOException {
		System.out.println("=== Mirror Index Benchmark Setup (batchSize=" + batchSize + ") ===");

		textAnalyzer = new TextAnalyzer();
		english = AnalysisProfile.english(AnalysisProfile.defaultStopWords());
		vocabularyProfile = AnalysisProfile.vocabulary(AnalysisProfile.defaultStopWords());
		records = SyntheticCatalog.generate(10000, 11L);

		engine = openEngine();
		mirror = new MirrorSynchronizer(engine, SyntheticCatalog.SCHEMA, RetryPolicy.none(), batchSize, new HashSet<>());
		mirror.bulkUpsert(records.iterator());

		query = SearchQuery.builder()
				.text("cherry tannins")
				.filter(Filter.equalTo("country", "France"))
				.limit(20)
				.build();
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		engine.close();
	}

	private LuceneMirrorEngine openEngine() throws IOException {
		return new LuceneMirrorEngine(new ByteBuffersDirectory(), SyntheticCatalog.SCHEMA, textAnalyzer, english,
				vocabularyProfile, true);
	}

	/**
	 * Benchmark: Stream the whole catalog into a fresh mirror index
	 */
	@Benchmark
	public void bulkReindex(Blackhole blackhole) throws IOException {
		try (LuceneMirrorEngine fresh = openEngine()) {
			MirrorSynchronizer synchronizer = new MirrorSynchronizer(fresh, SyntheticCatalog.SCHEMA, RetryPolicy.none(),
					batchSize, new HashSet<>());
			BulkReindexReport report = synchronizer.bulkUpsert(records.iterator());
			blackhole.consume(report);
		}
	}

	/**
	 * Benchmark: Replace one document
	 */
	@Benchmark
	public void upsertOne(Blackhole blackhole) {
		blackhole.consume(mirror.upsert(records.get(records.size() / 2)));
	}

	/**
	 * Benchmark: Boosted query with a filter
	 */
	@Benchmark
	public void query(Blackhole blackhole) throws IOException {
		blackhole.consume(mirror.query(query, null));
	}

	/**
	 * Benchmark: Boosted query with a filter and highlighting
	 */
	@Benchmark
	public void queryWithHighlights(Blackhole blackhole) throws IOException {
		blackhole.consume(mirror.query(query, HighlightMarkers.DEFAULT));
	}
}
