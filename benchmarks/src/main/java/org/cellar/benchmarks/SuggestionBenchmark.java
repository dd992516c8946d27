package org.cellar.benchmarks;

import org.apache.lucene.store.ByteBuffersDirectory;
import org.cellar.core.mirror.LuceneMirrorEngine;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.cellar.core.mirror.RetryPolicy;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vocabulary.InMemoryVocabularyStore;
import org.cellar.core.vocabulary.JdbcVocabularyStore;
import org.cellar.core.vocabulary.VocabularyEngine;
import org.cellar.core.vocabulary.VocabularyStore;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for "did you mean" suggestions
 * Tests: trigram vocabulary (in memory and SQLite) against the mirror's edit-distance spell checker
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class SuggestionBenchmark {

	@Param({"memory", "sqlite"})
	private String vocabularyStore;

	@Param({"cabernay", "sangiovse", "tanins"})
	private String misspelling;

	private Path workDir;
	private VocabularyStore store;
	private VocabularyEngine vocabulary;
	private LuceneMirrorEngine mirrorEngine;
	private MirrorSynchronizer mirror;

	@Setup(Level.Trial)
	public void setup() throws IOException, SQLException {
		System.out.println("=== Suggestion Benchmark Setup (store=" + vocabularyStore + ") ===");

		TextAnalyzer textAnalyzer = new TextAnalyzer();
		AnalysisProfile english = AnalysisProfile.english(AnalysisProfile.defaultStopWords());
		AnalysisProfile vocabularyProfile = AnalysisProfile.vocabulary(AnalysisProfile.defaultStopWords());

		workDir = Files.createTempDirectory("cellar-suggest-bench");
		store = vocabularyStore.equals("sqlite")
				? new JdbcVocabularyStore("jdbc:sqlite:" + workDir.resolve("vocabulary.sqlite"))
				: new InMemoryVocabularyStore();
		vocabulary = new VocabularyEngine(store, textAnalyzer, vocabularyProfile,
				SyntheticCatalog.SCHEMA.textFields().keySet(), 3, 50, 0.3);

		mirrorEngine = new LuceneMirrorEngine(new ByteBuffersDirectory(), SyntheticCatalog.SCHEMA, textAnalyzer,
				english, vocabularyProfile, true);
		mirror = new MirrorSynchronizer(mirrorEngine, SyntheticCatalog.SCHEMA, RetryPolicy.none(), 1000, new HashSet<>());

		List<CatalogRecord> records = SyntheticCatalog.generate(5000, 7L);
		for (CatalogRecord record : records) {
			vocabulary.ingest(record);
		}
		System.out.println("Mirror bulk load: " + mirror.bulkUpsert(records.iterator()));
		System.out.println("Vocabulary ready: " + vocabulary.size() + " terms");
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		mirrorEngine.close();
		store.close();
		try (var paths = Files.walk(workDir)) {
			paths.sorted((a, b) -> -a.compareTo(b)).forEach(path -> path.toFile().delete());
		}
	}

	/**
	 * Benchmark: Trigram similarity suggestions from the vocabulary
	 */
	@Benchmark
	public void trigramSuggest(Blackhole blackhole) throws IOException {
		blackhole.consume(vocabulary.suggest(misspelling, 5));
	}

	/**
	 * Benchmark: Edit-distance suggestions from the mirror's term dictionary
	 */
	@Benchmark
	public void mirrorTermSuggest(Blackhole blackhole) throws IOException {
		blackhole.consume(mirror.termSuggest(misspelling, 5));
	}
}
