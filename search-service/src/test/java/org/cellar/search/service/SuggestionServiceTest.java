package org.cellar.search.service;

import org.apache.lucene.store.ByteBuffersDirectory;
import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.error.ValidationException;
import org.cellar.core.mirror.LuceneMirrorEngine;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.cellar.core.mirror.RetryPolicy;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vocabulary.InMemoryVocabularyStore;
import org.cellar.core.vocabulary.VocabularyEngine;
import org.cellar.search.model.SearchSource;
import org.cellar.search.model.SuggestionResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SuggestionServiceTest {

	private final CatalogSchema schema = CatalogSchema.parse("variety:A,description:C", "");

	private VocabularyEngine vocabulary;
	private LuceneMirrorEngine mirrorEngine;
	private LuceneMirrorEngine offlineEngine;
	private MirrorSynchronizer mirror;
	private MirrorSynchronizer offlineMirror;

	@BeforeEach
	public void setUp() throws Exception {
		TextAnalyzer textAnalyzer = new TextAnalyzer();
		AnalysisProfile english = AnalysisProfile.english(AnalysisProfile.defaultStopWords());
		AnalysisProfile vocabularyProfile = AnalysisProfile.vocabulary(AnalysisProfile.defaultStopWords());

		vocabulary = new VocabularyEngine(new InMemoryVocabularyStore(), textAnalyzer, vocabularyProfile,
				schema.textFields().keySet(), 3, 50, 0.3);
		mirrorEngine = new LuceneMirrorEngine(new ByteBuffersDirectory(), schema, textAnalyzer, english, vocabularyProfile, true);
		mirror = new MirrorSynchronizer(mirrorEngine, schema, RetryPolicy.none(), 10, new HashSet<>());
		offlineEngine = new LuceneMirrorEngine(new ByteBuffersDirectory(), schema, textAnalyzer, english, vocabularyProfile, false);
		offlineMirror = new MirrorSynchronizer(offlineEngine, schema, RetryPolicy.none(), 10, new HashSet<>());

		for (CatalogRecord record : List.of(
				CatalogRecord.builder("1").text("variety", "Cabernet Sauvignon").text("description", "Cassis and cedar.").build(),
				CatalogRecord.builder("2").text("variety", "Cabernet Franc").text("description", "Green pepper, raspberry.").build(),
				CatalogRecord.builder("3").text("variety", "Nebbiolo").text("description", "Tar and roses.").build())) {
			vocabulary.ingest(record);
			assertTrue(mirror.upsert(record));
		}
	}

	@AfterEach
	public void tearDown() throws Exception {
		mirrorEngine.close();
		offlineEngine.close();
	}

	@Test
	public void testPrimaryUsesTrigramVocabulary() throws Exception {
		SuggestionResponse response = new SuggestionService(vocabulary, mirror, 10, true)
				.suggest("cabernay", SearchSource.PRIMARY, 5);

		assertEquals(SearchSource.PRIMARY, response.source());
		assertFalse(response.degraded());
		assertEquals("cabernet", response.suggestions().get(0).term());
		assertEquals(0.5, response.suggestions().get(0).similarity(), 1e-9);
	}

	@Test
	public void testSimilarityFloorCanBeRaised() throws Exception {
		SuggestionResponse response = new SuggestionService(vocabulary, mirror, 10, true)
				.suggest("cabernay", SearchSource.PRIMARY, 5, 0.9);

		assertTrue(response.suggestions().isEmpty());
	}

	@Test
	public void testMirrorUsesEditDistance() throws Exception {
		SuggestionResponse response = new SuggestionService(vocabulary, mirror, 10, true)
				.suggest("nebiolo", SearchSource.MIRROR, 5);

		assertEquals(SearchSource.MIRROR, response.source());
		assertEquals("nebbiolo", response.suggestions().get(0).term());
	}

	@Test
	public void testUnavailableMirrorFallsBackToVocabulary() throws Exception {
		SuggestionResponse response = new SuggestionService(vocabulary, offlineMirror, 10, true)
				.suggest("cabernay", SearchSource.MIRROR, 5);

		assertTrue(response.degraded());
		assertEquals(SearchSource.PRIMARY, response.source());
		assertEquals("cabernet", response.suggestions().get(0).term());
	}

	@Test
	public void testUnavailableMirrorFailsFastWithoutFallback() {
		SuggestionService service = new SuggestionService(vocabulary, offlineMirror, 10, false);

		assertThrows(IndexUnavailableException.class, () -> service.suggest("cabernay", SearchSource.MIRROR, 5));
	}

	@Test
	public void testRejectsBadArguments() {
		SuggestionService service = new SuggestionService(vocabulary, mirror, 10, true);

		assertThrows(ValidationException.class, () -> service.suggest(" ", SearchSource.PRIMARY, 5));
		assertThrows(ValidationException.class, () -> service.suggest("cabernay", SearchSource.PRIMARY, 0));
		assertThrows(ValidationException.class, () -> service.suggest("cabernay", SearchSource.PRIMARY, 5, 1.5));
	}

	@Test
	public void testLimitIsCappedAtMaxResults() throws Exception {
		SuggestionResponse response = new SuggestionService(vocabulary, mirror, 1, true)
				.suggest("caber", SearchSource.PRIMARY, 10);

		assertEquals(1, response.suggestions().size());
	}
}
