package org.cellar.core.mirror;

import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.error.ValidationException;
import org.cellar.core.highlight.HighlightMarkers;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.query.Filter;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vocabulary.Suggestion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LuceneMirrorEngineTest {

	private final CatalogSchema schema = CatalogSchema.parse(
			"variety:A,winery:B,description:C",
			"country:keyword,points:number");
	private final TextAnalyzer textAnalyzer = new TextAnalyzer();
	private final AnalysisProfile english = AnalysisProfile.english(AnalysisProfile.defaultStopWords());
	private final AnalysisProfile vocabulary = AnalysisProfile.vocabulary(AnalysisProfile.defaultStopWords());

	private Directory directory;
	private LuceneMirrorEngine engine;

	@BeforeEach
	public void setUp() throws Exception {
		directory = new ByteBuffersDirectory();
		engine = new LuceneMirrorEngine(directory, schema, textAnalyzer, english, vocabulary, true);
	}

	@AfterEach
	public void tearDown() throws Exception {
		engine.close();
		directory.close();
	}

	private static MirrorDocument wine(String id, String variety, String description, String country, Object points) {
		Map<String, String> text = new LinkedHashMap<>();
		text.put("variety", variety);
		text.put("description", description);
		Map<String, Object> attributes = new LinkedHashMap<>();
		if (country != null) {
			attributes.put("country", country);
		}
		if (points != null) {
			attributes.put("points", points);
		}
		return new MirrorDocument(id, text, attributes);
	}

	private static List<String> ids(List<MirrorHit> hits) {
		return hits.stream().map(MirrorHit::id).collect(Collectors.toList());
	}

	@Test
	public void testUpsertReplacesById() throws Exception {
		engine.upsert(wine("1", "Merlot", "plum", "France", 90));
		engine.upsert(wine("1", "Syrah", "pepper", "France", 90));

		assertEquals(1, engine.documentCount());
		assertTrue(engine.search(SearchQuery.builder().text("merlot").build(), schema.fieldWeights(), null).isEmpty());
		assertEquals(List.of("1"), ids(engine.search(SearchQuery.builder().text("syrah").build(), schema.fieldWeights(), null)));
	}

	@Test
	public void testBoostsDecideRanking() throws Exception {
		engine.upsert(wine("v", "Merlot", "soft and round", "France", 90));
		engine.upsert(wine("d", "Blend", "mostly merlot", "France", 90));

		SearchQuery query = SearchQuery.builder().text("merlot").build();
		List<MirrorHit> hits = engine.search(query, schema.fieldWeights(), null);
		assertEquals(List.of("v", "d"), ids(hits));
		assertTrue(hits.get(0).score() > hits.get(1).score());

		SearchQuery boosted = SearchQuery.builder().text("merlot").boost("variety", 0.1).boost("description", 10.0).build();
		assertEquals(List.of("d", "v"), ids(engine.search(boosted, schema.weightsFor(boosted), null)));
	}

	@Test
	public void testFilters() throws Exception {
		engine.upsert(wine("1", "Merlot", "plum", "France", 92));
		engine.upsert(wine("2", "Merlot", "plum", "Chile", 88));
		engine.upsert(wine("3", "Merlot", "plum", null, 95.0));

		assertEquals(List.of("1"), ids(engine.search(SearchQuery.builder().text("merlot")
				.filter(Filter.equalTo("country", "FRANCE")).build(), schema.fieldWeights(), null)));
		assertEquals(List.of("1", "3"), ids(engine.search(SearchQuery.builder().text("merlot")
				.filter(Filter.range("points", 90.0, null)).build(), schema.fieldWeights(), null)));
		assertEquals(List.of("2"), ids(engine.search(SearchQuery.builder().text("merlot")
				.filter(Filter.equalTo("points", 88)).build(), schema.fieldWeights(), null)));
	}

	@Test
	public void testUnknownFilterRejected() {
		assertThrows(ValidationException.class, () -> engine.search(SearchQuery.builder().text("merlot")
				.filter(Filter.equalTo("colour", "red")).build(), schema.fieldWeights(), null));
	}

	@Test
	public void testHighlights() throws Exception {
		engine.upsert(wine("1", "Merlot", "This wine is raw, chewy.", "France", 90));

		MirrorHit hit = engine.search(SearchQuery.builder().text("chewy").build(),
				schema.fieldWeights(), HighlightMarkers.DEFAULT).get(0);

		assertEquals("This wine is raw, <mark>chewy</mark>.", hit.highlights().get("description"));
		assertFalse(hit.highlights().containsKey("variety"));
		assertEquals("This wine is raw, chewy.", hit.textFields().get("description"));
		assertEquals("France", hit.attributes().get("country"));
		assertEquals(90.0, ((Number) hit.attributes().get("points")).doubleValue(), 1e-9);
	}

	@Test
	public void testBlankTextBrowsesById() throws Exception {
		engine.upsert(wine("b", "Gamay", "light", "France", 87));
		engine.upsert(wine("a", "Syrah", "smoky", "France", 91));
		engine.upsert(wine("c", "Zinfandel", "jammy", "US", 89));

		List<MirrorHit> hits = engine.search(SearchQuery.builder()
				.filter(Filter.equalTo("country", "France")).build(), schema.fieldWeights(), HighlightMarkers.DEFAULT);

		assertEquals(List.of("a", "b"), ids(hits));
		assertTrue(hits.get(0).highlights().isEmpty());
	}

	@Test
	public void testBulkUpsertReportsRejectedDocuments() throws Exception {
		List<MirrorDocument> documents = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			Object points = i % 4 == 0 ? "not-a-number" : 85 + i;
			documents.add(wine("w" + i, "Riesling", "petrol and lime", "Germany", points));
		}

		MirrorBulkResponse response = engine.bulkUpsert(documents);

		assertEquals(7, response.succeeded());
		assertEquals(List.of("w0", "w4", "w8"), List.copyOf(response.failures().keySet()));
		assertTrue(response.hasFailures());
		assertEquals(7, engine.documentCount());
		assertEquals(7, engine.search(SearchQuery.builder().text("riesling").limit(20).build(), schema.fieldWeights(), null).size());
	}

	@Test
	public void testDelete() throws Exception {
		engine.upsert(wine("1", "Merlot", "plum", "France", 90));
		engine.delete("1");
		engine.delete("missing");

		assertEquals(0, engine.documentCount());
	}

	@Test
	public void testSuggestByEditDistance() throws Exception {
		engine.upsert(wine("1", "Cabernet Sauvignon", "cassis and cedar", "France", 90));
		engine.upsert(wine("2", "Merlot", "plum", "Chile", 88));

		List<String> terms = engine.suggest("cabernay", 5).stream().map(Suggestion::term).collect(Collectors.toList());
		assertTrue(terms.contains("cabernet"));
		assertEquals("merlot", engine.suggest("merlt", 5).get(0).term());
		assertTrue(engine.suggest("", 5).isEmpty());
	}

	@Test
	public void testSuggestFoldsAccentsAndKeepsExactTerm() throws Exception {
		engine.upsert(wine("1", "Syrah", "Côtes du Rhône rosé", "France", 89));

		Suggestion exact = engine.suggest("Rhône", 5).get(0);
		assertEquals("rhone", exact.term());
		assertEquals(1.0, exact.similarity(), 1e-9);
		assertEquals("rhone", engine.suggest("rhôme", 5).get(0).term());
		assertEquals(1, engine.suggest("syrah", 1).size());
	}

	@Test
	public void testReadOnlyEngineSeesCommittedWrites() throws Exception {
		engine.upsert(wine("1", "Merlot", "plum", "France", 90));

		try (LuceneMirrorEngine reader = new LuceneMirrorEngine(directory, schema, textAnalyzer, english, vocabulary, false)) {
			assertEquals(1, reader.documentCount());
			engine.upsert(wine("2", "Malbec", "violet", "Argentina", 91));
			assertEquals(2, reader.documentCount());
			assertEquals(List.of("2"), ids(reader.search(SearchQuery.builder().text("malbec").build(), schema.fieldWeights(), null)));
			assertThrows(IndexUnavailableException.class, () -> reader.upsert(wine("3", "Gamay", "light", "France", 86)));
		}
	}

	@Test
	public void testClosedEngineIsUnavailable() throws Exception {
		engine.close();

		assertThrows(IndexUnavailableException.class, () -> engine.upsert(wine("1", "Merlot", "plum", "France", 90)));
		assertThrows(IndexUnavailableException.class, () -> engine.documentCount());
	}
}
