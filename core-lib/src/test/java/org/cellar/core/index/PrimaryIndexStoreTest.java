package org.cellar.core.index;

import org.cellar.core.error.ValidationException;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.model.ScoredRecord;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.query.Filter;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vector.SearchVectorBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PrimaryIndexStoreTest {

	private final CatalogSchema schema = CatalogSchema.parse(
			"variety:A,winery:B,description:C",
			"country:keyword,points:number,price:number");
	private final TextAnalyzer textAnalyzer = new TextAnalyzer();
	private final AnalysisProfile profile = AnalysisProfile.english(AnalysisProfile.defaultStopWords());
	private final SearchVectorBuilder vectorBuilder = new SearchVectorBuilder(textAnalyzer, profile);

	private InMemoryIndexStorage storage;
	private PrimaryIndexStore store;

	@BeforeEach
	public void setUp() {
		storage = new InMemoryIndexStorage();
		store = new PrimaryIndexStore(storage, schema, textAnalyzer, profile);
	}

	private void index(CatalogRecord record) {
		store.index(record.id(), record, vectorBuilder.build(record, schema.fieldWeights()));
	}

	private static List<String> ids(List<ScoredRecord> results) {
		return results.stream().map(ScoredRecord::recordId).collect(Collectors.toList());
	}

	@Test
	public void testVarietyMatchOutranksDescriptionMatch() {
		index(CatalogRecord.builder("a").text("variety", "Cabernet Sauvignon").text("description", "Blended with a little merlot").build());
		index(CatalogRecord.builder("b").text("variety", "Merlot").text("description", "Plum and cocoa").build());
		index(CatalogRecord.builder("c").text("variety", "Riesling").text("description", "Lime zest").build());

		List<ScoredRecord> results = store.query(SearchQuery.builder().text("merlot").build());

		assertEquals(List.of("b", "a"), ids(results));
		assertTrue(results.get(0).score() > results.get(1).score());
	}

	@Test
	public void testScoreFormula() {
		index(CatalogRecord.builder("1").text("variety", "Merlot").text("description", "merlot plum").build());

		double score = store.query(SearchQuery.builder().text("merlot merlot").build()).get(0).score();

		// weight (1.0 + 0.2) x query frequency 2 over 1 + ln(1 + 3 tokens)
		assertEquals(1.2 * 2 / (1 + Math.log(4)), score, 1e-9);
	}

	@Test
	public void testScoreGrowsWithDistinctMatchedTerms() {
		index(CatalogRecord.builder("1").text("description", "ripe plum cherry vanilla oak").build());

		double one = store.query(SearchQuery.builder().text("plum").build()).get(0).score();
		double two = store.query(SearchQuery.builder().text("plum cherry").build()).get(0).score();
		double three = store.query(SearchQuery.builder().text("plum cherry vanilla").build()).get(0).score();

		assertTrue(two > one);
		assertTrue(three > two);
	}

	@Test
	public void testMinimumMatch() {
		index(CatalogRecord.builder("1").text("description", "plum cherry").build());
		index(CatalogRecord.builder("2").text("description", "plum tobacco").build());

		SearchQuery query = SearchQuery.builder().text("plum cherry").minimumMatch(2).build();

		assertEquals(List.of("1"), ids(store.query(query)));
	}

	@Test
	public void testTiesOrderedById() {
		index(CatalogRecord.builder("z").text("variety", "Malbec").build());
		index(CatalogRecord.builder("m").text("variety", "Malbec").build());
		index(CatalogRecord.builder("a").text("variety", "Malbec").build());

		assertEquals(List.of("a", "m", "z"), ids(store.query(SearchQuery.builder().text("malbec").build())));
	}

	@Test
	public void testFilters() {
		index(CatalogRecord.builder("1").text("variety", "Merlot").attribute("country", "France").attribute("points", 92).build());
		index(CatalogRecord.builder("2").text("variety", "Merlot").attribute("country", "Chile").attribute("points", 88).build());
		index(CatalogRecord.builder("3").text("variety", "Merlot").attribute("points", 95).build());

		assertEquals(List.of("1"), ids(store.query(SearchQuery.builder()
				.text("merlot").filter(Filter.equalTo("country", "france")).build())));
		assertEquals(List.of("1", "3"), ids(store.query(SearchQuery.builder()
				.text("merlot").filter(Filter.range("points", 90.0, null)).build())));
		assertEquals(List.of("2"), ids(store.query(SearchQuery.builder()
				.text("merlot").filter(Filter.equalTo("points", 88)).build())));
	}

	@Test
	public void testUnknownFilterFieldRejected() {
		index(CatalogRecord.builder("1").text("variety", "Merlot").build());

		assertThrows(ValidationException.class, () -> store.query(SearchQuery.builder()
				.text("merlot").filter(Filter.equalTo("colour", "red")).build()));
	}

	@Test
	public void testBoostOverrideChangesRanking() {
		index(CatalogRecord.builder("v").text("variety", "Merlot").text("description", "soft").build());
		index(CatalogRecord.builder("d").text("variety", "Blend").text("description", "merlot").build());

		SearchQuery boosted = SearchQuery.builder().text("merlot").boost("variety", 0.1).boost("description", 5.0).build();

		assertEquals(List.of("v", "d"), ids(store.query(SearchQuery.builder().text("merlot").build())));
		assertEquals(List.of("d", "v"), ids(store.query(boosted)));
	}

	@Test
	public void testBlankTextBrowsesFilteredRecords() {
		index(CatalogRecord.builder("2").text("variety", "Syrah").attribute("country", "France").build());
		index(CatalogRecord.builder("1").text("variety", "Gamay").attribute("country", "France").build());
		index(CatalogRecord.builder("3").text("variety", "Zinfandel").attribute("country", "US").build());

		List<ScoredRecord> results = store.query(SearchQuery.builder().filter(Filter.equalTo("country", "France")).build());

		assertEquals(List.of("1", "2"), ids(results));
		assertEquals(0.0, results.get(0).score());
		assertEquals(3, store.query(SearchQuery.builder().text("  ").build()).size());
	}

	@Test
	public void testStopWordOnlyQueryMatchesNothing() {
		index(CatalogRecord.builder("1").text("description", "the best of the vintage").build());

		assertTrue(store.query(SearchQuery.builder().text("the of").build()).isEmpty());
	}

	@Test
	public void testLimit() {
		for (int i = 0; i < 5; i++) {
			index(CatalogRecord.builder("r" + i).text("variety", "Merlot").build());
		}

		assertEquals(List.of("r0", "r1"), ids(store.query(SearchQuery.builder().text("merlot").limit(2).build())));
	}

	@Test
	public void testReindexDropsStalePostings() {
		index(CatalogRecord.builder("1").text("variety", "Merlot").build());
		index(CatalogRecord.builder("1").text("variety", "Pinot Noir").build());

		assertTrue(store.query(SearchQuery.builder().text("merlot").build()).isEmpty());
		assertEquals(List.of("1"), ids(store.query(SearchQuery.builder().text("pinot").build())));
		assertTrue(storage.postings("merlot").isEmpty());
		assertEquals(1, store.getStats().recordsIndexed());
		assertEquals(2, store.getStats().uniqueTerms());
	}

	@Test
	public void testIndexIsIdempotent() {
		CatalogRecord record = CatalogRecord.builder("1").text("variety", "Merlot").text("description", "plum").build();
		index(record);
		List<ScoredRecord> first = store.query(SearchQuery.builder().text("merlot plum").build());
		index(record);

		assertEquals(first, store.query(SearchQuery.builder().text("merlot plum").build()));
		assertEquals(2, store.getStats().uniqueTerms());
	}

	@Test
	public void testRemove() {
		index(CatalogRecord.builder("1").text("variety", "Merlot").build());

		assertTrue(store.remove("1"));
		assertFalse(store.remove("1"));
		assertTrue(store.query(SearchQuery.builder().text("merlot").build()).isEmpty());
		assertTrue(store.find("1").isEmpty());
		assertEquals(0, store.getStats().uniqueTerms());
	}

	@Test
	public void testIdMismatchRejected() {
		CatalogRecord record = CatalogRecord.builder("1").text("variety", "Merlot").build();

		assertThrows(IllegalArgumentException.class,
				() -> store.index("2", record, vectorBuilder.build(record, schema.fieldWeights())));
	}

	@Test
	public void testTermFrequencies() {
		assertEquals(Map.of("plum", 2, "oak", 1), store.termFrequencies("plum, oak and PLUM"));
	}
}
