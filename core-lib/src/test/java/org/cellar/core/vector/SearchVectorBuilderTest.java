package org.cellar.core.vector;

import org.cellar.core.model.CatalogRecord;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SearchVectorBuilderTest {

	private final SearchVectorBuilder builder = new SearchVectorBuilder(
			new TextAnalyzer(), AnalysisProfile.english(AnalysisProfile.defaultStopWords()));

	private static FieldWeights weights() {
		Map<String, WeightTier> tiers = new LinkedHashMap<>();
		tiers.put("variety", WeightTier.A);
		tiers.put("winery", WeightTier.B);
		tiers.put("description", WeightTier.C);
		return FieldWeights.fromTiers(tiers);
	}

	@Test
	public void testTermWeightSumsContributingFields() {
		CatalogRecord record = CatalogRecord.builder("1")
				.text("variety", "Merlot")
				.text("winery", "Merlot House")
				.text("description", "Soft merlot with plum")
				.build();

		SearchVector vector = builder.build(record, weights());

		SearchVector.TermEntry merlot = vector.entry("merlot");
		assertEquals(1.0 + 0.4 + 0.2, merlot.weight(), 1e-9);
		assertEquals(List.of("variety", "winery", "description"), merlot.fields());
		assertEquals(3, merlot.frequency());
		assertEquals(0.2, vector.entry("plum").weight(), 1e-9);
		assertEquals(0.4, vector.entry("hous").weight(), 1e-9);
	}

	@Test
	public void testPositionsUniqueAcrossFields() {
		CatalogRecord record = CatalogRecord.builder("1")
				.text("variety", "Pinot Noir")
				.text("winery", "Domaine Noir")
				.text("description", "pinot from the hills")
				.build();

		SearchVector vector = builder.build(record, weights());

		Set<Integer> seen = new HashSet<>();
		int total = 0;
		for (SearchVector.TermEntry entry : vector.terms().values()) {
			seen.addAll(entry.positions());
			total += entry.positions().size();
		}
		assertEquals(total, seen.size());
		assertEquals(total, vector.length());
	}

	@Test
	public void testRebuildIsDeterministic() {
		CatalogRecord record = CatalogRecord.builder("7")
				.text("variety", "Riesling")
				.text("description", "Petrol, lime and green apple")
				.build();

		assertEquals(builder.build(record, weights()), builder.build(record, weights()));
	}

	@Test
	public void testMissingFieldsIgnored() {
		CatalogRecord record = CatalogRecord.builder("2").text("variety", "Syrah").build();

		SearchVector vector = builder.build(record, weights());

		assertEquals(Set.of("syrah"), vector.terms().keySet());
		assertEquals(1, vector.length());
	}

	@Test
	public void testRecordWithoutTextGivesEmptyVector() {
		CatalogRecord record = CatalogRecord.builder("3").attribute("points", 90).build();

		SearchVector vector = builder.build(record, weights());

		assertTrue(vector.isEmpty());
		assertEquals(0, vector.length());
	}

	@Test
	public void testBoostOverridesReplaceTierWeight() {
		CatalogRecord record = CatalogRecord.builder("4")
				.text("variety", "Malbec")
				.text("description", "malbec from Mendoza")
				.build();

		SearchVector vector = builder.build(record, weights());
		FieldWeights boosted = weights().withOverrides(Map.of("description", 2.0));

		assertEquals(1.2, vector.weight("malbec", weights()), 1e-9);
		assertEquals(3.0, vector.weight("malbec", boosted), 1e-9);
	}
}
