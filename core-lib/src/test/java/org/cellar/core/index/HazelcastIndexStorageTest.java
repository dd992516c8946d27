package org.cellar.core.index;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.model.ScoredRecord;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.query.Filter;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vector.SearchVectorBuilder;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class HazelcastIndexStorageTest {

	private static HazelcastInstance hazelcast;

	@BeforeAll
	public static void startMember() {
		Config config = new Config();
		config.setClusterName("cellar-test-" + UUID.randomUUID());
		config.setProperty("hazelcast.logging.type", "slf4j");
		config.setProperty("hazelcast.phone.home.enabled", "false");
		config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
		config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
		hazelcast = Hazelcast.newHazelcastInstance(config);
	}

	@AfterAll
	public static void stopMember() {
		hazelcast.shutdown();
	}

	@Test
	public void testSharedIndexAcrossStoreInstances() {
		CatalogSchema schema = CatalogSchema.parse("variety:A,description:C", "country:keyword");
		TextAnalyzer textAnalyzer = new TextAnalyzer();
		AnalysisProfile profile = AnalysisProfile.english(AnalysisProfile.defaultStopWords());
		SearchVectorBuilder vectors = new SearchVectorBuilder(textAnalyzer, profile);

		PrimaryIndexStore writer = new PrimaryIndexStore(
				new HazelcastIndexStorage(hazelcast, "records", "postings"), schema, textAnalyzer, profile);
		PrimaryIndexStore reader = new PrimaryIndexStore(
				new HazelcastIndexStorage(hazelcast, "records", "postings"), schema, textAnalyzer, profile);

		CatalogRecord merlot = CatalogRecord.builder("1").text("variety", "Merlot").attribute("country", "France").build();
		CatalogRecord blend = CatalogRecord.builder("2").text("variety", "Blend").text("description", "merlot").attribute("country", "US").build();
		writer.index("1", merlot, vectors.build(merlot, schema.fieldWeights()));
		writer.index("2", blend, vectors.build(blend, schema.fieldWeights()));

		List<ScoredRecord> results = reader.query(SearchQuery.builder().text("merlot").build());
		assertEquals("1", results.get(0).recordId());
		assertEquals(2, results.size());
		assertEquals(1, reader.query(SearchQuery.builder().text("merlot").filter(Filter.equalTo("country", "us")).build()).size());

		CatalogRecord updated = CatalogRecord.builder("1").text("variety", "Syrah").build();
		writer.index("1", updated, vectors.build(updated, schema.fieldWeights()));
		assertEquals(List.of("2"), reader.query(SearchQuery.builder().text("merlot").build()).stream().map(ScoredRecord::recordId).toList());

		assertTrue(writer.remove("2"));
		assertEquals(1, reader.getStats().recordsIndexed());
		assertEquals(merlot.id(), reader.find("1").orElseThrow().id());
	}
}
