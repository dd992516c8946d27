package org.cellar.indexing.config;

import org.cellar.core.query.AttributeType;
import org.cellar.core.query.CatalogSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingConfigTest {

	private static Properties baseProperties() {
		Properties p = new Properties();
		p.setProperty("server.port", "7002");
		p.setProperty("hazelcast.cluster.name", "test-cluster");
		p.setProperty("hazelcast.port", "5701");
		p.setProperty("hazelcast.member.ports", "5701, 5703");
		p.setProperty("hazelcast.backup.count", "1");
		p.setProperty("hazelcast.async.backup.count", "0");
		p.setProperty("hazelcast.map.records.name", "records");
		p.setProperty("hazelcast.multimap.postings.name", "postings");
		p.setProperty("hazelcast.set.pending.name", "pending");
		p.setProperty("CURRENT_NODE_IP", "10.0.0.5");
		p.setProperty("CLUSTER_NODES_LIST", "10.0.0.5, 10.0.0.6,");
		p.setProperty("catalog.text.fields", "variety:A,description:C");
		p.setProperty("catalog.filter.fields", "country:keyword,points:number");
		p.setProperty("catalog.stop.words", "");
		p.setProperty("vocabulary.jdbc.url", "jdbc:sqlite::memory:");
		p.setProperty("vocabulary.min.word.length", "3");
		p.setProperty("vocabulary.max.word.length", "50");
		p.setProperty("suggest.min.similarity", "0.3");
		p.setProperty("mirror.index.path", "/tmp/mirror");
		p.setProperty("mirror.batch.size", "500");
		p.setProperty("mirror.retry.max.attempts", "3");
		p.setProperty("mirror.retry.initial.backoff.ms", "200");
		p.setProperty("mirror.retry.max.backoff.ms", "2000");
		p.setProperty("mirror.update.mode", "executor");
		p.setProperty("mirror.worker.threads", "1");
		p.setProperty("activemq.queue.name", "mirror-updates");
		return p;
	}

	@Test
	public void testReadsTypedSections() {
		IndexingConfig config = IndexingConfig.from(baseProperties());

		assertEquals(7002, config.serverPort());
		assertEquals(List.of(5701, 5703), config.hazelcast().memberPorts());
		assertEquals(List.of("10.0.0.5", "10.0.0.6"), config.hazelcast().members());
		assertEquals(IndexingConfig.UpdateMode.EXECUTOR, config.mirror().updateMode());
		assertNull(config.vocabulary().username());
		assertNull(config.activeMq().brokerUrl());
		assertEquals(0.3, config.vocabulary().minSimilarity(), 1e-9);

		CatalogSchema schema = config.catalog().schema();
		assertEquals(AttributeType.NUMBER, schema.filterFields().get("points"));
		assertTrue(config.catalog().stopWordSet().contains("the"));
	}

	@Test
	public void testMissingRequiredKeyFailsFast() {
		Properties p = baseProperties();
		p.remove("mirror.batch.size");

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> IndexingConfig.from(p));
		assertTrue(e.getMessage().contains("mirror.batch.size"));
	}

	@Test
	public void testInvalidValuesFailFast() {
		Properties badMode = baseProperties();
		badMode.setProperty("mirror.update.mode", "kafka");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(badMode));

		Properties badPort = baseProperties();
		badPort.setProperty("hazelcast.member.ports", "5701,70000");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(badPort));
	}

	@Test
	public void testDataVolumeOverridesIndexPath() {
		Properties p = baseProperties();
		p.setProperty("DATA_VOLUME_PATH", "/data/mirror");

		assertEquals("/data/mirror", IndexingConfig.from(p).mirror().indexPath());
	}

	@Test
	public void testJmsModeDerivesBrokerUrl() {
		Properties p = baseProperties();
		p.setProperty("mirror.update.mode", "jms");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(p));

		p.setProperty("MASTER_NODE_IP", "10.0.0.1");
		assertEquals("tcp://10.0.0.1:61616", IndexingConfig.from(p).activeMq().brokerUrl());
		assertNull(p.getProperty("activemq.broker.url"));

		p.setProperty("BROKER_URL", "tcp://broker:61617");
		assertEquals("tcp://broker:61617", IndexingConfig.from(p).activeMq().brokerUrl());
	}
}
