package org.cellar.indexing.config;

import org.cellar.core.query.CatalogSchema;
import org.cellar.core.text.AnalysisProfile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Typed configuration for the Indexing Service.
 *
 * <p>Loads {@code application.properties}, overlays environment variables, then command line overrides. Some
 * convenience normalization is applied:
 * <ul>
 *   <li>If {@code DATA_VOLUME_PATH} is set, it overrides {@code mirror.index.path}.</li>
 *   <li>If {@code activemq.broker.url} is blank/missing, it is derived from {@code BROKER_URL} or
 *   {@code MASTER_NODE_IP}; this is only required when {@code mirror.update.mode=jms}.</li>
 * </ul>
 * Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record IndexingConfig(
    int serverPort,
    Hazelcast hazelcast,
    Catalog catalog,
    Vocabulary vocabulary,
    Mirror mirror,
    ActiveMq activeMq
) {
    /** Hazelcast cluster and data-structure settings used by the Indexing Service. */
    public record Hazelcast(
        String clusterName,
        int port,
        List<Integer> memberPorts,
        int backupCount,
        int asyncBackupCount,
        String currentNodeIp,
        List<String> members,
        String recordMapName,
        String postingsName,
        String pendingResyncName
    ) {}

    /** Searchable fields, filterable attributes and stop words. */
    public record Catalog(String textFields, String filterFields, String stopWords) {
        public CatalogSchema schema() {
            return CatalogSchema.parse(textFields, filterFields);
        }

        public Set<String> stopWordSet() {
            return stopWords == null ? AnalysisProfile.defaultStopWords() : AnalysisProfile.parseStopWords(stopWords);
        }
    }

    /** Suggestion vocabulary database and word filters. */
    public record Vocabulary(
        String jdbcUrl,
        String username,
        String password,
        int minWordLength,
        int maxWordLength,
        double minSimilarity
    ) {}

    /** Mirror index location, write retries and how updates reach it. */
    public record Mirror(
        String indexPath,
        int batchSize,
        int maxAttempts,
        long initialBackoffMillis,
        long maxBackoffMillis,
        UpdateMode updateMode,
        int workerThreads
    ) {}

    /** ActiveMQ connectivity settings used for queued mirror updates. */
    public record ActiveMq(String brokerUrl, String queueName) {}

    public enum UpdateMode {
        DIRECT,
        EXECUTOR,
        JMS;

        static UpdateMode parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid mirror.update.mode '" + value + "'. Valid options: direct, executor, jms", e);
            }
        }
    }

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link IndexingConfig}
     */
    public static IndexingConfig load() {
        return load(new Properties());
    }

    /**
     * Same as {@link #load()} with {@code overrides} applied last (command line arguments).
     */
    public static IndexingConfig load(Properties overrides) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        properties.putAll(overrides);
        return from(properties);
    }

    static IndexingConfig from(Properties source) {
        Properties properties = new Properties();
        properties.putAll(source);
        normalizeIndexPath(properties);
        Mirror mirror = readMirror(properties);
        if (mirror.updateMode() == UpdateMode.JMS) {
            ensureBrokerUrl(properties);
        }
        return new IndexingConfig(
            requireInt(properties, "server.port"),
            readHazelcast(properties),
            readCatalog(properties),
            readVocabulary(properties),
            mirror,
            readActiveMq(properties)
        );
    }

    private static Hazelcast readHazelcast(Properties p) {
        return new Hazelcast(
            requireString(p, "hazelcast.cluster.name"),
            requireInt(p, "hazelcast.port"),
            splitCsvInts(p.getProperty("hazelcast.member.ports"), List.of(5701, 5702)),
            requireInt(p, "hazelcast.backup.count"),
            requireInt(p, "hazelcast.async.backup.count"),
            requireString(p, "CURRENT_NODE_IP"),
            splitCsv(requireString(p, "CLUSTER_NODES_LIST")),
            requireString(p, "hazelcast.map.records.name"),
            requireString(p, "hazelcast.multimap.postings.name"),
            requireString(p, "hazelcast.set.pending.name")
        );
    }

    private static Catalog readCatalog(Properties p) {
        return new Catalog(
            requireString(p, "catalog.text.fields"),
            trimToNull(p.getProperty("catalog.filter.fields")) == null ? "" : p.getProperty("catalog.filter.fields").trim(),
            trimToNull(p.getProperty("catalog.stop.words"))
        );
    }

    private static Vocabulary readVocabulary(Properties p) {
        return new Vocabulary(
            requireString(p, "vocabulary.jdbc.url"),
            trimToNull(p.getProperty("vocabulary.jdbc.username")),
            trimToNull(p.getProperty("vocabulary.jdbc.password")),
            requireInt(p, "vocabulary.min.word.length"),
            requireInt(p, "vocabulary.max.word.length"),
            requireDouble(p, "suggest.min.similarity")
        );
    }

    private static Mirror readMirror(Properties p) {
        return new Mirror(
            requireString(p, "mirror.index.path"),
            requireInt(p, "mirror.batch.size"),
            requireInt(p, "mirror.retry.max.attempts"),
            requireInt(p, "mirror.retry.initial.backoff.ms"),
            requireInt(p, "mirror.retry.max.backoff.ms"),
            UpdateMode.parse(requireString(p, "mirror.update.mode")),
            requireInt(p, "mirror.worker.threads")
        );
    }

    private static ActiveMq readActiveMq(Properties p) {
        return new ActiveMq(trimToNull(p.getProperty("activemq.broker.url")), requireString(p, "activemq.queue.name"));
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = IndexingConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static void normalizeIndexPath(Properties properties) {
        String volume = trimToNull(properties.getProperty("DATA_VOLUME_PATH"));
        if (volume != null) {
            properties.setProperty("mirror.index.path", volume);
        }
    }

    private static void ensureBrokerUrl(Properties properties) {
        String brokerUrl = trimToNull(properties.getProperty("activemq.broker.url"));
        if (brokerUrl != null) {
            return;
        }

        String brokerEnv = trimToNull(properties.getProperty("BROKER_URL"));
        if (brokerEnv != null) {
            properties.setProperty("activemq.broker.url", brokerEnv);
            return;
        }

        String masterIp = requireString(properties, "MASTER_NODE_IP");
        properties.setProperty("activemq.broker.url", "tcp://" + masterIp + ":61616");
    }

    private static List<String> splitCsv(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static List<Integer> splitCsvInts(String csv, List<Integer> defaultValue) {
        String trimmed = trimToNull(csv);
        if (trimmed == null) {
            return defaultValue;
        }

        List<Integer> parsed = Arrays.stream(trimmed.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(IndexingConfig::parsePort)
            .toList();

        return parsed.isEmpty() ? defaultValue : parsed;
    }

    private static int parsePort(String value) {
        try {
            int port = Integer.parseInt(value);
            if (port <= 0 || port > 65535) {
                throw new IllegalStateException("Port out of range in hazelcast.member.ports: " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer port in hazelcast.member.ports: '" + value + "'", e);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static double requireDouble(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
