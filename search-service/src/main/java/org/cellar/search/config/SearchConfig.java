package org.cellar.search.config;

import org.cellar.core.highlight.HighlightMarkers;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.search.model.SearchSource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, overlays environment variables, then command line overrides.
 * {@code DATA_VOLUME_PATH}, when set, overrides {@code mirror.index.path}. Missing required keys fail fast with
 * {@link IllegalStateException}. The catalog, vocabulary and mirror settings must match the Indexing Service.</p>
 */
public record SearchConfig(
    int serverPort,
    int maxResults,
    int defaultLimit,
    SearchSource defaultSource,
    boolean mirrorFallback,
    HighlightMarkers highlightMarkers,
    Hazelcast hazelcast,
    Catalog catalog,
    Vocabulary vocabulary,
    String mirrorIndexPath
) {
    /** Hazelcast cluster the Search Service joins as a client. */
    public record Hazelcast(
        String clusterName,
        int port,
        List<String> members,
        long connectTimeoutMillis,
        String recordMapName,
        String postingsName
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

    /** Suggestion vocabulary database. */
    public record Vocabulary(
        String jdbcUrl,
        String username,
        String password,
        int minWordLength,
        int maxWordLength,
        double minSimilarity
    ) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load() {
        return load(new Properties());
    }

    /**
     * Same as {@link #load()} with {@code overrides} applied last (command line arguments).
     */
    public static SearchConfig load(Properties overrides) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        properties.putAll(overrides);
        return from(properties);
    }

    static SearchConfig from(Properties source) {
        Properties p = new Properties();
        p.putAll(source);
        String volume = trimToNull(p.getProperty("DATA_VOLUME_PATH"));
        if (volume != null) {
            p.setProperty("mirror.index.path", volume);
        }
        return new SearchConfig(
            requireInt(p, "server.port"),
            requireInt(p, "search.max.results"),
            requireInt(p, "search.default.limit"),
            readSource(p),
            requireBoolean(p, "search.mirror.fallback"),
            new HighlightMarkers(requireString(p, "highlight.start.marker"), requireString(p, "highlight.end.marker")),
            readHazelcast(p),
            readCatalog(p),
            readVocabulary(p),
            requireString(p, "mirror.index.path")
        );
    }

    private static SearchSource readSource(Properties p) {
        String value = requireString(p, "search.default.source");
        try {
            return SearchSource.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid search.default.source '" + value + "'. Valid options: primary, mirror", e);
        }
    }

    private static Hazelcast readHazelcast(Properties p) {
        return new Hazelcast(
            requireString(p, "hazelcast.cluster.name"),
            requireInt(p, "hazelcast.port"),
            splitCsv(requireString(p, "CLUSTER_NODES_LIST")),
            requireInt(p, "hazelcast.client.connect.timeout.ms"),
            requireString(p, "hazelcast.map.records.name"),
            requireString(p, "hazelcast.multimap.postings.name")
        );
    }

    private static Catalog readCatalog(Properties p) {
        String filterFields = trimToNull(p.getProperty("catalog.filter.fields"));
        return new Catalog(
            requireString(p, "catalog.text.fields"),
            filterFields == null ? "" : filterFields,
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

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
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

    private static List<String> splitCsv(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
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

    private static boolean requireBoolean(Properties properties, String key) {
        String value = requireString(properties, key).toLowerCase(Locale.ROOT);
        if (!value.equals("true") && !value.equals("false")) {
            throw new IllegalStateException("Invalid boolean for configuration '" + key + "': '" + value + "'");
        }
        return Boolean.parseBoolean(value);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
