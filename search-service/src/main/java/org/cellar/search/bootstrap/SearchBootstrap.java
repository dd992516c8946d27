package org.cellar.search.bootstrap;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Properties;

import org.apache.lucene.store.FSDirectory;
import org.cellar.core.highlight.Highlighter;
import org.cellar.core.index.HazelcastIndexStorage;
import org.cellar.core.index.PrimaryIndexStore;
import org.cellar.core.mirror.LuceneMirrorEngine;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.cellar.core.mirror.RetryPolicy;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vocabulary.JdbcVocabularyStore;
import org.cellar.core.vocabulary.VocabularyEngine;
import org.cellar.core.vocabulary.VocabularyStore;
import org.cellar.search.config.SearchConfig;
import org.cellar.search.controller.SearchController;
import org.cellar.search.hazelcast.HazelcastClientConfigFactory;
import org.cellar.search.service.SearchService;
import org.cellar.search.service.SuggestionService;
import org.cellar.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hazelcast.client.HazelcastClient;
import com.hazelcast.core.HazelcastInstance;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, connects to the Hazelcast cluster as a client, opens the vocabulary database and a
 * read-only view of the mirror index, starts the HTTP API and registers a JVM shutdown hook.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run(Properties overrides) {
        try {
            start(overrides);
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start(Properties overrides) throws IOException, SQLException {
        SearchConfig cfg = SearchConfig.load(overrides);
        CatalogSchema schema = cfg.catalog().schema();
        logger.info("Catalog schema: {}", schema);

        TextAnalyzer textAnalyzer = new TextAnalyzer();
        AnalysisProfile english = AnalysisProfile.english(cfg.catalog().stopWordSet());
        AnalysisProfile vocabularyProfile = AnalysisProfile.vocabulary(cfg.catalog().stopWordSet());

        HazelcastInstance hz = HazelcastClient.newHazelcastClient(HazelcastClientConfigFactory.build(cfg.hazelcast()));
        logger.info("Connected to Hazelcast cluster '{}' as a client", cfg.hazelcast().clusterName());
        PrimaryIndexStore primaryIndex = new PrimaryIndexStore(
            new HazelcastIndexStorage(hz, cfg.hazelcast().recordMapName(), cfg.hazelcast().postingsName()),
            schema, textAnalyzer, english);

        SearchConfig.Vocabulary v = cfg.vocabulary();
        logger.info("  Vocabulary: {}", v.jdbcUrl());
        VocabularyStore vocabularyStore = new JdbcVocabularyStore(v.jdbcUrl(), v.username(), v.password());
        VocabularyEngine vocabulary = new VocabularyEngine(vocabularyStore, textAnalyzer, vocabularyProfile,
            schema.textFields().keySet(), v.minWordLength(), v.maxWordLength(), v.minSimilarity());

        Path mirrorPath = Paths.get(cfg.mirrorIndexPath());
        logger.info("  Mirror index: {} (read-only)", mirrorPath.toAbsolutePath());
        LuceneMirrorEngine mirrorEngine = new LuceneMirrorEngine(
            FSDirectory.open(mirrorPath), schema, textAnalyzer, english, vocabularyProfile, false);
        // reads only; pending resync is tracked by the Indexing Service
        MirrorSynchronizer mirror = new MirrorSynchronizer(mirrorEngine, schema, RetryPolicy.none(), 1, new HashSet<>());

        SearchService searchService = new SearchService(primaryIndex, mirror, schema,
            new Highlighter(textAnalyzer, english), cfg.highlightMarkers(), cfg.maxResults(), cfg.mirrorFallback());
        SuggestionService suggestionService = new SuggestionService(vocabulary, mirror, cfg.maxResults(), cfg.mirrorFallback());
        SearchController controller = new SearchController(searchService, suggestionService, schema,
            cfg.defaultLimit(), cfg.maxResults(), cfg.defaultSource());

        Javalin app = SearchHttpServer.start(cfg.serverPort(), controller);
        addShutdownHook(new Resources(hz, mirrorEngine, vocabularyStore, app));
        logger.info("Search Service started on port {} (default source: {}, mirror fallback: {})",
            cfg.serverPort(), cfg.defaultSource(), cfg.mirrorFallback());
    }

    private static void addShutdownHook(Resources resources) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(resources)));
    }

    private static void shutdown(Resources r) {
        logger.info("Shutting down Search Service...");
        r.app().stop();
        try {
            r.mirrorEngine().close();
        } catch (IOException e) {
            logger.error("Error closing mirror index", e);
        }
        try {
            r.vocabularyStore().close();
        } catch (IOException e) {
            logger.error("Error closing vocabulary database", e);
        }
        r.hz().shutdown();
        logger.info("Search Service stopped.");
    }

    private record Resources(
        HazelcastInstance hz,
        LuceneMirrorEngine mirrorEngine,
        VocabularyStore vocabularyStore,
        Javalin app
    ) {}
}
