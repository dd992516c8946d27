package org.cellar.indexing.bootstrap;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.Properties;

import org.apache.lucene.store.FSDirectory;
import org.cellar.core.index.HazelcastIndexStorage;
import org.cellar.core.index.PrimaryIndexStore;
import org.cellar.core.mirror.LuceneMirrorEngine;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.cellar.core.mirror.RetryPolicy;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vector.SearchVectorBuilder;
import org.cellar.core.vocabulary.JdbcVocabularyStore;
import org.cellar.core.vocabulary.VocabularyEngine;
import org.cellar.core.vocabulary.VocabularyStore;
import org.cellar.indexing.config.IndexingConfig;
import org.cellar.indexing.hazelcast.HazelcastConfigFactory;
import org.cellar.indexing.hook.MirrorCallback;
import org.cellar.indexing.hook.PrimaryIndexCallback;
import org.cellar.indexing.hook.RecordWriteHooks;
import org.cellar.indexing.hook.VocabularyCallback;
import org.cellar.indexing.mirror.DirectMirrorUpdateQueue;
import org.cellar.indexing.mirror.ExecutorMirrorUpdateQueue;
import org.cellar.indexing.mirror.JmsMirrorUpdateQueue;
import org.cellar.indexing.mirror.MirrorUpdateListener;
import org.cellar.indexing.mirror.MirrorUpdateQueue;
import org.cellar.indexing.service.IndexingService;
import org.cellar.indexing.web.IndexingHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Indexing Service.
 *
 * <p>Loads configuration, starts Hazelcast, opens the vocabulary database and the mirror index, registers the
 * post-write callbacks in order (primary index, vocabulary, mirror), starts the HTTP server and registers a JVM
 * shutdown hook for clean termination.</p>
 */
public final class IndexingBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(IndexingBootstrap.class);

    private IndexingBootstrap() {}

    /**
     * Starts the Indexing Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run(Properties overrides) {
        try {
            start(overrides);
        } catch (Exception e) {
            logger.error("Failed to start Indexing Service", e);
            System.exit(1);
        }
    }

    private static void start(Properties overrides) throws IOException, SQLException {
        IndexingConfig cfg = IndexingConfig.load(overrides);
        CatalogSchema schema = cfg.catalog().schema();
        logger.info("Catalog schema: {}", schema);

        TextAnalyzer textAnalyzer = new TextAnalyzer();
        AnalysisProfile english = AnalysisProfile.english(cfg.catalog().stopWordSet());
        AnalysisProfile vocabularyProfile = AnalysisProfile.vocabulary(cfg.catalog().stopWordSet());

        HazelcastInstance hz = startHazelcast(cfg);
        PrimaryIndexStore primaryIndex = new PrimaryIndexStore(
            new HazelcastIndexStorage(hz, cfg.hazelcast().recordMapName(), cfg.hazelcast().postingsName()),
            schema, textAnalyzer, english);

        VocabularyStore vocabularyStore = openVocabulary(cfg.vocabulary());
        VocabularyEngine vocabulary = new VocabularyEngine(vocabularyStore, textAnalyzer, vocabularyProfile,
            schema.textFields().keySet(), cfg.vocabulary().minWordLength(), cfg.vocabulary().maxWordLength(),
            cfg.vocabulary().minSimilarity());

        LuceneMirrorEngine mirrorEngine = openMirror(cfg.mirror(), schema, textAnalyzer, english, vocabularyProfile);
        IndexingConfig.Mirror m = cfg.mirror();
        MirrorSynchronizer mirror = new MirrorSynchronizer(mirrorEngine, schema,
            new RetryPolicy(m.maxAttempts(), m.initialBackoffMillis(), m.maxBackoffMillis()),
            m.batchSize(), hz.getSet(cfg.hazelcast().pendingResyncName()));

        MirrorUpdateQueue queue = createQueue(cfg, mirror);
        MirrorUpdateListener listener = startListener(cfg, mirror);

        SearchVectorBuilder vectorBuilder = new SearchVectorBuilder(textAnalyzer, english);
        RecordWriteHooks hooks = new RecordWriteHooks()
            .register(new PrimaryIndexCallback(vectorBuilder, primaryIndex, schema))
            .register(new VocabularyCallback(vocabulary))
            .register(new MirrorCallback(queue));

        IndexingService service = new IndexingService(hooks, primaryIndex, vectorBuilder, schema, vocabulary, mirror);
        runStartupConsistencyCheck(service);

        Javalin app = IndexingHttpServer.start(cfg.serverPort(), service);
        addShutdownHook(new Resources(hz, listener, queue, mirrorEngine, vocabularyStore, app));
        logger.info("Indexing Service started on port {} (mirror updates: {})", cfg.serverPort(), m.updateMode());
    }

    private static void runStartupConsistencyCheck(IndexingService service) {
        IndexingService.IndexStats stats = service.getStats();
        if (stats.pendingResync() > 0) {
            logger.warn("{} mirror updates are pending from a previous run, replaying them...", stats.pendingResync());
            int cleared = service.resyncMirror();
            logger.info("Startup resync cleared {} ids.", cleared);
        }
        if (service.isPrimaryIndexEmpty()) {
            logger.warn("Primary index is empty. POST the catalog to /index/rebuild to populate it.");
        }
    }

    private static HazelcastInstance startHazelcast(IndexingConfig cfg) {
        var config = HazelcastConfigFactory.build(cfg.hazelcast());
        return Hazelcast.newHazelcastInstance(config);
    }

    private static VocabularyStore openVocabulary(IndexingConfig.Vocabulary v) throws SQLException {
        String url = v.jdbcUrl();
        if (url.startsWith("jdbc:sqlite:") && !url.contains(":memory:")) {
            Path parent = Paths.get(url.substring("jdbc:sqlite:".length())).toAbsolutePath().getParent();
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                logger.warn("Failed to create vocabulary directory {}", parent, e);
            }
        }
        logger.info("  Vocabulary: {}", url);
        return new JdbcVocabularyStore(url, v.username(), v.password());
    }

    private static LuceneMirrorEngine openMirror(
        IndexingConfig.Mirror m,
        CatalogSchema schema,
        TextAnalyzer textAnalyzer,
        AnalysisProfile english,
        AnalysisProfile vocabularyProfile
    ) throws IOException {
        Path path = Paths.get(m.indexPath());
        Files.createDirectories(path);
        logger.info("  Mirror index: {}", path.toAbsolutePath());
        return new LuceneMirrorEngine(FSDirectory.open(path), schema, textAnalyzer, english, vocabularyProfile, true);
    }

    private static MirrorUpdateQueue createQueue(IndexingConfig cfg, MirrorSynchronizer mirror) {
        return switch (cfg.mirror().updateMode()) {
            case DIRECT -> new DirectMirrorUpdateQueue(mirror);
            case EXECUTOR -> new ExecutorMirrorUpdateQueue(mirror, cfg.mirror().workerThreads());
            case JMS -> new JmsMirrorUpdateQueue(cfg.activeMq().brokerUrl(), cfg.activeMq().queueName(),
                new DirectMirrorUpdateQueue(mirror));
        };
    }

    private static MirrorUpdateListener startListener(IndexingConfig cfg, MirrorSynchronizer mirror) {
        if (cfg.mirror().updateMode() != IndexingConfig.UpdateMode.JMS) {
            return null;
        }
        MirrorUpdateListener listener = new MirrorUpdateListener(
            cfg.activeMq().brokerUrl(),
            cfg.activeMq().queueName(),
            mirror
        );
        listener.start();
        return listener;
    }

    private static void addShutdownHook(Resources resources) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(resources)));
    }

    private static void shutdown(Resources r) {
        logger.info("Shutting down Indexing Service...");
        r.app().stop();
        if (r.listener() != null) {
            r.listener().stop();
        }
        r.queue().close();
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
        logger.info("Indexing Service stopped.");
    }

    private record Resources(
        HazelcastInstance hz,
        MirrorUpdateListener listener,
        MirrorUpdateQueue queue,
        LuceneMirrorEngine mirrorEngine,
        VocabularyStore vocabularyStore,
        Javalin app
    ) {}
}
