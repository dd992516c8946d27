package org.cellar.indexing.service;

import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.index.IndexedRecord;
import org.cellar.core.index.PrimaryIndexStore;
import org.cellar.core.mirror.BulkReindexReport;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.vector.SearchVectorBuilder;
import org.cellar.core.vocabulary.VocabularyEngine;
import org.cellar.indexing.hook.HookOutcome;
import org.cellar.indexing.hook.RecordWriteHooks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;

/**
 * Write-side entry points: the post-write hook, the primary index rebuild and the mirror bulk reindex.
 */
public class IndexingService {
    private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

    private final RecordWriteHooks hooks;
    private final PrimaryIndexStore primaryIndex;
    private final SearchVectorBuilder vectorBuilder;
    private final CatalogSchema schema;
    private final VocabularyEngine vocabulary;
    private final MirrorSynchronizer mirror;

    public IndexingService(
        RecordWriteHooks hooks,
        PrimaryIndexStore primaryIndex,
        SearchVectorBuilder vectorBuilder,
        CatalogSchema schema,
        VocabularyEngine vocabulary,
        MirrorSynchronizer mirror
    ) {
        this.hooks = hooks;
        this.primaryIndex = primaryIndex;
        this.vectorBuilder = vectorBuilder;
        this.schema = schema;
        this.vocabulary = vocabulary;
        this.mirror = mirror;
    }

    public HookOutcome onRecordSaved(CatalogRecord record) {
        HookOutcome outcome = hooks.fireSaved(record);
        logger.debug("Record {} saved, failed callbacks: {}", record.id(), outcome.failedCallbacks());
        return outcome;
    }

    public HookOutcome onRecordDeleted(String recordId) {
        HookOutcome outcome = hooks.fireDeleted(recordId);
        logger.debug("Record {} deleted, failed callbacks: {}", recordId, outcome.failedCallbacks());
        return outcome;
    }

    /**
     * Streams the given records into the mirror.
     */
    public BulkReindexReport reindexMirror(Iterator<CatalogRecord> records) {
        logger.info("Starting mirror bulk reindex...");
        return mirror.bulkUpsert(records);
    }

    /**
     * Streams every record held by the primary index into the mirror.
     */
    public BulkReindexReport reindexMirrorFromPrimary() {
        return reindexMirror(primaryIndex.records());
    }

    /**
     * Replays mirror writes that gave up earlier, reading current record state from the primary index.
     */
    public int resyncMirror() {
        return mirror.resyncPending(id -> primaryIndex.find(id).map(IndexedRecord::record));
    }

    /**
     * Clears the primary index and indexes every given record again, vocabulary included. The mirror is left
     * alone.
     */
    public int rebuildPrimary(Iterator<CatalogRecord> records) {
        logger.info("Starting full primary index rebuild...");
        primaryIndex.clear();

        int successCount = 0;
        while (records.hasNext()) {
            CatalogRecord record = records.next();
            try {
                primaryIndex.index(record.id(), record, vectorBuilder.build(record, schema.fieldWeights()));
                vocabulary.ingest(record);
                successCount++;
            } catch (IOException | RuntimeException e) {
                logger.error("Failed to index record {}: {}", record.id(), e.getMessage(), e);
            }
        }

        logger.info("Primary index rebuild complete: {} records succeeded.", successCount);
        return successCount;
    }

    public boolean isPrimaryIndexEmpty() {
        return primaryIndex.isEmpty();
    }

    public IndexStats getStats() {
        PrimaryIndexStore.IndexStats primary = primaryIndex.getStats();

        int vocabularySize;
        try {
            vocabularySize = vocabulary.size();
        } catch (IOException e) {
            logger.warn("Vocabulary size unavailable: {}", e.getMessage());
            vocabularySize = -1;
        }

        long mirrorDocuments;
        try {
            mirrorDocuments = mirror.documentCount();
        } catch (IndexUnavailableException e) {
            logger.warn("Mirror document count unavailable: {}", e.getMessage());
            mirrorDocuments = -1;
        }

        return new IndexStats(primary.recordsIndexed(), primary.uniqueTerms(), vocabularySize, mirrorDocuments,
            mirror.pendingResync().size());
    }

    /**
     * Counts are -1 where the backing store could not be reached.
     */
    public record IndexStats(int recordsIndexed, int uniqueTerms, int vocabularySize, long mirrorDocuments, int pendingResync) {}
}
