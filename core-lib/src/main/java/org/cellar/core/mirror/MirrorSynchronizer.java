package org.cellar.core.mirror;

import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.highlight.HighlightMarkers;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.vocabulary.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Keeps the mirror index in step with the record store and queries it.
 *
 * <p>Single-record writes retry with backoff and then park the id in the pending-resync set; they never throw
 * back into the write path. Bulk writes stream in batches and report failures instead of aborting. Queries pass
 * the field boosts on every request since the mirror stores none.</p>
 */
public class MirrorSynchronizer {
	private static final Logger logger = LoggerFactory.getLogger(MirrorSynchronizer.class);

	private final MirrorEngine engine;
	private final MirrorDocumentMapper mapper;
	private final CatalogSchema schema;
	private final RetryPolicy retryPolicy;
	private final int batchSize;
	private final Set<String> pendingResync;

	public MirrorSynchronizer(
			MirrorEngine engine,
			CatalogSchema schema,
			RetryPolicy retryPolicy,
			int batchSize,
			Set<String> pendingResync
	) {
		if (batchSize < 1) {
			throw new IllegalArgumentException("batch size must be at least 1, got " + batchSize);
		}
		this.engine = engine;
		this.mapper = new MirrorDocumentMapper(schema);
		this.schema = schema;
		this.retryPolicy = retryPolicy;
		this.batchSize = batchSize;
		this.pendingResync = pendingResync;
	}

	/**
	 * @return true when the mirror accepted the record, false when it was parked for resync or rejected
	 */
	public boolean upsert(CatalogRecord record) {
		MirrorDocument document = mapper.toDocument(record);
		try {
			runWithRetry("upsert " + record.id(), () -> engine.upsert(document));
			pendingResync.remove(record.id());
			return true;
		} catch (IndexUnavailableException e) {
			pendingResync.add(record.id());
			logger.warn("Mirror upsert of {} gave up after {} attempts, marked for resync: {}",
					record.id(), retryPolicy.maxAttempts(), e.getMessage());
			return false;
		} catch (IllegalArgumentException e) {
			logger.error("Mirror rejected record {}: {}", record.id(), e.getMessage());
			return false;
		}
	}

	public boolean delete(String recordId) {
		try {
			runWithRetry("delete " + recordId, () -> engine.delete(recordId));
			pendingResync.remove(recordId);
			return true;
		} catch (IndexUnavailableException e) {
			pendingResync.add(recordId);
			logger.warn("Mirror delete of {} gave up after {} attempts, marked for resync: {}",
					recordId, retryPolicy.maxAttempts(), e.getMessage());
			return false;
		}
	}

	/**
	 * Streams every record into the mirror in batches. A rejected record or an unreachable engine for one batch is
	 * counted as failed and the stream continues with the next batch.
	 */
	public BulkReindexReport bulkUpsert(Iterator<CatalogRecord> records) {
		int succeeded = 0;
		List<String> failedIds = new ArrayList<>();
		List<MirrorDocument> batch = new ArrayList<>(batchSize);
		int batches = 0;

		while (records.hasNext()) {
			CatalogRecord record = records.next();
			batch.add(mapper.toDocument(record));
			if (batch.size() == batchSize || !records.hasNext()) {
				succeeded += flush(batch, failedIds);
				batches++;
				batch.clear();
			}
		}

		logger.info("Mirror bulk upsert finished: {} succeeded, {} failed in {} batches", succeeded, failedIds.size(), batches);
		return new BulkReindexReport(succeeded, failedIds.size(), failedIds);
	}

	private int flush(List<MirrorDocument> batch, List<String> failedIds) {
		List<MirrorDocument> documents = List.copyOf(batch);
		try {
			MirrorBulkResponse response = withRetry("bulk of " + documents.size(), () -> engine.bulkUpsert(documents));
			for (MirrorDocument document : documents) {
				if (response.failures().containsKey(document.id())) {
					failedIds.add(document.id());
				} else {
					pendingResync.remove(document.id());
				}
			}
			if (response.hasFailures()) {
				response.failures().forEach((id, reason) -> logger.warn("Mirror rejected record {}: {}", id, reason));
			}
			return response.succeeded();
		} catch (IndexUnavailableException e) {
			logger.error("Mirror batch of {} records failed: {}", documents.size(), e.getMessage());
			for (MirrorDocument document : documents) {
				failedIds.add(document.id());
			}
			return 0;
		}
	}

	/**
	 * Replays parked ids. Each id is reloaded; records that no longer exist are deleted from the mirror.
	 *
	 * @return number of ids cleared from the pending set
	 */
	public int resyncPending(Function<String, Optional<CatalogRecord>> loader) {
		int cleared = 0;
		for (String recordId : List.copyOf(pendingResync)) {
			Optional<CatalogRecord> record = loader.apply(recordId);
			boolean synced = record.isPresent() ? upsert(record.get()) : delete(recordId);
			if (synced) {
				cleared++;
			}
		}
		logger.info("Mirror resync cleared {} ids, {} still pending", cleared, pendingResync.size());
		return cleared;
	}

	public Set<String> pendingResync() {
		return Set.copyOf(pendingResync);
	}

	/**
	 * Ranked mirror search. Boosts are the configured tiers with the query's overrides applied.
	 */
	public List<MirrorHit> query(SearchQuery query, HighlightMarkers markers) throws IndexUnavailableException {
		return engine.search(query, schema.weightsFor(query), markers);
	}

	public List<Suggestion> termSuggest(String term, int maxResults) throws IndexUnavailableException {
		return engine.suggest(term, maxResults);
	}

	public long documentCount() throws IndexUnavailableException {
		return engine.documentCount();
	}

	private <T> T withRetry(String operation, MirrorCall<T> call) throws IndexUnavailableException {
		IndexUnavailableException last = null;
		for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
			try {
				return call.execute();
			} catch (IndexUnavailableException e) {
				last = e;
				if (attempt < retryPolicy.maxAttempts()) {
					long delay = retryPolicy.backoffMillis(attempt);
					logger.debug("Mirror {} failed (attempt {}), retrying in {} ms", operation, attempt, delay);
					if (!sleep(delay)) {
						break;
					}
				}
			}
		}
		throw last;
	}

	private void runWithRetry(String operation, MirrorAction action) throws IndexUnavailableException {
		withRetry(operation, () -> {
			action.execute();
			return null;
		});
	}

	private static boolean sleep(long millis) {
		try {
			Thread.sleep(millis);
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	@FunctionalInterface
	private interface MirrorCall<T> {
		T execute() throws IndexUnavailableException;
	}

	@FunctionalInterface
	private interface MirrorAction {
		void execute() throws IndexUnavailableException;
	}
}
