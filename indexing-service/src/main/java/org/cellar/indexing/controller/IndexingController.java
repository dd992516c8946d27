package org.cellar.indexing.controller;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.cellar.core.error.ValidationException;
import org.cellar.core.mirror.BulkReindexReport;
import org.cellar.core.model.CatalogRecord;
import org.cellar.indexing.hook.HookOutcome;
import org.cellar.indexing.io.NdjsonRecordReader;
import org.cellar.indexing.model.IndexResponse;
import org.cellar.indexing.model.IndexStatusResponse;
import org.cellar.indexing.model.RecordPayload;
import org.cellar.indexing.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

public class IndexingController {
	private static final Logger logger = LoggerFactory.getLogger(IndexingController.class);
	private static final Gson gson = new Gson();
	private final IndexingService indexingService;

	public IndexingController(IndexingService indexingService) {
		this.indexingService = indexingService;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.post("/records", this::handleRecordSaved);

		app.delete("/records/{record_id}", this::handleRecordDeleted);

		app.post("/index/rebuild", this::handleIndexRebuild);

		app.post("/mirror/reindex", this::handleMirrorReindex);

		app.post("/mirror/resync", this::handleMirrorResync);

		app.get("/index/status", this::handleIndexStatus);

		logger.info("Indexing routes registered");
	}

	/**
	 * GET /health
	 */
	void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "indexing-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());

		try {
			IndexingService.IndexStats stats = indexingService.getStats();
			health.put("records_indexed", stats.recordsIndexed());
			health.put("unique_terms", stats.uniqueTerms());
			health.put("mirror_documents", stats.mirrorDocuments());
		} catch (RuntimeException e) {
			health.put("records_indexed", "error");
			logger.error("Error getting stats for health check", e);
		}

		ctx.result(gson.toJson(health));
	}

	/**
	 * POST /records
	 * Post-write hook for a saved record; body is one record as JSON
	 */
	void handleRecordSaved(Context ctx) {
		CatalogRecord record;
		try {
			RecordPayload payload = gson.fromJson(ctx.body(), RecordPayload.class);
			if (payload == null) {
				throw new ValidationException("Request body is empty");
			}
			record = payload.toRecord();
		} catch (JsonParseException | ValidationException e) {
			ctx.status(400).result(gson.toJson(IndexResponse.failed(null, e.getMessage())));
			logger.warn("Rejected record payload: {}", e.getMessage());
			return;
		}

		HookOutcome outcome = indexingService.onRecordSaved(record);
		ctx.status(200).result(gson.toJson(IndexResponse.of("indexed", outcome)));
		logger.info("Indexed record {} ({} failed callbacks)", record.id(), outcome.failedCallbacks().size());
	}

	/**
	 * DELETE /records/{record_id}
	 */
	void handleRecordDeleted(Context ctx) {
		String recordId = ctx.pathParam("record_id");
		HookOutcome outcome = indexingService.onRecordDeleted(recordId);
		ctx.status(200).result(gson.toJson(IndexResponse.of("deleted", outcome)));
		logger.info("Removed record {} ({} failed callbacks)", recordId, outcome.failedCallbacks().size());
	}

	/**
	 * POST /index/rebuild
	 * Rebuild the primary index from an NDJSON stream of every record
	 */
	void handleIndexRebuild(Context ctx) {
		try {
			logger.info("Received index rebuild request");
			NdjsonRecordReader records = recordStream(ctx);

			int recordsIndexed = indexingService.rebuildPrimary(records);

			Map<String, Object> response = new HashMap<>();
			response.put("status", "completed");
			response.put("records_indexed", recordsIndexed);
			response.put("skipped_lines", records.skipped());

			ctx.status(200).result(gson.toJson(response));
			logger.info("Successfully rebuilt index with {} records", recordsIndexed);

		} catch (RuntimeException e) {
			fail(ctx, e, "Failed to rebuild index");
		}
	}

	/**
	 * POST /mirror/reindex[?from=primary|body]
	 * Bulk upsert into the mirror from an NDJSON body (default), or from the primary index with {@code from=primary}
	 */
	void handleMirrorReindex(Context ctx) {
		boolean fromPrimary;
		try {
			fromPrimary = readsFromPrimary(ctx.queryParam("from"));
		} catch (ValidationException e) {
			ctx.status(400).result(gson.toJson(Map.of("status", "failed", "error", e.getMessage())));
			return;
		}

		try {
			BulkReindexReport report;
			int skipped = 0;
			if (fromPrimary) {
				logger.info("Received mirror reindex request, streaming from the primary index");
				report = indexingService.reindexMirrorFromPrimary();
			} else {
				logger.info("Received mirror reindex request with record stream");
				NdjsonRecordReader records = recordStream(ctx);
				report = indexingService.reindexMirror(records);
				skipped = records.skipped();
			}

			Map<String, Object> response = new HashMap<>();
			response.put("status", report.failed() == 0 ? "completed" : "partial");
			response.put("succeeded", report.succeeded());
			response.put("failed", report.failed());
			response.put("failed_ids", report.failedIds());
			response.put("skipped_lines", skipped);

			ctx.status(200).result(gson.toJson(response));
		} catch (RuntimeException e) {
			fail(ctx, e, "Failed to reindex mirror");
		}
	}

	/**
	 * POST /mirror/resync
	 */
	void handleMirrorResync(Context ctx) {
		int cleared = indexingService.resyncMirror();

		Map<String, Object> response = new HashMap<>();
		response.put("cleared", cleared);
		response.put("pending", indexingService.getStats().pendingResync());
		ctx.status(200).result(gson.toJson(response));
	}

	/**
	 * GET /index/status
	 */
	void handleIndexStatus(Context ctx) {
		try {
			IndexingService.IndexStats stats = indexingService.getStats();

			IndexStatusResponse response = new IndexStatusResponse(
					stats.recordsIndexed(),
					stats.uniqueTerms(),
					stats.vocabularySize(),
					stats.mirrorDocuments(),
					stats.pendingResync(),
					LocalDateTime.now().toString()
			);

			ctx.status(200).result(gson.toJson(response));
			logger.debug("Retrieved index status: {} records, {} terms", stats.recordsIndexed(), stats.uniqueTerms());

		} catch (RuntimeException e) {
			fail(ctx, e, "Failed to retrieve index status");
		}
	}

	static boolean readsFromPrimary(String from) {
		if (from == null || from.isBlank() || from.equals("body")) {
			return false;
		}
		if (from.equals("primary")) {
			return true;
		}
		throw new ValidationException("from must be 'primary' or 'body', got '" + from + "'");
	}

	private static NdjsonRecordReader recordStream(Context ctx) {
		return new NdjsonRecordReader(new BufferedReader(
				new InputStreamReader(ctx.bodyInputStream(), StandardCharsets.UTF_8)));
	}

	private static void fail(Context ctx, RuntimeException e, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("status", "failed");
		error.put("error", message + ": " + e.getMessage());
		ctx.status(500).result(gson.toJson(error));
		logger.error("{}: {}", message, e.getMessage(), e);
	}
}
