package org.cellar.search.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.error.ValidationException;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.query.SearchQuery;
import org.cellar.search.model.SearchResponse;
import org.cellar.search.model.SearchSource;
import org.cellar.search.model.SuggestionResponse;
import org.cellar.search.service.SearchService;
import org.cellar.search.service.SuggestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new Gson();
	private static final Set<String> RESERVED_PARAMS = Set.of("q", "source", "limit", "highlight", "min_match", "min_similarity");
	private static final String BOOST_PREFIX = "boost.";

	private final SearchService searchService;
	private final SuggestionService suggestionService;
	private final CatalogSchema schema;
	private final int defaultLimit;
	private final int maxResults;
	private final SearchSource defaultSource;

	public SearchController(
			SearchService searchService,
			SuggestionService suggestionService,
			CatalogSchema schema,
			int defaultLimit,
			int maxResults,
			SearchSource defaultSource
	) {
		this.searchService = searchService;
		this.suggestionService = suggestionService;
		this.schema = schema;
		this.defaultLimit = defaultLimit;
		this.maxResults = maxResults;
		this.defaultSource = defaultSource;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/search", this::handleSearch);

		app.get("/suggest", this::handleSuggest);

		app.get("/stats", this::handleStats);

		logger.info("Search routes registered");
	}

	/**
	 * GET /health
	 */
	void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());

		try {
			SearchService.SearchStats stats = searchService.getStats();
			health.put("records_indexed", stats.recordsIndexed());
			health.put("mirror_available", stats.mirrorDocuments() >= 0);
		} catch (RuntimeException e) {
			health.put("records_indexed", "error");
			logger.error("Error getting stats for health check", e);
		}

		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /search?q={text}&source={primary|mirror}&limit={n}&highlight={bool}&min_match={n}&boost.{field}={w}&{filter}={value}
	 * Any parameter that is not reserved is a filter on a catalog attribute.
	 */
	void handleSearch(Context ctx) {
		try {
			SearchSource source = parseSource(ctx.queryParam("source"));
			boolean highlight = Boolean.parseBoolean(ctx.queryParam("highlight"));

			SearchQuery.Builder builder = SearchQuery.builder()
					.text(ctx.queryParam("q"))
					.limit(Math.min(parseInt(ctx.queryParam("limit"), "limit", defaultLimit), maxResults))
					.minimumMatch(parseInt(ctx.queryParam("min_match"), "min_match", 1));

			Map<String, String> filters = new LinkedHashMap<>();
			for (Map.Entry<String, List<String>> param : ctx.queryParamMap().entrySet()) {
				String name = param.getKey();
				String value = param.getValue().isEmpty() ? null : param.getValue().get(0);
				if (RESERVED_PARAMS.contains(name)) {
					continue;
				}
				if (name.startsWith(BOOST_PREFIX)) {
					builder.boost(name.substring(BOOST_PREFIX.length()), parseDouble(value, name));
				} else {
					filters.put(name, value);
				}
			}
			builder.filters(schema.parseFilters(filters));

			SearchResponse response = searchService.search(builder.build(), source, highlight);
			ctx.status(200).result(gson.toJson(response));
			logger.info("Returned {} search results from {}", response.totalResults(), response.source());

		} catch (ValidationException e) {
			badRequest(ctx, e);
		} catch (IndexUnavailableException e) {
			unavailable(ctx, e);
		} catch (RuntimeException e) {
			serverError(ctx, "Search failed", e);
		}
	}

	/**
	 * GET /suggest?q={term}&source={primary|mirror}&limit={n}&min_similarity={0..1}
	 */
	void handleSuggest(Context ctx) {
		try {
			SearchSource source = parseSource(ctx.queryParam("source"));
			int limit = parseInt(ctx.queryParam("limit"), "limit", defaultLimit);
			String minSimilarity = ctx.queryParam("min_similarity");

			SuggestionResponse response = minSimilarity == null || minSimilarity.isBlank()
					? suggestionService.suggest(ctx.queryParam("q"), source, limit)
					: suggestionService.suggest(ctx.queryParam("q"), source, limit, parseDouble(minSimilarity, "min_similarity"));

			ctx.status(200).result(gson.toJson(response));
			logger.info("Returned {} suggestions for '{}'", response.suggestions().size(), response.term());

		} catch (ValidationException e) {
			badRequest(ctx, e);
		} catch (IndexUnavailableException e) {
			unavailable(ctx, e);
		} catch (IOException | RuntimeException e) {
			serverError(ctx, "Suggestion failed", e);
		}
	}

	/**
	 * GET /stats
	 */
	void handleStats(Context ctx) {
		try {
			SearchService.SearchStats stats = searchService.getStats();

			Map<String, Object> response = new HashMap<>();
			response.put("records_indexed", stats.recordsIndexed());
			response.put("unique_terms", stats.uniqueTerms());
			response.put("mirror_documents", stats.mirrorDocuments());
			response.put("vocabulary_size", suggestionService.vocabularySize());

			ctx.status(200).result(gson.toJson(response));
			logger.debug("Retrieved search statistics");

		} catch (IOException | RuntimeException e) {
			serverError(ctx, "Failed to retrieve statistics", e);
		}
	}

	private SearchSource parseSource(String value) {
		return value == null || value.isBlank() ? defaultSource : SearchSource.parse(value);
	}

	private static int parseInt(String value, String name, int defaultValue) {
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new ValidationException("Invalid " + name + " format. Must be an integer.", e);
		}
	}

	private static double parseDouble(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new ValidationException("Parameter '" + name + "' has no value");
		}
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new ValidationException("Invalid " + name + " format. Must be a number.", e);
		}
	}

	private static void badRequest(Context ctx, ValidationException e) {
		ctx.status(400).result(gson.toJson(Map.of("error", e.getMessage())));
		logger.debug("Rejected request {}: {}", ctx.fullUrl(), e.getMessage());
	}

	private static void unavailable(Context ctx, IndexUnavailableException e) {
		ctx.status(503).result(gson.toJson(Map.of("error", "Mirror index unavailable: " + e.getMessage())));
		logger.warn("Mirror index unavailable: {}", e.getMessage());
	}

	private static void serverError(Context ctx, String what, Exception e) {
		ctx.status(500).result(gson.toJson(Map.of("error", what + ": " + e.getMessage())));
		logger.error(what, e);
	}
}
