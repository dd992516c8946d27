package org.cellar.search.service;

import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.highlight.HighlightMarkers;
import org.cellar.core.highlight.Highlighter;
import org.cellar.core.index.IndexedRecord;
import org.cellar.core.index.PrimaryIndexStore;
import org.cellar.core.mirror.MirrorHit;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.model.ScoredRecord;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.query.SearchQuery;
import org.cellar.search.model.SearchResponse;
import org.cellar.search.model.SearchResultItem;
import org.cellar.search.model.SearchSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Query entry point over either the primary index or the mirror index.
 *
 * <p>When the mirror cannot be reached and fallback is enabled, the primary index answers instead and the
 * response is flagged as degraded.</p>
 */
public class SearchService {
    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

    private final PrimaryIndexStore primaryIndex;
    private final MirrorSynchronizer mirror;
    private final CatalogSchema schema;
    private final Highlighter highlighter;
    private final HighlightMarkers markers;
    private final int maxResults;
    private final boolean mirrorFallback;

    public SearchService(
        PrimaryIndexStore primaryIndex,
        MirrorSynchronizer mirror,
        CatalogSchema schema,
        Highlighter highlighter,
        HighlightMarkers markers,
        int maxResults,
        boolean mirrorFallback
    ) {
        this.primaryIndex = primaryIndex;
        this.mirror = mirror;
        this.schema = schema;
        this.highlighter = highlighter;
        this.markers = markers;
        this.maxResults = maxResults;
        this.mirrorFallback = mirrorFallback;
    }

    /**
     * Runs a free-text query with raw filter values as they arrive from a request.
     *
     * @param text    free text; blank browses every record that passes the filters
     * @param filters attribute name to raw value, e.g. {@code country=Italy} or {@code points=90..}
     * @param limit   capped at the configured maximum
     */
    public SearchResponse search(String text, Map<String, String> filters, SearchSource source, int limit, boolean highlight)
        throws IndexUnavailableException {
        SearchQuery query = SearchQuery.builder()
            .text(text)
            .filters(schema.parseFilters(filters))
            .limit(Math.min(limit, maxResults))
            .build();
        return search(query, source, highlight);
    }

    public SearchResponse search(SearchQuery query, SearchSource source, boolean highlight) throws IndexUnavailableException {
        logger.info("Search query: '{}' on {}, filters: {}, limit: {}", query.text(), source, query.filters(), query.limit());

        if (source == SearchSource.PRIMARY) {
            return respond(query, SearchSource.PRIMARY, false, searchPrimary(query, highlight));
        }

        try {
            List<SearchResultItem> results = new ArrayList<>();
            for (MirrorHit hit : mirror.query(query, highlight ? markers : null)) {
                results.add(SearchResultItem.fromHit(hit));
            }
            return respond(query, SearchSource.MIRROR, false, results);
        } catch (IndexUnavailableException e) {
            if (!mirrorFallback) {
                throw e;
            }
            logger.warn("Mirror index unavailable ({}), answering '{}' from the primary index", e.getMessage(), query.text());
            return respond(query, SearchSource.PRIMARY, true, searchPrimary(query, highlight));
        }
    }

    private List<SearchResultItem> searchPrimary(SearchQuery query, boolean highlight) {
        List<ScoredRecord> ranked = primaryIndex.query(query);
        if (ranked.isEmpty()) {
            return List.of();
        }

        Set<String> ids = new LinkedHashSet<>();
        ranked.forEach(scored -> ids.add(scored.recordId()));
        Map<String, IndexedRecord> records = primaryIndex.findAll(ids);

        List<SearchResultItem> results = new ArrayList<>(ranked.size());
        for (ScoredRecord scored : ranked) {
            IndexedRecord indexed = records.get(scored.recordId());
            if (indexed == null) {
                // removed between ranking and fetch
                continue;
            }
            Map<String, String> highlights = highlight && query.hasText()
                ? highlightFields(indexed.record(), query.text())
                : Map.of();
            results.add(SearchResultItem.fromRecord(indexed.record(), scored.score(), highlights));
        }
        return results;
    }

    private Map<String, String> highlightFields(CatalogRecord record, String text) {
        List<String> queryTerms = List.of(text);
        Map<String, String> highlights = new LinkedHashMap<>();
        for (String field : schema.textFields().keySet()) {
            String value = record.text(field);
            if (highlighter.matches(value, queryTerms)) {
                highlights.put(field, highlighter.highlight(value, queryTerms, markers.start(), markers.end()));
            }
        }
        return highlights;
    }

    private static SearchResponse respond(SearchQuery query, SearchSource source, boolean degraded, List<SearchResultItem> results) {
        logger.debug("Returning {} results from {}{}", results.size(), source, degraded ? " (degraded)" : "");
        return new SearchResponse(query.text(), source, degraded, results.size(), results);
    }

    /**
     * Index sizes as seen by this service; mirror documents is {@code -1} when the mirror cannot be read.
     */
    public SearchStats getStats() {
        PrimaryIndexStore.IndexStats primary = primaryIndex.getStats();
        long mirrorDocuments;
        try {
            mirrorDocuments = mirror.documentCount();
        } catch (IndexUnavailableException e) {
            logger.debug("Mirror index unavailable for stats: {}", e.getMessage());
            mirrorDocuments = -1;
        }
        return new SearchStats(primary.recordsIndexed(), primary.uniqueTerms(), mirrorDocuments);
    }

    public record SearchStats(int recordsIndexed, int uniqueTerms, long mirrorDocuments) {}
}
