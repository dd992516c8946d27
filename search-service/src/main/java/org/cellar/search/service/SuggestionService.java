package org.cellar.search.service;

import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.error.ValidationException;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.cellar.core.vocabulary.Suggestion;
import org.cellar.core.vocabulary.VocabularyEngine;
import org.cellar.search.model.SearchSource;
import org.cellar.search.model.SuggestionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * "Did you mean" entry point: trigram similarity over the vocabulary, or edit distance over the mirror's terms.
 */
public class SuggestionService {
    private static final Logger logger = LoggerFactory.getLogger(SuggestionService.class);

    private final VocabularyEngine vocabulary;
    private final MirrorSynchronizer mirror;
    private final int maxResults;
    private final boolean mirrorFallback;

    public SuggestionService(VocabularyEngine vocabulary, MirrorSynchronizer mirror, int maxResults, boolean mirrorFallback) {
        this.vocabulary = vocabulary;
        this.mirror = mirror;
        this.maxResults = maxResults;
        this.mirrorFallback = mirrorFallback;
    }

    public SuggestionResponse suggest(String term, SearchSource source, int limit) throws IOException {
        return suggest(term, source, limit, vocabulary.defaultMinSimilarity());
    }

    /**
     * @param minSimilarity trigram similarity floor for the vocabulary; the mirror ranks by edit distance and
     *                      ignores it
     */
    public SuggestionResponse suggest(String term, SearchSource source, int limit, double minSimilarity) throws IOException {
        if (term == null || term.isBlank()) {
            throw new ValidationException("Suggestion term must not be blank");
        }
        if (limit <= 0) {
            throw new ValidationException("limit must be positive, got " + limit);
        }
        int cappedLimit = Math.min(limit, maxResults);
        logger.info("Suggest '{}' from {}, limit: {}", term, source, cappedLimit);

        if (source == SearchSource.PRIMARY) {
            return new SuggestionResponse(term, SearchSource.PRIMARY, false, vocabulary.suggest(term, minSimilarity, cappedLimit));
        }

        try {
            List<Suggestion> suggestions = mirror.termSuggest(term, cappedLimit);
            return new SuggestionResponse(term, SearchSource.MIRROR, false, suggestions);
        } catch (IndexUnavailableException e) {
            if (!mirrorFallback) {
                throw e;
            }
            logger.warn("Mirror index unavailable ({}), suggesting '{}' from the vocabulary", e.getMessage(), term);
            return new SuggestionResponse(term, SearchSource.PRIMARY, true, vocabulary.suggest(term, minSimilarity, cappedLimit));
        }
    }

    public int vocabularySize() throws IOException {
        return vocabulary.size();
    }
}
