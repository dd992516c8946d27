package org.cellar.core.vocabulary;

/**
 * A candidate term for a misspelled query term.
 *
 * @param term       the known term
 * @param similarity similarity in [0, 1]; trigram Jaccard for the vocabulary, edit-distance based for the mirror
 */
public record Suggestion(String term, double similarity) {
}
