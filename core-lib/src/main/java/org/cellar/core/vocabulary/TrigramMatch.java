package org.cellar.core.vocabulary;

/**
 * A vocabulary term sharing at least one trigram with a probe.
 *
 * @param term         the vocabulary term
 * @param trigramCount size of the term's own trigram set
 * @param shared       number of trigrams shared with the probe
 */
public record TrigramMatch(String term, int trigramCount, int shared) {
}
