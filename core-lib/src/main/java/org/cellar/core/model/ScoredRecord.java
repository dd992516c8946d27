package org.cellar.core.model;

/**
 * A ranked match produced by the primary index.
 */
public record ScoredRecord(String recordId, double score) {
}
