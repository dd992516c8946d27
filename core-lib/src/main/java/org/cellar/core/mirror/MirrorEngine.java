package org.cellar.core.mirror;

import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.highlight.HighlightMarkers;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.vector.FieldWeights;
import org.cellar.core.vocabulary.Suggestion;

import java.io.Closeable;
import java.util.List;

/**
 * Client of the dedicated search engine holding the mirror index.
 *
 * <p>Created once at startup and shared; never reinitialized while the process runs. Field boosts are never
 * stored with documents and must be supplied on every query.</p>
 */
public interface MirrorEngine extends Closeable {

	/**
	 * Replaces any document with the same id.
	 */
	void upsert(MirrorDocument document) throws IndexUnavailableException;

	/**
	 * Writes a batch. Documents the engine rejects are reported in the response; an exception means the
	 * whole batch did not go through.
	 */
	MirrorBulkResponse bulkUpsert(List<MirrorDocument> documents) throws IndexUnavailableException;

	void delete(String id) throws IndexUnavailableException;

	/**
	 * Ranks with the engine's own relevance model.
	 *
	 * @param boosts  per-field boosts for this query
	 * @param markers highlight markers, or {@code null} for no highlighting
	 */
	List<MirrorHit> search(SearchQuery query, FieldWeights boosts, HighlightMarkers markers) throws IndexUnavailableException;

	/**
	 * Edit-distance based term suggestions from the engine's own term dictionary.
	 */
	List<Suggestion> suggest(String term, int maxResults) throws IndexUnavailableException;

	long documentCount() throws IndexUnavailableException;
}
