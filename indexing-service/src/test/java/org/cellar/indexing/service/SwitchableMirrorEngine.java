package org.cellar.indexing.service;

import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.highlight.HighlightMarkers;
import org.cellar.core.mirror.MirrorBulkResponse;
import org.cellar.core.mirror.MirrorDocument;
import org.cellar.core.mirror.MirrorEngine;
import org.cellar.core.mirror.MirrorHit;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.vector.FieldWeights;
import org.cellar.core.vocabulary.Suggestion;

import java.io.IOException;
import java.util.List;

/**
 * Mirror engine that can be taken offline.
 */
class SwitchableMirrorEngine implements MirrorEngine {
	private final MirrorEngine delegate;
	volatile boolean online = true;

	SwitchableMirrorEngine(MirrorEngine delegate) {
		this.delegate = delegate;
	}

	private void check() throws IndexUnavailableException {
		if (!online) {
			throw new IndexUnavailableException("mirror offline");
		}
	}

	@Override
	public void upsert(MirrorDocument document) throws IndexUnavailableException {
		check();
		delegate.upsert(document);
	}

	@Override
	public MirrorBulkResponse bulkUpsert(List<MirrorDocument> documents) throws IndexUnavailableException {
		check();
		return delegate.bulkUpsert(documents);
	}

	@Override
	public void delete(String id) throws IndexUnavailableException {
		check();
		delegate.delete(id);
	}

	@Override
	public List<MirrorHit> search(SearchQuery query, FieldWeights boosts, HighlightMarkers markers) throws IndexUnavailableException {
		check();
		return delegate.search(query, boosts, markers);
	}

	@Override
	public List<Suggestion> suggest(String term, int maxResults) throws IndexUnavailableException {
		check();
		return delegate.suggest(term, maxResults);
	}

	@Override
	public long documentCount() throws IndexUnavailableException {
		check();
		return delegate.documentCount();
	}

	@Override
	public void close() throws IOException {
		delegate.close();
	}
}
