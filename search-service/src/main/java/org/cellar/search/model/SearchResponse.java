package org.cellar.search.model;

import java.util.List;

/**
 * @param degraded the requested source was unavailable and another one answered
 */
public record SearchResponse(
		String query,
		SearchSource source,
		boolean degraded,
		int totalResults,
		List<SearchResultItem> results
) {}
