package org.cellar.search.model;

import org.cellar.core.vocabulary.Suggestion;

import java.util.List;

public record SuggestionResponse(
		String term,
		SearchSource source,
		boolean degraded,
		List<Suggestion> suggestions
) {}
