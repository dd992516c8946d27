package org.cellar.indexing.model;

public record IndexStatusResponse(
		int recordsIndexed,
		int uniqueTerms,
		int vocabularySize,
		long mirrorDocuments,
		int pendingResync,
		String lastUpdate
) {}
