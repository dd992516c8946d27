package org.cellar.indexing.model;

import org.cellar.indexing.hook.HookOutcome;

import java.util.List;

public record IndexResponse(
		String recordId,
		String index,
		List<String> failedCallbacks,
		String message
) {
	public static IndexResponse of(String operation, HookOutcome outcome) {
		return new IndexResponse(outcome.recordId(), outcome.isClean() ? operation : "partial", outcome.failedCallbacks(), null);
	}

	public static IndexResponse failed(String recordId, String message) {
		return new IndexResponse(recordId, "failed", List.of(), message);
	}
}
