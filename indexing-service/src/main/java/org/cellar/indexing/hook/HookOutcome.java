package org.cellar.indexing.hook;

import java.util.List;

/**
 * Which callbacks failed for one record write; empty when all of them ran cleanly.
 */
public record HookOutcome(String recordId, List<String> failedCallbacks) {

	public HookOutcome {
		failedCallbacks = List.copyOf(failedCallbacks);
	}

	public boolean isClean() {
		return failedCallbacks.isEmpty();
	}
}
