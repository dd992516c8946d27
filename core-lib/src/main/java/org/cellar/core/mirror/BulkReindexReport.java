package org.cellar.core.mirror;

import java.util.List;

/**
 * Outcome of streaming records into the mirror. Failed ids are listed in stream order.
 */
public record BulkReindexReport(int succeeded, int failed, List<String> failedIds) {

	public BulkReindexReport {
		failedIds = List.copyOf(failedIds);
	}

	public int total() {
		return succeeded + failed;
	}
}
