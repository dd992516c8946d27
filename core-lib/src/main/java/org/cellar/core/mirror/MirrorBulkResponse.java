package org.cellar.core.mirror;

import java.util.Map;

/**
 * Per-batch outcome of a bulk write to the mirror engine.
 *
 * @param succeeded number of documents written
 * @param failures  document id to failure reason for documents the engine rejected
 */
public record MirrorBulkResponse(int succeeded, Map<String, String> failures) {

	public boolean hasFailures() {
		return !failures.isEmpty();
	}
}
