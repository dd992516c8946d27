package org.cellar.core.mirror;

import java.util.Map;

/**
 * A ranked document returned by the mirror engine.
 *
 * @param highlights marked-up text per field; only fields with a match are present
 */
public record MirrorHit(
		String id,
		double score,
		Map<String, String> textFields,
		Map<String, Object> attributes,
		Map<String, String> highlights
) {
}
