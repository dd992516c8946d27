package org.cellar.core.highlight;

import java.util.Objects;

/**
 * Start and end markers wrapped around highlighted spans.
 */
public record HighlightMarkers(String start, String end) {

	public static final HighlightMarkers DEFAULT = new HighlightMarkers("<mark>", "</mark>");

	public HighlightMarkers {
		Objects.requireNonNull(start, "start");
		Objects.requireNonNull(end, "end");
	}
}
