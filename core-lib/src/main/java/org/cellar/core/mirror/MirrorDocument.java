package org.cellar.core.mirror;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Denormalized projection of a record as held by the mirror engine: text fields and filterable attributes,
 * no derived vector.
 */
public record MirrorDocument(String id, Map<String, String> textFields, Map<String, Object> attributes) {

	public MirrorDocument {
		Objects.requireNonNull(id, "id");
		textFields = Collections.unmodifiableMap(new LinkedHashMap<>(textFields));
		attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}
}
