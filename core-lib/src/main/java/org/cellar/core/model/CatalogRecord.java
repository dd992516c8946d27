package org.cellar.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A searchable catalog entry as committed by the primary record store.
 *
 * <p>Text fields are nullable raw strings. Attributes hold categorical strings or numbers and are only
 * used as filters.</p>
 */
public record CatalogRecord(
		String id,
		Map<String, String> textFields,
		Map<String, Object> attributes
) implements Serializable {

	public CatalogRecord {
		Objects.requireNonNull(id, "id");
		textFields = textFields == null
				? Collections.emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<>(textFields));
		attributes = attributes == null
				? Collections.emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}

	public String text(String field) {
		return textFields.get(field);
	}

	public Object attribute(String field) {
		return attributes.get(field);
	}

	public static Builder builder(String id) {
		return new Builder(id);
	}

	@NotNull
	@Override
	public String toString() {
		return String.format("CatalogRecord{id='%s', fields=%s, attributes=%s}", id, textFields.keySet(), attributes);
	}

	@Serial
	private static final long serialVersionUID = 1L;

	public static final class Builder {
		private final String id;
		private final Map<String, String> textFields = new LinkedHashMap<>();
		private final Map<String, Object> attributes = new LinkedHashMap<>();

		private Builder(String id) {
			this.id = id;
		}

		public Builder text(String field, String value) {
			textFields.put(field, value);
			return this;
		}

		public Builder attribute(String field, Object value) {
			attributes.put(field, value);
			return this;
		}

		public CatalogRecord build() {
			return new CatalogRecord(id, textFields, attributes);
		}
	}
}
