package org.cellar.indexing.model;

import org.cellar.core.error.ValidationException;
import org.cellar.core.model.CatalogRecord;

import java.util.Map;

/**
 * JSON shape of a catalog record in request bodies and NDJSON streams.
 */
public record RecordPayload(
		String id,
		Map<String, String> textFields,
		Map<String, Object> attributes
) {
	public CatalogRecord toRecord() {
		if (id == null || id.isBlank()) {
			throw new ValidationException("Record is missing an 'id'");
		}
		return new CatalogRecord(id.trim(),
				textFields == null ? Map.of() : textFields,
				attributes == null ? Map.of() : attributes);
	}

	public static RecordPayload from(CatalogRecord record) {
		return new RecordPayload(record.id(), record.textFields(), record.attributes());
	}
}
