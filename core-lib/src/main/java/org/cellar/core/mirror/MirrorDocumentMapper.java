package org.cellar.core.mirror;

import org.cellar.core.model.CatalogRecord;
import org.cellar.core.query.CatalogSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Projects a record onto the mirror: every searchable text field and every filterable attribute, nothing else.
 */
public class MirrorDocumentMapper {
	private final CatalogSchema schema;

	public MirrorDocumentMapper(CatalogSchema schema) {
		this.schema = schema;
	}

	public MirrorDocument toDocument(CatalogRecord record) {
		Map<String, String> text = new LinkedHashMap<>();
		for (String field : schema.textFields().keySet()) {
			String value = record.text(field);
			if (value != null) {
				text.put(field, value);
			}
		}

		Map<String, Object> attributes = new LinkedHashMap<>();
		for (String field : schema.filterFields().keySet()) {
			Object value = record.attribute(field);
			if (value != null) {
				attributes.put(field, value);
			}
		}

		return new MirrorDocument(record.id(), text, attributes);
	}
}
