package org.cellar.core.index;

import org.cellar.core.model.CatalogRecord;
import org.cellar.core.vector.SearchVector;

import java.io.Serial;
import java.io.Serializable;

/**
 * A record co-located with its search vector in the primary index.
 */
public record IndexedRecord(CatalogRecord record, SearchVector vector) implements Serializable {

	public String id() {
		return record.id();
	}

	@Serial
	private static final long serialVersionUID = 1L;
}
