package org.cellar.indexing.hook;

import org.cellar.core.model.CatalogRecord;

/**
 * Work that follows a committed record write. Callbacks run in registration order on the writing thread.
 */
public interface RecordWriteCallback {

	String name();

	void afterSave(CatalogRecord record) throws Exception;

	void afterDelete(String recordId) throws Exception;
}
