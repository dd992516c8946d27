package org.cellar.indexing.hook;

import org.cellar.core.index.PrimaryIndexStore;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.vector.SearchVector;
import org.cellar.core.vector.SearchVectorBuilder;

/**
 * Rebuilds the record's search vector and upserts it into the primary index.
 */
public class PrimaryIndexCallback implements RecordWriteCallback {
	private final SearchVectorBuilder vectorBuilder;
	private final PrimaryIndexStore primaryIndex;
	private final CatalogSchema schema;

	public PrimaryIndexCallback(SearchVectorBuilder vectorBuilder, PrimaryIndexStore primaryIndex, CatalogSchema schema) {
		this.vectorBuilder = vectorBuilder;
		this.primaryIndex = primaryIndex;
		this.schema = schema;
	}

	@Override
	public String name() {
		return "primary-index";
	}

	@Override
	public void afterSave(CatalogRecord record) {
		SearchVector vector = vectorBuilder.build(record, schema.fieldWeights());
		primaryIndex.index(record.id(), record, vector);
	}

	@Override
	public void afterDelete(String recordId) {
		primaryIndex.remove(recordId);
	}
}
