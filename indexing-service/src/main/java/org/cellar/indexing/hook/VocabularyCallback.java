package org.cellar.indexing.hook;

import org.cellar.core.model.CatalogRecord;
import org.cellar.core.vocabulary.VocabularyEngine;

import java.io.IOException;

/**
 * Adds the record's words to the suggestion vocabulary. Deletes leave the vocabulary as it is.
 */
public class VocabularyCallback implements RecordWriteCallback {
	private final VocabularyEngine vocabulary;

	public VocabularyCallback(VocabularyEngine vocabulary) {
		this.vocabulary = vocabulary;
	}

	@Override
	public String name() {
		return "vocabulary";
	}

	@Override
	public void afterSave(CatalogRecord record) throws IOException {
		vocabulary.ingest(record);
	}

	@Override
	public void afterDelete(String recordId) {
		// append-only
	}
}
