package org.cellar.indexing.hook;

import org.cellar.core.model.CatalogRecord;
import org.cellar.indexing.mirror.MirrorUpdate;
import org.cellar.indexing.mirror.MirrorUpdateQueue;

/**
 * Hands the write to the mirror update queue. Never blocks on the mirror itself.
 */
public class MirrorCallback implements RecordWriteCallback {
	private final MirrorUpdateQueue queue;

	public MirrorCallback(MirrorUpdateQueue queue) {
		this.queue = queue;
	}

	@Override
	public String name() {
		return "mirror";
	}

	@Override
	public void afterSave(CatalogRecord record) {
		queue.submit(MirrorUpdate.upsert(record));
	}

	@Override
	public void afterDelete(String recordId) {
		queue.submit(MirrorUpdate.delete(recordId));
	}
}
