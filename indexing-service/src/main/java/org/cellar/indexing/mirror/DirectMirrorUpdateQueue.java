package org.cellar.indexing.mirror;

import org.cellar.core.mirror.MirrorSynchronizer;

/**
 * Applies each update on the submitting thread, retries included.
 */
public class DirectMirrorUpdateQueue implements MirrorUpdateQueue {
	private final MirrorSynchronizer synchronizer;

	public DirectMirrorUpdateQueue(MirrorSynchronizer synchronizer) {
		this.synchronizer = synchronizer;
	}

	@Override
	public void submit(MirrorUpdate update) {
		update.applyTo(synchronizer);
	}

	@Override
	public void close() {
	}
}
