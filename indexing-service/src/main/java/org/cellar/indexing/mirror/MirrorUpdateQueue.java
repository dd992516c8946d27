package org.cellar.indexing.mirror;

/**
 * Carries mirror updates from the write path to the mirror. {@link #submit} never throws for mirror trouble.
 */
public interface MirrorUpdateQueue extends AutoCloseable {

	void submit(MirrorUpdate update);

	@Override
	void close();
}
