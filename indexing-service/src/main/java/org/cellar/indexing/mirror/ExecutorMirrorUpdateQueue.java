package org.cellar.indexing.mirror;

import org.cellar.core.mirror.MirrorSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Applies updates on background worker threads so the write path returns before the mirror is touched.
 *
 * <p>With a single worker, updates reach the mirror in submission order.</p>
 */
public class ExecutorMirrorUpdateQueue implements MirrorUpdateQueue {
	private static final Logger logger = LoggerFactory.getLogger(ExecutorMirrorUpdateQueue.class);

	private final MirrorSynchronizer synchronizer;
	private final ExecutorService executor;

	public ExecutorMirrorUpdateQueue(MirrorSynchronizer synchronizer, int workerThreads) {
		this.synchronizer = synchronizer;
		this.executor = Executors.newFixedThreadPool(Math.max(1, workerThreads), runnable -> {
			Thread thread = new Thread(runnable);
			thread.setDaemon(true);
			thread.setName("Mirror-Update-Worker");
			return thread;
		});
	}

	@Override
	public void submit(MirrorUpdate update) {
		try {
			executor.execute(() -> apply(update));
		} catch (RejectedExecutionException e) {
			logger.warn("Mirror queue is closed, applying {} {} inline", update.type(), update.recordId());
			apply(update);
		}
	}

	private void apply(MirrorUpdate update) {
		try {
			update.applyTo(synchronizer);
		} catch (RuntimeException e) {
			logger.error("Mirror update {} {} failed", update.type(), update.recordId(), e);
		}
	}

	/**
	 * Stops taking new work and waits for submitted updates to finish. Later submits run inline.
	 */
	public boolean drain(long timeout, TimeUnit unit) throws InterruptedException {
		executor.shutdown();
		return executor.awaitTermination(timeout, unit);
	}

	@Override
	public void close() {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
				logger.warn("Mirror update workers did not finish in time, {} tasks dropped", executor.shutdownNow().size());
			}
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
