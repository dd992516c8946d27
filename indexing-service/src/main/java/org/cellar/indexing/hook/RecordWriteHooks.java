package org.cellar.indexing.hook;

import org.cellar.core.model.CatalogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered list of post-write callbacks.
 *
 * <p>A failing callback is logged and recorded in the outcome; the callbacks after it still run.</p>
 */
public class RecordWriteHooks {
	private static final Logger logger = LoggerFactory.getLogger(RecordWriteHooks.class);

	private final List<RecordWriteCallback> callbacks = new CopyOnWriteArrayList<>();

	public RecordWriteHooks register(RecordWriteCallback callback) {
		callbacks.add(callback);
		logger.info("Registered write callback #{}: {}", callbacks.size(), callback.name());
		return this;
	}

	public List<String> callbackNames() {
		return callbacks.stream().map(RecordWriteCallback::name).toList();
	}

	public HookOutcome fireSaved(CatalogRecord record) {
		List<String> failed = new ArrayList<>();
		for (RecordWriteCallback callback : callbacks) {
			try {
				callback.afterSave(record);
			} catch (Exception e) {
				failed.add(callback.name());
				logger.error("Write callback '{}' failed for record {}", callback.name(), record.id(), e);
			}
		}
		return new HookOutcome(record.id(), failed);
	}

	public HookOutcome fireDeleted(String recordId) {
		List<String> failed = new ArrayList<>();
		for (RecordWriteCallback callback : callbacks) {
			try {
				callback.afterDelete(recordId);
			} catch (Exception e) {
				failed.add(callback.name());
				logger.error("Delete callback '{}' failed for record {}", callback.name(), recordId, e);
			}
		}
		return new HookOutcome(recordId, failed);
	}
}
