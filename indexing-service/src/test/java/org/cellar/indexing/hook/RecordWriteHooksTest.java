package org.cellar.indexing.hook;

import org.cellar.core.model.CatalogRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RecordWriteHooksTest {

	private static RecordWriteCallback recording(String name, List<String> calls, boolean fail) {
		return new RecordWriteCallback() {
			@Override
			public String name() {
				return name;
			}

			@Override
			public void afterSave(CatalogRecord record) throws IOException {
				calls.add(name + ":save:" + record.id());
				if (fail) {
					throw new IOException(name + " down");
				}
			}

			@Override
			public void afterDelete(String recordId) {
				calls.add(name + ":delete:" + recordId);
				if (fail) {
					throw new IllegalStateException(name + " down");
				}
			}
		};
	}

	@Test
	public void testCallbacksRunInRegistrationOrder() {
		List<String> calls = new ArrayList<>();
		RecordWriteHooks hooks = new RecordWriteHooks()
				.register(recording("primary", calls, false))
				.register(recording("vocabulary", calls, false))
				.register(recording("mirror", calls, false));

		HookOutcome outcome = hooks.fireSaved(CatalogRecord.builder("7").build());

		assertTrue(outcome.isClean());
		assertEquals(List.of("primary:save:7", "vocabulary:save:7", "mirror:save:7"), calls);
		assertEquals(List.of("primary", "vocabulary", "mirror"), hooks.callbackNames());
	}

	@Test
	public void testFailingCallbackDoesNotStopLaterOnes() {
		List<String> calls = new ArrayList<>();
		RecordWriteHooks hooks = new RecordWriteHooks()
				.register(recording("primary", calls, false))
				.register(recording("vocabulary", calls, true))
				.register(recording("mirror", calls, false));

		HookOutcome saved = hooks.fireSaved(CatalogRecord.builder("1").build());
		HookOutcome deleted = hooks.fireDeleted("1");

		assertEquals(List.of("vocabulary"), saved.failedCallbacks());
		assertEquals(List.of("vocabulary"), deleted.failedCallbacks());
		assertEquals(6, calls.size());
		assertEquals("mirror:delete:1", calls.get(5));
	}
}
