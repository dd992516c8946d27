package org.cellar.indexing.io;

import org.cellar.core.model.CatalogRecord;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class NdjsonRecordReaderTest {

	@Test
	public void testStreamsRecordsAndSkipsBadLines() {
		String ndjson = """
				{"id":"1","textFields":{"variety":"Merlot"},"attributes":{"country":"France","points":91}}

				{"id":"2","textFields":{"variety":"Syrah"}}
				not a record
				{"textFields":{"variety":"no id"}}
				{"id":"3"}
				""";

		NdjsonRecordReader reader = new NdjsonRecordReader(new StringReader(ndjson));
		List<CatalogRecord> records = new ArrayList<>();
		reader.forEachRemaining(records::add);

		assertEquals(List.of("1", "2", "3"), records.stream().map(CatalogRecord::id).toList());
		assertEquals("Merlot", records.get(0).text("variety"));
		assertEquals("France", records.get(0).attribute("country"));
		assertTrue(records.get(2).textFields().isEmpty());
		assertEquals(2, reader.skipped());
		assertThrows(NoSuchElementException.class, reader::next);
	}

	@Test
	public void testEmptyStream() {
		NdjsonRecordReader reader = new NdjsonRecordReader(new StringReader(""));

		assertFalse(reader.hasNext());
		assertEquals(0, reader.skipped());
	}
}
