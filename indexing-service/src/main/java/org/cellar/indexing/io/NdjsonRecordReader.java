package org.cellar.indexing.io;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.cellar.core.model.CatalogRecord;
import org.cellar.indexing.model.RecordPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Streams catalog records from newline-delimited JSON, one record per line.
 *
 * <p>Blank lines are ignored. Lines that are not a valid record are logged, counted in {@link #skipped()} and
 * skipped, so one bad line never stops a reindex.</p>
 */
public class NdjsonRecordReader implements Iterator<CatalogRecord> {
	private static final Logger logger = LoggerFactory.getLogger(NdjsonRecordReader.class);
	private static final Gson gson = new Gson();

	private final BufferedReader reader;
	private CatalogRecord next;
	private int lineNumber;
	private int skipped;

	public NdjsonRecordReader(Reader source) {
		this.reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
	}

	@Override
	public boolean hasNext() {
		if (next == null) {
			next = readNext();
		}
		return next != null;
	}

	@Override
	public CatalogRecord next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		CatalogRecord record = next;
		next = null;
		return record;
	}

	public int skipped() {
		return skipped;
	}

	private CatalogRecord readNext() {
		try {
			String line;
			while ((line = reader.readLine()) != null) {
				lineNumber++;
				if (line.isBlank()) {
					continue;
				}
				try {
					RecordPayload payload = gson.fromJson(line, RecordPayload.class);
					if (payload == null) {
						throw new JsonParseException("null record");
					}
					return payload.toRecord();
				} catch (JsonParseException | IllegalArgumentException e) {
					skipped++;
					logger.warn("Skipping line {}: {}", lineNumber, e.getMessage());
				}
			}
			return null;
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read record stream at line " + lineNumber, e);
		}
	}
}
