package org.cellar.core.index;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process {@link IndexStorage} backed by concurrent maps.
 */
public class InMemoryIndexStorage implements IndexStorage {
	private final Map<String, IndexedRecord> records = new ConcurrentHashMap<>();
	private final Map<String, Set<String>> postings = new ConcurrentHashMap<>();

	@Override
	public Optional<IndexedRecord> put(IndexedRecord record) {
		return Optional.ofNullable(records.put(record.id(), record));
	}

	@Override
	public Optional<IndexedRecord> get(String recordId) {
		return Optional.ofNullable(records.get(recordId));
	}

	@Override
	public Map<String, IndexedRecord> getAll(Set<String> recordIds) {
		Map<String, IndexedRecord> found = new HashMap<>();
		for (String id : recordIds) {
			IndexedRecord record = records.get(id);
			if (record != null) {
				found.put(id, record);
			}
		}
		return found;
	}

	@Override
	public Optional<IndexedRecord> remove(String recordId) {
		return Optional.ofNullable(records.remove(recordId));
	}

	@Override
	public Collection<IndexedRecord> values() {
		return List.copyOf(records.values());
	}

	@Override
	public void addPosting(String term, String recordId) {
		postings.computeIfAbsent(term, t -> ConcurrentHashMap.newKeySet()).add(recordId);
	}

	@Override
	public void removePosting(String term, String recordId) {
		postings.computeIfPresent(term, (t, ids) -> {
			ids.remove(recordId);
			return ids.isEmpty() ? null : ids;
		});
	}

	@Override
	public Collection<String> postings(String term) {
		Set<String> ids = postings.get(term);
		return ids == null ? Collections.emptySet() : Set.copyOf(ids);
	}

	@Override
	public int recordCount() {
		return records.size();
	}

	@Override
	public int termCount() {
		return postings.size();
	}

	@Override
	public void clear() {
		records.clear();
		postings.clear();
	}
}
