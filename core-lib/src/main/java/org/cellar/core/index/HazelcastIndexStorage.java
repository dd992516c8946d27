package org.cellar.core.index;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import com.hazelcast.multimap.MultiMap;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link IndexStorage} shared across the cluster: indexed records live in an {@link IMap}, postings in a
 * set-valued {@link MultiMap}. The indexing service writes, the search service reads the same structures.
 */
public class HazelcastIndexStorage implements IndexStorage {
	private final IMap<String, IndexedRecord> records;
	private final MultiMap<String, String> postings;

	public HazelcastIndexStorage(HazelcastInstance hazelcast, String recordMapName, String postingsName) {
		this.records = hazelcast.getMap(recordMapName);
		this.postings = hazelcast.getMultiMap(postingsName);
	}

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
		return records.getAll(recordIds);
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
		postings.put(term, recordId);
	}

	@Override
	public void removePosting(String term, String recordId) {
		postings.remove(term, recordId);
	}

	@Override
	public Collection<String> postings(String term) {
		return postings.get(term);
	}

	@Override
	public int recordCount() {
		return records.size();
	}

	@Override
	public int termCount() {
		return postings.keySet().size();
	}

	@Override
	public void clear() {
		records.clear();
		postings.clear();
	}
}
