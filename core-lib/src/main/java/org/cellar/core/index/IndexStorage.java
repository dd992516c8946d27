package org.cellar.core.index;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Backing storage for the primary index: indexed records by id plus a term to record-id postings multimap.
 * Implementations must be safe for concurrent use on different records.
 */
public interface IndexStorage {
	/**
	 * Stores the record, returning the previously stored version if there was one.
	 */
	Optional<IndexedRecord> put(IndexedRecord record);

	Optional<IndexedRecord> get(String recordId);

	Map<String, IndexedRecord> getAll(Set<String> recordIds);

	Optional<IndexedRecord> remove(String recordId);

	/**
	 * Every stored record; used for filter-only browsing.
	 */
	Collection<IndexedRecord> values();

	void addPosting(String term, String recordId);

	void removePosting(String term, String recordId);

	Collection<String> postings(String term);

	int recordCount();

	int termCount();

	void clear();
}
