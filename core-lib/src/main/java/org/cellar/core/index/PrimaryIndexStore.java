package org.cellar.core.index;

import org.cellar.core.model.CatalogRecord;
import org.cellar.core.model.ScoredRecord;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.query.Filter;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vector.FieldWeights;
import org.cellar.core.vector.SearchVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Stores a search vector per record and answers ranked queries through the postings of an inverted index.
 *
 * <p>Ranking: a record matches when it contains at least {@link SearchQuery#minimumMatch()} distinct query
 * terms. Its score is the sum over shared terms of (term weight x query term frequency), divided by
 * {@code 1 + ln(1 + vector length)}. Filters are applied before ranking. Results are ordered by score
 * descending, then record id ascending.</p>
 *
 * <p>A query with blank text browses: every record passing the filters is returned with score 0, ordered by
 * id. Text that normalizes to no terms at all (only stop words, only punctuation) matches nothing.</p>
 */
public class PrimaryIndexStore {
	private static final Logger logger = LoggerFactory.getLogger(PrimaryIndexStore.class);

	private static final Comparator<ScoredRecord> RANKING = Comparator
			.comparingDouble(ScoredRecord::score).reversed()
			.thenComparing(ScoredRecord::recordId);

	private final IndexStorage storage;
	private final CatalogSchema schema;
	private final TextAnalyzer textAnalyzer;
	private final AnalysisProfile profile;

	public PrimaryIndexStore(IndexStorage storage, CatalogSchema schema, TextAnalyzer textAnalyzer, AnalysisProfile profile) {
		this.storage = storage;
		this.schema = schema;
		this.textAnalyzer = textAnalyzer;
		this.profile = profile;
	}

	/**
	 * Upserts the vector of a record. Postings of terms the previous vector had and the new one lacks are
	 * dropped; indexing the same record twice leaves the index unchanged.
	 */
	public void index(String recordId, CatalogRecord record, SearchVector vector) {
		if (!recordId.equals(record.id())) {
			throw new IllegalArgumentException("Record id mismatch: " + recordId + " vs " + record.id());
		}

		Optional<IndexedRecord> previous = storage.put(new IndexedRecord(record, vector));

		for (String term : vector.terms().keySet()) {
			storage.addPosting(term, recordId);
		}

		int stale = 0;
		if (previous.isPresent()) {
			for (String term : previous.get().vector().terms().keySet()) {
				if (!vector.contains(term)) {
					storage.removePosting(term, recordId);
					stale++;
				}
			}
		}

		logger.debug("Indexed record {} with {} terms ({} stale postings removed)", recordId, vector.terms().size(), stale);
	}

	public boolean remove(String recordId) {
		Optional<IndexedRecord> removed = storage.remove(recordId);
		removed.ifPresent(indexed -> {
			for (String term : indexed.vector().terms().keySet()) {
				storage.removePosting(term, recordId);
			}
		});
		logger.debug("Removed record {} from primary index: {}", recordId, removed.isPresent());
		return removed.isPresent();
	}

	public Optional<IndexedRecord> find(String recordId) {
		return storage.get(recordId);
	}

	public Map<String, IndexedRecord> findAll(Set<String> recordIds) {
		return storage.getAll(recordIds);
	}

	/**
	 * Every indexed record, in no particular order.
	 */
	public Iterator<CatalogRecord> records() {
		return storage.values().stream().map(IndexedRecord::record).iterator();
	}

	public boolean isEmpty() {
		return storage.recordCount() == 0;
	}

	public void clear() {
		storage.clear();
		logger.info("Cleared primary index");
	}

	public List<ScoredRecord> query(SearchQuery query) {
		schema.validate(query);

		if (!query.hasText()) {
			return browse(query);
		}

		SortedMap<String, Integer> queryTerms = termFrequencies(query.text());
		if (queryTerms.isEmpty()) {
			logger.debug("Query '{}' has no searchable terms", query.text());
			return List.of();
		}

		Set<String> candidates = new HashSet<>();
		for (String term : queryTerms.keySet()) {
			candidates.addAll(storage.postings(term));
		}
		if (candidates.isEmpty()) {
			return List.of();
		}

		FieldWeights weights = schema.weightsFor(query);
		List<ScoredRecord> results = new ArrayList<>();
		for (IndexedRecord indexed : storage.getAll(candidates).values()) {
			if (!passesFilters(indexed.record(), query.filters())) {
				continue;
			}
			if (matchedTerms(indexed.vector(), queryTerms.keySet()) < query.minimumMatch()) {
				continue;
			}
			results.add(new ScoredRecord(indexed.id(), score(indexed.vector(), queryTerms, weights)));
		}

		results.sort(RANKING);
		logger.debug("Query '{}' matched {} of {} candidates", query.text(), results.size(), candidates.size());
		return results.size() > query.limit() ? List.copyOf(results.subList(0, query.limit())) : results;
	}

	/**
	 * Normalized query terms with their frequency in the query text.
	 */
	public SortedMap<String, Integer> termFrequencies(String text) {
		SortedMap<String, Integer> frequencies = new TreeMap<>();
		for (String term : textAnalyzer.terms(text, profile)) {
			frequencies.merge(term, 1, Integer::sum);
		}
		return frequencies;
	}

	static double score(SearchVector vector, Map<String, Integer> queryTerms, FieldWeights weights) {
		double dot = 0.0;
		for (Map.Entry<String, Integer> entry : queryTerms.entrySet()) {
			if (vector.contains(entry.getKey())) {
				dot += vector.weight(entry.getKey(), weights) * entry.getValue();
			}
		}
		return dot / (1.0 + Math.log(1.0 + vector.length()));
	}

	private static int matchedTerms(SearchVector vector, Collection<String> terms) {
		int matched = 0;
		for (String term : terms) {
			if (vector.contains(term)) {
				matched++;
			}
		}
		return matched;
	}

	private List<ScoredRecord> browse(SearchQuery query) {
		List<ScoredRecord> results = new ArrayList<>();
		for (IndexedRecord indexed : storage.values()) {
			if (passesFilters(indexed.record(), query.filters())) {
				results.add(new ScoredRecord(indexed.id(), 0.0));
			}
		}
		results.sort(RANKING);
		return results.size() > query.limit() ? List.copyOf(results.subList(0, query.limit())) : results;
	}

	private static boolean passesFilters(CatalogRecord record, List<Filter> filters) {
		for (Filter filter : filters) {
			if (!filter.matches(record.attribute(filter.field()))) {
				return false;
			}
		}
		return true;
	}

	public IndexStats getStats() {
		return new IndexStats(storage.recordCount(), storage.termCount());
	}

	public record IndexStats(int recordsIndexed, int uniqueTerms) {}
}
