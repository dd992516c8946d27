package org.cellar.core.vector;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Positional term-weight structure derived from a record's text fields.
 *
 * <p>Terms are kept sorted so two vectors built from the same input are equal and serialize identically.</p>
 *
 * @param terms  term to entry, sorted by term
 * @param length number of tokens that went into the vector
 */
public record SearchVector(SortedMap<String, TermEntry> terms, int length) implements Serializable {

	public SearchVector {
		terms = Collections.unmodifiableSortedMap(new TreeMap<>(terms));
	}

	public static SearchVector empty() {
		return new SearchVector(new TreeMap<>(), 0);
	}

	public boolean isEmpty() {
		return terms.isEmpty();
	}

	public boolean contains(String term) {
		return terms.containsKey(term);
	}

	public TermEntry entry(String term) {
		return terms.get(term);
	}

	/**
	 * Weight of a term under the given field weights, computed from the fields the term occurs in.
	 */
	public double weight(String term, FieldWeights weights) {
		TermEntry entry = terms.get(term);
		if (entry == null) {
			return 0.0;
		}
		double weight = 0.0;
		for (String field : entry.fields()) {
			weight += weights.weight(field);
		}
		return weight;
	}

	/**
	 * Per-term data.
	 *
	 * @param weight    sum of the tier weights of the fields containing the term
	 * @param positions sorted token positions across all fields
	 * @param fields    fields containing the term, in configured field order
	 */
	public record TermEntry(double weight, List<Integer> positions, List<String> fields) implements Serializable {

		public TermEntry {
			positions = Collections.unmodifiableList(new ArrayList<>(positions));
			fields = Collections.unmodifiableList(new ArrayList<>(fields));
		}

		public int frequency() {
			return positions.size();
		}

		@Serial
		private static final long serialVersionUID = 1L;
	}

	static SearchVector of(Map<String, TermEntry> terms, int length) {
		return new SearchVector(new TreeMap<>(terms), length);
	}

	@Serial
	private static final long serialVersionUID = 1L;
}
