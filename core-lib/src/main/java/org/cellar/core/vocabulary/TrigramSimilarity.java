package org.cellar.core.vocabulary;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Trigram-set Jaccard similarity.
 *
 * <p>Each word is lower-cased and padded with two blanks in front and one behind before it is cut into
 * overlapping 3-character shingles, so {@code "cat"} yields {@code "  c", " ca", "cat", "at "}. Characters
 * that are not letters or digits separate words.</p>
 */
public final class TrigramSimilarity {
	private TrigramSimilarity() {}

	public static Set<String> trigrams(String text) {
		Set<String> trigrams = new TreeSet<>();
		if (text == null) {
			return trigrams;
		}

		for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
			if (word.isEmpty()) {
				continue;
			}
			String padded = "  " + word + " ";
			for (int i = 0; i + 3 <= padded.length(); i++) {
				trigrams.add(padded.substring(i, i + 3));
			}
		}
		return trigrams;
	}

	/**
	 * {@code |A ∩ B| / |A ∪ B|} over the trigram sets of both strings; 0 when both sets are empty.
	 */
	public static double similarity(String a, String b) {
		return similarity(trigrams(a), trigrams(b));
	}

	public static double similarity(Set<String> a, Set<String> b) {
		if (a.isEmpty() && b.isEmpty()) {
			return 0.0;
		}
		int shared = 0;
		Set<String> smaller = a.size() <= b.size() ? a : b;
		Set<String> larger = smaller == a ? b : a;
		for (String trigram : smaller) {
			if (larger.contains(trigram)) {
				shared++;
			}
		}
		return jaccard(shared, a.size(), b.size());
	}

	/**
	 * Jaccard index from the size of both sets and the size of their intersection.
	 */
	public static double jaccard(int shared, int sizeA, int sizeB) {
		int union = sizeA + sizeB - shared;
		return union == 0 ? 0.0 : (double) shared / union;
	}
}
