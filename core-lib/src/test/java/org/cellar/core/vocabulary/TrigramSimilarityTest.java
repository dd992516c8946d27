package org.cellar.core.vocabulary;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TrigramSimilarityTest {

	@Test
	public void testPaddedTrigrams() {
		assertEquals(Set.of("  c", " ca", "cat", "at "), TrigramSimilarity.trigrams("cat"));
		assertEquals(TrigramSimilarity.trigrams("cat"), TrigramSimilarity.trigrams("CAT"));
		assertTrue(TrigramSimilarity.trigrams("").isEmpty());
	}

	@Test
	public void testSymmetric() {
		List<String> words = List.of("cabernet", "cabernay", "merlot", "malbec", "sauvignon", "sangiovese", "a");
		for (String a : words) {
			for (String b : words) {
				assertEquals(TrigramSimilarity.similarity(a, b), TrigramSimilarity.similarity(b, a), 1e-12);
			}
		}
	}

	@Test
	public void testBounds() {
		assertEquals(1.0, TrigramSimilarity.similarity("merlot", "merlot"), 1e-12);
		assertEquals(0.0, TrigramSimilarity.similarity("merlot", "zinfandel"), 1e-12);
		assertEquals(0.0, TrigramSimilarity.similarity("", ""), 1e-12);
	}

	@Test
	public void testMisspellingAboveDefaultThreshold() {
		double similarity = TrigramSimilarity.similarity("cabernay", "cabernet");
		assertEquals(0.5, similarity, 1e-12);
		assertTrue(similarity >= 0.3);
	}
}
