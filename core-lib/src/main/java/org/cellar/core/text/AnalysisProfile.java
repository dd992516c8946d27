package org.cellar.core.text;

import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.en.EnglishAnalyzer;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Describes how raw text is normalized into terms.
 *
 * @param name      profile name, used in logs
 * @param stopWords lower-cased words dropped from the token stream
 * @param stemming  whether the Porter stemmer is applied
 */
public record AnalysisProfile(String name, Set<String> stopWords, boolean stemming) {

	public AnalysisProfile {
		stopWords = Collections.unmodifiableSet(new TreeSet<>(stopWords));
	}

	/**
	 * Stemmed English profile used for vectors, highlighting and the mirror index.
	 */
	public static AnalysisProfile english(Set<String> stopWords) {
		return new AnalysisProfile("english", stopWords, true);
	}

	/**
	 * Unstemmed profile used to collect suggestion vocabulary.
	 */
	public static AnalysisProfile vocabulary(Set<String> stopWords) {
		return new AnalysisProfile("vocabulary", stopWords, false);
	}

	public static Set<String> defaultStopWords() {
		Set<String> words = new TreeSet<>();
		CharArraySet set = EnglishAnalyzer.ENGLISH_STOP_WORDS_SET;
		for (Object word : set) {
			words.add(new String((char[]) word));
		}
		return words;
	}

	/**
	 * Parse stop words from comma-separated string
	 */
	public static Set<String> parseStopWords(String stopWordsStr) {
		if (stopWordsStr == null || stopWordsStr.trim().isEmpty()) {
			return new TreeSet<>();
		}

		Set<String> stopWords = new TreeSet<>();
		for (String word : stopWordsStr.split(",")) {
			String cleaned = word.trim().toLowerCase();
			if (!cleaned.isEmpty()) {
				stopWords.add(cleaned);
			}
		}

		return stopWords;
	}
}
