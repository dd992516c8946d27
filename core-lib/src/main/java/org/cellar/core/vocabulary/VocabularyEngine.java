package org.cellar.core.vocabulary;

import org.cellar.core.error.ValidationException;
import org.cellar.core.model.CatalogRecord;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Maintains the deduplicated vocabulary and answers "closest known term" queries by trigram similarity.
 *
 * <p>The vocabulary only grows: terms that disappear from records on update or delete stay known.</p>
 */
public class VocabularyEngine {
	private static final Logger logger = LoggerFactory.getLogger(VocabularyEngine.class);

	private static final Pattern WORD_PATTERN = Pattern.compile("\\p{L}+");
	private static final Comparator<Suggestion> RANKING = Comparator
			.comparingDouble(Suggestion::similarity).reversed()
			.thenComparing(Suggestion::term);

	private final VocabularyStore store;
	private final TextAnalyzer textAnalyzer;
	private final AnalysisProfile profile;
	private final Collection<String> textFields;
	private final int minWordLength;
	private final int maxWordLength;
	private final double defaultMinSimilarity;

	public VocabularyEngine(
			VocabularyStore store,
			TextAnalyzer textAnalyzer,
			AnalysisProfile profile,
			Collection<String> textFields,
			int minWordLength,
			int maxWordLength,
			double defaultMinSimilarity
	) {
		this.store = store;
		this.textAnalyzer = textAnalyzer;
		this.profile = profile;
		this.textFields = List.copyOf(textFields);
		this.minWordLength = minWordLength;
		this.maxWordLength = maxWordLength;
		this.defaultMinSimilarity = checkSimilarity(defaultMinSimilarity);
	}

	/**
	 * Adds every new term of the record's text fields to the vocabulary. Known terms are skipped silently.
	 *
	 * @return number of terms that were new
	 */
	public int ingest(CatalogRecord record) throws IOException {
		Set<String> words = extractWords(record);
		int added = 0;
		for (String word : words) {
			if (store.insertIfAbsent(word, TrigramSimilarity.trigrams(word))) {
				added++;
			}
		}
		logger.debug("Vocabulary ingest of record {}: {} words, {} new", record.id(), words.size(), added);
		return added;
	}

	public List<Suggestion> suggest(String queryTerm, int maxResults) throws IOException {
		return suggest(queryTerm, defaultMinSimilarity, maxResults);
	}

	/**
	 * Known terms whose trigram similarity to {@code queryTerm} is at least {@code minSimilarity}, best first,
	 * ties broken alphabetically.
	 */
	public List<Suggestion> suggest(String queryTerm, double minSimilarity, int maxResults) throws IOException {
		checkSimilarity(minSimilarity);
		if (maxResults <= 0) {
			throw new ValidationException("max results must be positive, got " + maxResults);
		}
		if (queryTerm == null || queryTerm.isBlank()) {
			return List.of();
		}

		Set<String> probe = TrigramSimilarity.trigrams(textAnalyzer.normalize(queryTerm, profile));
		List<Suggestion> suggestions = new ArrayList<>();
		for (TrigramMatch match : store.findBySharedTrigrams(probe)) {
			double similarity = TrigramSimilarity.jaccard(match.shared(), probe.size(), match.trigramCount());
			if (similarity >= minSimilarity) {
				suggestions.add(new Suggestion(match.term(), similarity));
			}
		}

		suggestions.sort(RANKING);
		return suggestions.size() > maxResults ? List.copyOf(suggestions.subList(0, maxResults)) : suggestions;
	}

	public double defaultMinSimilarity() {
		return defaultMinSimilarity;
	}

	public int size() throws IOException {
		return store.size();
	}

	private Set<String> extractWords(CatalogRecord record) {
		Set<String> words = new TreeSet<>();
		for (String field : textFields) {
			for (String term : textAnalyzer.terms(record.text(field), profile)) {
				if (isValidWord(term)) {
					words.add(term);
				}
			}
		}
		return words;
	}

	/**
	 * Check if a word is valid for the vocabulary
	 */
	private boolean isValidWord(String word) {
		if (word.length() < minWordLength || word.length() > maxWordLength) {
			return false;
		}
		return WORD_PATTERN.matcher(word).matches();
	}

	private static double checkSimilarity(double similarity) {
		if (!(similarity > 0.0 && similarity <= 1.0)) {
			throw new ValidationException("similarity threshold must be in (0, 1], got " + similarity);
		}
		return similarity;
	}
}
