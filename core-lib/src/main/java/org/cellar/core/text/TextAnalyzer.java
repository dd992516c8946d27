package org.cellar.core.text;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Breaks text into normalized terms.
 *
 * <p>Pure and deterministic: the same text and profile always produce the same tokens. Null or blank input
 * yields an empty list.</p>
 */
public class TextAnalyzer {
	private static final String FIELD = "text";

	private final Map<AnalysisProfile, Analyzer> analyzers = new ConcurrentHashMap<>();

	public List<Token> tokenize(String text, AnalysisProfile profile) {
		if (text == null || text.isBlank()) {
			return Collections.emptyList();
		}

		Analyzer analyzer = analyzers.computeIfAbsent(profile, CatalogAnalyzer::new);
		List<Token> tokens = new ArrayList<>();

		try (TokenStream stream = analyzer.tokenStream(FIELD, text)) {
			CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
			PositionIncrementAttribute increment = stream.addAttribute(PositionIncrementAttribute.class);
			OffsetAttribute offset = stream.addAttribute(OffsetAttribute.class);

			stream.reset();
			int position = -1;
			while (stream.incrementToken()) {
				position += increment.getPositionIncrement();
				tokens.add(new Token(term.toString(), position, offset.startOffset(), offset.endOffset()));
			}
			stream.end();
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to analyze text with profile " + profile.name(), e);
		}

		return tokens;
	}

	/**
	 * Terms only, in token order (duplicates kept).
	 */
	public List<String> terms(String text, AnalysisProfile profile) {
		List<Token> tokens = tokenize(text, profile);
		List<String> terms = new ArrayList<>(tokens.size());
		for (Token token : tokens) {
			terms.add(token.term());
		}
		return terms;
	}

	/**
	 * Lower-cases and folds a single query term the way indexed terms are folded, without stemming or
	 * stop word removal.
	 */
	public String normalize(String term, AnalysisProfile profile) {
		return analyzer(profile).normalize("", term.trim()).utf8ToString();
	}

	/**
	 * Analyzer backing the profile, shared with components that talk to Lucene directly.
	 */
	public Analyzer analyzer(AnalysisProfile profile) {
		return analyzers.computeIfAbsent(profile, CatalogAnalyzer::new);
	}
}
