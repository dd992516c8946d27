package org.cellar.core.highlight;

import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.text.Token;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Marks the surface text of tokens whose normalized term matches a query term.
 *
 * <p>Text outside marked spans is copied unchanged. Overlapping spans are merged so a token is never
 * wrapped twice. When nothing matches, the original text is returned.</p>
 */
public class Highlighter {

	private final TextAnalyzer textAnalyzer;
	private final AnalysisProfile profile;

	public Highlighter(TextAnalyzer textAnalyzer, AnalysisProfile profile) {
		this.textAnalyzer = textAnalyzer;
		this.profile = profile;
	}

	/**
	 * @param fieldText   original field text, may be null
	 * @param queryTerms  raw query words; they are normalized with the same profile as the field
	 * @param startMarker inserted before each matched span
	 * @param endMarker   inserted after each matched span
	 */
	public String highlight(String fieldText, Collection<String> queryTerms, String startMarker, String endMarker) {
		if (fieldText == null || fieldText.isEmpty() || queryTerms == null || queryTerms.isEmpty()) {
			return fieldText;
		}

		Set<String> normalized = normalize(queryTerms);
		if (normalized.isEmpty()) {
			return fieldText;
		}

		List<int[]> spans = matchedSpans(fieldText, normalized);
		if (spans.isEmpty()) {
			return fieldText;
		}

		StringBuilder out = new StringBuilder(fieldText.length() + spans.size() * (startMarker.length() + endMarker.length()));
		int cursor = 0;
		for (int[] span : spans) {
			out.append(fieldText, cursor, span[0]);
			out.append(startMarker);
			out.append(fieldText, span[0], span[1]);
			out.append(endMarker);
			cursor = span[1];
		}
		out.append(fieldText, cursor, fieldText.length());
		return out.toString();
	}

	/**
	 * Whether any token of the text matches one of the query terms.
	 */
	public boolean matches(String fieldText, Collection<String> queryTerms) {
		if (fieldText == null || queryTerms == null || queryTerms.isEmpty()) {
			return false;
		}
		return !matchedSpans(fieldText, normalize(queryTerms)).isEmpty();
	}

	private Set<String> normalize(Collection<String> queryTerms) {
		Set<String> normalized = new HashSet<>();
		for (String term : queryTerms) {
			normalized.addAll(textAnalyzer.terms(term, profile));
		}
		return normalized;
	}

	private List<int[]> matchedSpans(String fieldText, Set<String> terms) {
		List<int[]> spans = new ArrayList<>();
		for (Token token : textAnalyzer.tokenize(fieldText, profile)) {
			if (terms.contains(token.term())) {
				spans.add(new int[] {token.startOffset(), token.endOffset()});
			}
		}
		spans.sort((a, b) -> a[0] != b[0] ? Integer.compare(a[0], b[0]) : Integer.compare(a[1], b[1]));
		return merge(spans);
	}

	static List<int[]> merge(List<int[]> sorted) {
		List<int[]> merged = new ArrayList<>();
		for (int[] span : sorted) {
			if (!merged.isEmpty()) {
				int[] last = merged.get(merged.size() - 1);
				if (span[0] < last[1]) {
					last[1] = Math.max(last[1], span[1]);
					continue;
				}
			}
			merged.add(new int[] {span[0], span[1]});
		}
		return merged;
	}
}
