package org.cellar.core.vector;

import org.cellar.core.model.CatalogRecord;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.text.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts a record's weighted text fields into a {@link SearchVector}.
 *
 * <p>Each field is tokenized on its own. Positions of a field are shifted past the last position of the
 * previous field, and a term occurring in several fields gets the sum of those fields' weights.</p>
 */
public class SearchVectorBuilder {
	private static final Logger logger = LoggerFactory.getLogger(SearchVectorBuilder.class);

	private final TextAnalyzer textAnalyzer;
	private final AnalysisProfile profile;

	public SearchVectorBuilder(TextAnalyzer textAnalyzer, AnalysisProfile profile) {
		this.textAnalyzer = textAnalyzer;
		this.profile = profile;
	}

	public SearchVector build(CatalogRecord record, FieldWeights fieldWeights) {
		try {
			return buildVector(record, fieldWeights);
		} catch (UncheckedIOException | IllegalArgumentException e) {
			logger.warn("Could not build search vector for record {}, indexing it with an empty vector: {}",
					record.id(), e.getMessage());
			return SearchVector.empty();
		}
	}

	private SearchVector buildVector(CatalogRecord record, FieldWeights fieldWeights) {
		Map<String, Accumulator> accumulators = new TreeMap<>();
		int offset = 0;
		int length = 0;

		for (String field : fieldWeights.fields()) {
			List<Token> tokens = textAnalyzer.tokenize(record.text(field), profile);
			if (tokens.isEmpty()) {
				continue;
			}

			int lastPosition = 0;
			for (Token token : tokens) {
				int position = offset + token.position();
				accumulators.computeIfAbsent(token.term(), t -> new Accumulator()).add(field, position);
				lastPosition = Math.max(lastPosition, token.position());
			}

			length += tokens.size();
			offset += lastPosition + 1;
		}

		Map<String, SearchVector.TermEntry> entries = new LinkedHashMap<>();
		accumulators.forEach((term, acc) -> entries.put(term, acc.toEntry(fieldWeights)));

		logger.debug("Built vector for record {}: {} terms, {} tokens", record.id(), entries.size(), length);
		return SearchVector.of(entries, length);
	}

	private static final class Accumulator {
		private final List<Integer> positions = new ArrayList<>();
		private final List<String> fields = new ArrayList<>();

		void add(String field, int position) {
			positions.add(position);
			if (!fields.contains(field)) {
				fields.add(field);
			}
		}

		SearchVector.TermEntry toEntry(FieldWeights fieldWeights) {
			double weight = 0.0;
			for (String field : fields) {
				weight += fieldWeights.weight(field);
			}
			List<Integer> sorted = new ArrayList<>(positions);
			sorted.sort(null);
			return new SearchVector.TermEntry(weight, sorted, fields);
		}
	}
}
