package org.cellar.core.vocabulary;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Append-only set of vocabulary terms with a trigram inverted index.
 */
public interface VocabularyStore extends AutoCloseable {
	/**
	 * Inserts the term and its trigrams unless the term is already present.
	 *
	 * @return {@code true} if the term was new
	 */
	boolean insertIfAbsent(String term, Set<String> trigrams) throws IOException;

	/**
	 * Terms sharing at least one of the given trigrams, with the number shared.
	 */
	List<TrigramMatch> findBySharedTrigrams(Set<String> trigrams) throws IOException;

	boolean contains(String term) throws IOException;

	int size() throws IOException;

	@Override
	void close() throws IOException;
}
