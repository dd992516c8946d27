package org.cellar.core.vocabulary;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process {@link VocabularyStore}.
 */
public class InMemoryVocabularyStore implements VocabularyStore {
	private final Map<String, Integer> terms = new ConcurrentHashMap<>();
	private final Map<String, Set<String>> trigramIndex = new ConcurrentHashMap<>();

	@Override
	public boolean insertIfAbsent(String term, Set<String> trigrams) {
		if (terms.putIfAbsent(term, trigrams.size()) != null) {
			return false;
		}
		for (String trigram : trigrams) {
			trigramIndex.computeIfAbsent(trigram, t -> ConcurrentHashMap.newKeySet()).add(term);
		}
		return true;
	}

	@Override
	public List<TrigramMatch> findBySharedTrigrams(Set<String> trigrams) {
		Map<String, Integer> shared = new HashMap<>();
		for (String trigram : trigrams) {
			Set<String> holders = trigramIndex.get(trigram);
			if (holders == null) {
				continue;
			}
			for (String term : holders) {
				shared.merge(term, 1, Integer::sum);
			}
		}

		List<TrigramMatch> matches = new ArrayList<>(shared.size());
		shared.forEach((term, count) -> matches.add(new TrigramMatch(term, terms.getOrDefault(term, count), count)));
		return matches;
	}

	@Override
	public boolean contains(String term) {
		return terms.containsKey(term);
	}

	@Override
	public int size() {
		return terms.size();
	}

	@Override
	public void close() {
		// nothing to release
	}
}
