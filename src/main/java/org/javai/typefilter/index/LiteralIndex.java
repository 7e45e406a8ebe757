package org.javai.typefilter.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Inverted index from normalized terms to the literal occurrences that contain them.
 * <p>
 * Built once per schema by {@link LiteralIndexer} and immutable afterwards, so a single
 * index can serve any number of concurrent queries. The normalizer used at build time is
 * kept with the index so that queries are normalized identically.
 */
public final class LiteralIndex {

	private final Map<String, Set<LiteralKey>> postings;
	private final Map<LiteralKey, Set<String>> termsByKey;
	private final TermNormalizer normalizer;

	LiteralIndex(Map<LiteralKey, Set<String>> termsByKey, TermNormalizer normalizer) {
		Map<String, Set<LiteralKey>> inverted = new LinkedHashMap<>();
		Map<LiteralKey, Set<String>> forward = new LinkedHashMap<>();
		termsByKey.forEach((key, terms) -> {
			forward.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(terms)));
			for (String term : terms) {
				inverted.computeIfAbsent(term, t -> new LinkedHashSet<>()).add(key);
			}
		});
		inverted.replaceAll((term, keys) -> Collections.unmodifiableSet(keys));
		this.postings = Collections.unmodifiableMap(inverted);
		this.termsByKey = Collections.unmodifiableMap(forward);
		this.normalizer = normalizer;
	}

	/**
	 * Occurrences indexed under the given, already normalized, term.
	 */
	public Set<LiteralKey> lookup(String term) {
		return postings.getOrDefault(term, Set.of());
	}

	/**
	 * Terms indexed for an occurrence, including those of template aliases.
	 */
	public Set<String> termsOf(LiteralKey key) {
		return termsByKey.getOrDefault(key, Set.of());
	}

	public Set<LiteralKey> keys() {
		return termsByKey.keySet();
	}

	public Set<String> terms() {
		return postings.keySet();
	}

	public TermNormalizer normalizer() {
		return normalizer;
	}

	public int size() {
		return termsByKey.size();
	}
}
