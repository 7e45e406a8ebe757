package org.javai.typefilter.config;

import java.util.Objects;
import java.util.Set;
import org.javai.typefilter.index.TermNormalizer;

/**
 * Settings for loading and pruning a schema.
 *
 * @param root name of the declaration pruned output is rooted at
 * @param pathCompression inline trivial declarations after pruning
 * @param stemming reduce indexed and queried words to their stems
 * @param stopWords words ignored in queries and multi-word literals, none by default
 * @param lossless write {@code LITERAL<...>} templates in full instead of as their label
 */
public record TypeFilterConfig(String root, boolean pathCompression, boolean stemming, Set<String> stopWords,
		boolean lossless) {

	public static final String DEFAULT_ROOT = "Cart";

	public TypeFilterConfig {
		Objects.requireNonNull(root, "root must not be null");
		if (root.isBlank()) {
			throw new IllegalArgumentException("root must not be blank");
		}
		stopWords = stopWords != null ? Set.copyOf(stopWords) : Set.of();
	}

	public static TypeFilterConfig defaults() {
		return new TypeFilterConfig(DEFAULT_ROOT, true, true, Set.of(), false);
	}

	public TypeFilterConfig withRoot(String newRoot) {
		return new TypeFilterConfig(newRoot, pathCompression, stemming, stopWords, lossless);
	}

	public TypeFilterConfig withPathCompression(boolean enabled) {
		return new TypeFilterConfig(root, enabled, stemming, stopWords, lossless);
	}

	public TypeFilterConfig withLossless(boolean enabled) {
		return new TypeFilterConfig(root, pathCompression, stemming, stopWords, enabled);
	}

	public TermNormalizer normalizer() {
		return new TermNormalizer(stopWords, stemming);
	}
}
