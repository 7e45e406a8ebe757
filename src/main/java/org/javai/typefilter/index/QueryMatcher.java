package org.javai.typefilter.index;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the {@link LiveSet} for a query: a free-text phrase plus the literal values
 * already present in the cart.
 * <p>
 * Every word of the phrase is normalized as the index was built, and each cart literal
 * exactly as an indexed literal, so a value already in the cart always matches itself. An occurrence is live when any of its indexed terms (including template
 * alias terms) equals any query term. Matching is exact on stems.
 */
public final class QueryMatcher {

	private static final Logger logger = LoggerFactory.getLogger(QueryMatcher.class);

	private final LiteralIndex index;

	public QueryMatcher(LiteralIndex index) {
		this.index = Objects.requireNonNull(index, "index must not be null");
	}

	public LiveSet match(String phrase, List<String> cartLiterals) {
		Set<String> terms = queryTerms(phrase, cartLiterals);
		Set<LiteralKey> live = new LinkedHashSet<>();
		for (String term : terms) {
			live.addAll(index.lookup(term));
		}
		logger.debug("Query terms {} matched {} literal occurrence(s)", terms, live.size());
		return LiveSet.of(live);
	}

	public LiveSet match(String phrase) {
		return match(phrase, List.of());
	}

	/**
	 * The normalized terms a query contributes, phrase first, then cart literals in order.
	 */
	public Set<String> queryTerms(String phrase, List<String> cartLiterals) {
		TermNormalizer normalizer = index.normalizer();
		Set<String> terms = new LinkedHashSet<>(normalizer.terms(phrase));
		if (cartLiterals != null) {
			for (String literal : cartLiterals) {
				terms.addAll(normalizer.literalTerms(literal));
			}
		}
		return terms;
	}
}
