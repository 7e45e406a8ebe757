package org.javai.typefilter.index;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.tartarus.snowball.ext.EnglishStemmer;

/**
 * Turns free text into the terms stored in and looked up from a {@link LiteralIndex}.
 * <p>
 * Text is lowercased, split on whitespace, stripped of punctuation at word edges, filtered
 * against an optional stop word list and stemmed with the Snowball English stemmer, so that
 * "Jalapeños" and "jalapeño" produce the same term. The input string is never modified.
 * <p>
 * Stop words only thin out text. A literal made entirely of stop words keeps all of its
 * words, see {@link #literalTerms(String)}.
 * <p>
 * Instances are immutable. A fresh stemmer is created per call because Snowball
 * stemmers keep per-word state.
 */
public final class TermNormalizer {

	private final Set<String> stopWords;
	private final boolean stemming;

	public TermNormalizer(Set<String> stopWords, boolean stemming) {
		this.stopWords = stopWords != null ? Set.copyOf(stopWords) : Set.of();
		this.stemming = stemming;
	}

	public static TermNormalizer standard() {
		return new TermNormalizer(Set.of(), true);
	}

	/**
	 * Normalized terms of the text, in order of appearance, without duplicates.
	 */
	public Set<String> terms(String text) {
		return new LinkedHashSet<>(normalize(text));
	}

	/**
	 * Terms of a literal value, template label or alias, or of a value taken from the cart.
	 * Falls back to every word when the stop words would leave none, so that each
	 * non-blank literal can be matched.
	 */
	public Set<String> literalTerms(String text) {
		Set<String> terms = terms(text);
		if (terms.isEmpty() && !stopWords.isEmpty()) {
			terms.addAll(normalize(text, false));
		}
		return terms;
	}

	/**
	 * Normalized terms of the text, in order of appearance, duplicates kept.
	 */
	public List<String> normalize(String text) {
		return normalize(text, true);
	}

	private List<String> normalize(String text, boolean dropStopWords) {
		List<String> result = new ArrayList<>();
		if (text == null || text.isBlank()) {
			return result;
		}
		EnglishStemmer stemmer = stemming ? new EnglishStemmer() : null;
		for (String raw : text.toLowerCase(Locale.ROOT).split("\\s+")) {
			String word = trimPunctuation(raw);
			if (word.isEmpty() || (dropStopWords && stopWords.contains(word))) {
				continue;
			}
			result.add(stemmer != null ? stem(stemmer, word) : word);
		}
		return result;
	}

	public Set<String> stopWords() {
		return stopWords;
	}

	public boolean stemming() {
		return stemming;
	}

	private static String stem(EnglishStemmer stemmer, String word) {
		stemmer.setCurrent(word);
		stemmer.stem();
		return stemmer.getCurrent();
	}

	private static String trimPunctuation(String word) {
		int start = 0;
		int end = word.length();
		while (start < end && !Character.isLetterOrDigit(word.codePointAt(start))) {
			start += Character.charCount(word.codePointAt(start));
		}
		while (end > start && !Character.isLetterOrDigit(word.codePointBefore(end))) {
			end -= Character.charCount(word.codePointBefore(end));
		}
		return word.substring(start, end);
	}
}
