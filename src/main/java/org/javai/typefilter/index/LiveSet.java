package org.javai.typefilter.index;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

/**
 * The literal occurrences considered relevant to one query. Immutable.
 */
public final class LiveSet {

	private static final LiveSet NONE = new LiveSet(Set.of());

	private final Set<LiteralKey> keys;

	private LiveSet(Set<LiteralKey> keys) {
		this.keys = keys;
	}

	public static LiveSet none() {
		return NONE;
	}

	public static LiveSet of(Collection<LiteralKey> keys) {
		return keys.isEmpty() ? NONE : new LiveSet(Set.copyOf(keys));
	}

	public static LiveSet of(LiteralKey... keys) {
		return of(Arrays.asList(keys));
	}

	public boolean contains(LiteralKey key) {
		return keys.contains(key);
	}

	public boolean contains(String declaration, String value) {
		return keys.contains(new LiteralKey(declaration, value));
	}

	public Set<LiteralKey> keys() {
		return keys;
	}

	public int size() {
		return keys.size();
	}

	public boolean isEmpty() {
		return keys.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		return this == o || (o instanceof LiveSet other && keys.equals(other.keys));
	}

	@Override
	public int hashCode() {
		return keys.hashCode();
	}

	@Override
	public String toString() {
		return "LiveSet" + keys;
	}
}
