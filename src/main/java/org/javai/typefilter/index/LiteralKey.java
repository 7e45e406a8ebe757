package org.javai.typefilter.index;

import java.util.Objects;

/**
 * Identity of a literal occurrence: the declaration that contains it and its value
 * (the label, for a template).
 */
public record LiteralKey(String declaration, String value) {

	public LiteralKey {
		Objects.requireNonNull(declaration, "declaration must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public String toString() {
		return declaration + ":\"" + value + "\"";
	}
}
