package org.javai.typefilter.type;

import java.util.Objects;
import java.util.Optional;

/**
 * A generic parameter of a {@link Declaration}.
 *
 * @param name the parameter name
 * @param constraint the {@code extends} bound, or null when unconstrained
 */
public record TypeParam(String name, TypeExpr constraint) {

	public TypeParam {
		Objects.requireNonNull(name, "name must not be null");
	}

	public static TypeParam of(String name) {
		return new TypeParam(name, null);
	}

	public Optional<TypeExpr> constraintType() {
		return Optional.ofNullable(constraint);
	}
}
