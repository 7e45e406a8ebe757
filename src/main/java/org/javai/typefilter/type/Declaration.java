package org.javai.typefilter.type;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One named type definition: {@code type Name<P1 extends C1, ...> = body;}.
 *
 * @param name unique declaration name
 * @param params ordered generic parameters
 * @param body the defining type expression
 * @param hints display-only {@code Hint:} comments attached to this declaration
 */
public record Declaration(String name, List<TypeParam> params, TypeExpr body, List<String> hints) {

	public Declaration {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(body, "body must not be null");
		params = params != null ? List.copyOf(params) : List.of();
		hints = hints != null ? List.copyOf(hints) : List.of();
	}

	public Declaration(String name, TypeExpr body) {
		this(name, List.of(), body, List.of());
	}

	public boolean isGeneric() {
		return !params.isEmpty();
	}

	public Set<String> paramNames() {
		return params.stream().map(TypeParam::name).collect(Collectors.toUnmodifiableSet());
	}

	public Declaration withBody(List<TypeParam> newParams, TypeExpr newBody) {
		return new Declaration(name, newParams, newBody, hints);
	}
}
