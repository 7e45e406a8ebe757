package org.javai.typefilter.type;

import java.util.Objects;

/**
 * A named member of a {@link TypeExpr.Struct}.
 *
 * @param name the field name
 * @param optional true when declared with {@code ?}
 * @param type the field type
 */
public record Field(String name, boolean optional, TypeExpr type) {

	public Field {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(type, "type must not be null");
	}

	public Field withType(TypeExpr newType) {
		return newType == type ? this : new Field(name, optional, newType);
	}
}
