package org.javai.typefilter.graph;

/**
 * A struct lists the same field name more than once.
 */
public class DuplicateFieldException extends TypeGraphException {

	private final String field;

	public DuplicateFieldException(String declaration, String field) {
		super(declaration, "Type '" + declaration + "' declares field '" + field + "' twice");
		this.field = field;
	}

	public String field() {
		return field;
	}
}
