package org.javai.typefilter.graph;

/**
 * A reference names neither a declaration, a built-in type nor a parameter in scope.
 */
public class DanglingReferenceException extends TypeGraphException {

	private final String target;

	public DanglingReferenceException(String declaration, String target) {
		super(declaration, "Type '" + declaration + "' references unknown type '" + target + "'");
		this.target = target;
	}

	public String target() {
		return target;
	}
}
