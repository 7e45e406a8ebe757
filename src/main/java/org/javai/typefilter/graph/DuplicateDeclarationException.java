package org.javai.typefilter.graph;

/**
 * Two declarations share a name.
 */
public class DuplicateDeclarationException extends TypeGraphException {

	public DuplicateDeclarationException(String name) {
		super(name, "Type '" + name + "' is declared more than once");
	}
}
