package org.javai.typefilter.graph;

import org.javai.typefilter.TypeFilterException;

/**
 * A schema parsed cleanly but its declarations do not form a valid graph.
 */
public abstract class TypeGraphException extends TypeFilterException {

	private final String declaration;

	protected TypeGraphException(String declaration, String message) {
		super(message);
		this.declaration = declaration;
	}

	/**
	 * Name of the declaration in which the problem was found.
	 */
	public String declaration() {
		return declaration;
	}
}
