package org.javai.typefilter.prune;

import org.javai.typefilter.TypeFilterException;

/**
 * The query matched nothing that keeps the root declaration inhabited, so pruning would
 * produce an empty schema. Callers decide on a fallback, typically the unpruned schema.
 */
public class RootEliminatedException extends TypeFilterException {

	private final String root;

	public RootEliminatedException(String root) {
		super("Pruning eliminated root type '" + root + "'");
		this.root = root;
	}

	public String root() {
		return root;
	}
}
