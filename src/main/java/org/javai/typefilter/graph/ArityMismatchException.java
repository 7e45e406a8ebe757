package org.javai.typefilter.graph;

/**
 * A reference supplies a different number of type arguments than the target declares.
 */
public class ArityMismatchException extends TypeGraphException {

	private final String target;
	private final int expected;
	private final int actual;

	public ArityMismatchException(String declaration, String target, int expected, int actual) {
		super(declaration, "Type '" + declaration + "' references '" + target + "' with " + actual
				+ " type argument(s) but " + expected + " expected");
		this.target = target;
		this.expected = expected;
		this.actual = actual;
	}

	public String target() {
		return target;
	}

	public int expected() {
		return expected;
	}

	public int actual() {
		return actual;
	}
}
