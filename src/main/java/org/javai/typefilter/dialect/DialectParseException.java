package org.javai.typefilter.dialect;

import org.javai.typefilter.TypeFilterException;

/**
 * Exception thrown when dialect source text is malformed.
 * Carries the 1-based position of the offending character or token.
 */
public class DialectParseException extends TypeFilterException {

	private final int line;
	private final int column;

	public DialectParseException(String message, int line, int column) {
		super(message + " at line " + line + ", column " + column);
		this.line = line;
		this.column = column;
	}

	public DialectParseException(String message, DialectToken token) {
		this(message, token.line(), token.column());
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}
}
