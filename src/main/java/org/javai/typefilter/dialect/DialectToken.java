package org.javai.typefilter.dialect;

/**
 * Represents a token of the type declaration dialect.
 *
 * @param type the token type
 * @param value the token value (unescaped text for strings, hint text for hints)
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 */
public record DialectToken(TokenType type, String value, int line, int column) {

	public enum TokenType {
		IDENTIFIER,    // names and keywords
		STRING,        // "double" or 'single' quoted
		NUMBER,        // integers and decimals, optionally signed
		LT,            // <
		GT,            // >
		LBRACE,        // {
		RBRACE,        // }
		LBRACKET,      // [
		RBRACKET,      // ]
		LPAREN,        // (
		RPAREN,        // )
		COMMA,         // ,
		SEMICOLON,     // ;
		COLON,         // :
		QUESTION,      // ?
		PIPE,          // |
		EQUALS,        // =
		HINT,          // a comment starting with "Hint:"
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case NUMBER, IDENTIFIER, HINT -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isIdentifier(String expected) {
		return type == TokenType.IDENTIFIER && value.equals(expected);
	}

	/**
	 * Human readable location, used in syntax error messages.
	 */
	public String location() {
		return "line " + line + ", column " + column;
	}
}
