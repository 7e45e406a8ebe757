package org.javai.typefilter.dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.javai.typefilter.dialect.DialectToken.TokenType;

/**
 * Tokenizer for the type declaration dialect.
 * Converts input text into a stream of tokens.
 * <p>
 * Comments ({@code // ...} and {@code /* ... *}{@code /}) are treated as whitespace, except
 * those whose text starts with {@code Hint:}, which become {@link TokenType#HINT} tokens
 * carrying the text after the prefix.
 */
public class DialectTokenizer {

	private static final String HINT_PREFIX = "Hint:";
	private static final Pattern LEADING_STARS = Pattern.compile("^[\\s*]*");

	private final String input;
	private int pos = 0;
	private int line = 1;
	private int lineStart = 0;

	public DialectTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws DialectParseException if invalid syntax is encountered
	 */
	public List<DialectToken> tokenize() {
		List<DialectToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			if (peek() == '/' && peekNext() == '/') {
				addIfHint(tokens, scanLineComment());
			} else if (peek() == '/' && peekNext() == '*') {
				addIfHint(tokens, scanBlockComment());
			} else {
				tokens.add(nextToken());
			}
		}

		tokens.add(token(TokenType.EOF, "", pos));
		return tokens;
	}

	private DialectToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '<' -> single(TokenType.LT);
			case '>' -> single(TokenType.GT);
			case '{' -> single(TokenType.LBRACE);
			case '}' -> single(TokenType.RBRACE);
			case '[' -> single(TokenType.LBRACKET);
			case ']' -> single(TokenType.RBRACKET);
			case '(' -> single(TokenType.LPAREN);
			case ')' -> single(TokenType.RPAREN);
			case ',' -> single(TokenType.COMMA);
			case ';' -> single(TokenType.SEMICOLON);
			case ':' -> single(TokenType.COLON);
			case '?' -> single(TokenType.QUESTION);
			case '|' -> single(TokenType.PIPE);
			case '=' -> single(TokenType.EQUALS);
			case '"', '\'' -> scanString();
			default -> {
				if (isDigit(c) || (c == '-' && isDigit(peekNext()))) {
					yield scanNumber();
				} else if (isIdentifierStart(c)) {
					yield scanIdentifier();
				} else {
					throw new DialectParseException("Unexpected character '" + c + "'", line, column(start));
				}
			}
		};
	}

	private DialectToken single(TokenType type) {
		int start = pos;
		char c = advance();
		return token(type, String.valueOf(c), start);
	}

	private DialectToken scanString() {
		int start = pos;
		int startLine = line;
		int startColumn = column(start);
		char quote = advance();

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != quote) {
			char c = advance();
			if (c == '\n') {
				throw new DialectParseException("Unterminated string", startLine, startColumn);
			}
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				switch (next) {
					case 'n' -> sb.append('\n');
					case 't' -> sb.append('\t');
					case 'r' -> sb.append('\r');
					case 'b' -> sb.append('\b');
					case 'f' -> sb.append('\f');
					case 'u' -> sb.append(scanUnicodeEscape(startLine, startColumn));
					default -> sb.append(next);
				}
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new DialectParseException("Unterminated string", startLine, startColumn);
		}

		advance(); // closing quote
		return new DialectToken(TokenType.STRING, sb.toString(), startLine, startColumn);
	}

	private char scanUnicodeEscape(int startLine, int startColumn) {
		if (pos + 4 > input.length()) {
			throw new DialectParseException("Truncated unicode escape", startLine, startColumn);
		}
		String hex = input.substring(pos, pos + 4);
		try {
			char value = (char) Integer.parseInt(hex, 16);
			pos += 4;
			return value;
		} catch (NumberFormatException e) {
			throw new DialectParseException("Invalid unicode escape '\\u" + hex + "'", startLine, startColumn);
		}
	}

	private DialectToken scanNumber() {
		int start = pos;

		if (peek() == '-') {
			advance();
		}
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
		if (peek() == '.' && isDigit(peekNext())) {
			advance();
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}
		if (peek() == 'e' || peek() == 'E') {
			int mark = pos;
			advance();
			if (peek() == '+' || peek() == '-') {
				advance();
			}
			if (!isDigit(peek())) {
				pos = mark;
			}
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		return token(TokenType.NUMBER, input.substring(start, pos), start);
	}

	private DialectToken scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		return token(TokenType.IDENTIFIER, input.substring(start, pos), start);
	}

	private DialectToken scanLineComment() {
		int start = pos;
		pos += 2;
		while (!isAtEnd() && peek() != '\n') {
			advance();
		}
		return token(TokenType.HINT, input.substring(start + 2, pos), start);
	}

	private DialectToken scanBlockComment() {
		int start = pos;
		int startLine = line;
		int startColumn = column(start);
		pos += 2;
		while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
			advance();
		}
		if (isAtEnd()) {
			throw new DialectParseException("Unterminated block comment", startLine, startColumn);
		}
		String body = input.substring(start + 2, pos);
		pos += 2;
		return new DialectToken(TokenType.HINT, body, startLine, startColumn);
	}

	/**
	 * Keeps a comment only when it is a hint, replacing its value by the hint text.
	 */
	private void addIfHint(List<DialectToken> tokens, DialectToken comment) {
		// doc-comment stars are delimiters, on the first line and on continuation lines
		String text = LEADING_STARS.matcher(comment.value()).replaceFirst("");
		if (!text.startsWith(HINT_PREFIX)) {
			return;
		}
		String hint = text.substring(HINT_PREFIX.length()).strip().replaceAll("\\s*\\R[\\s*]*", " ");
		tokens.add(new DialectToken(TokenType.HINT, hint, comment.line(), comment.column()));
	}

	private DialectToken token(TokenType type, String value, int start) {
		return new DialectToken(type, value, line, column(start));
	}

	private int column(int offset) {
		return offset - lineStart + 1;
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			lineStart = pos;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
