package org.javai.typefilter.dialect;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.javai.typefilter.dialect.DialectToken.TokenType;
import org.javai.typefilter.type.Declaration;
import org.javai.typefilter.type.Field;
import org.javai.typefilter.type.TypeExpr;
import org.javai.typefilter.type.TypeParam;

/**
 * Recursive descent parser for the type declaration dialect.
 * <p>
 * Converts the tokens produced by {@link DialectTokenizer} into an ordered list of
 * {@link Declaration}s. Parsing is a single pass and fails fast on the first error;
 * no partial result is ever returned.
 * <p>
 * Hint tokens are not part of the grammar. They are collected while tokens are consumed:
 * hints met inside a declaration attach to it, hints between declarations attach to the
 * next one, and hints after the last declaration are returned as trailing hints.
 */
public class DialectParser {

	private final List<DialectToken> tokens;
	private final List<String> collectedHints = new ArrayList<>();
	private int current = 0;

	public DialectParser(List<DialectToken> tokens) {
		this.tokens = tokens != null && !tokens.isEmpty()
				? tokens
				: List.of(new DialectToken(TokenType.EOF, "", 1, 1));
	}

	/**
	 * Convenience entry point: tokenizes and parses the given source text.
	 *
	 * @throws DialectParseException if the text is not valid dialect
	 */
	public static ParsedSchema parse(String source) {
		return new DialectParser(new DialectTokenizer(source).tokenize()).parse();
	}

	/**
	 * Parses all tokens into declarations.
	 *
	 * @return the parsed schema (may contain no declarations)
	 * @throws DialectParseException if syntax errors are encountered
	 */
	public ParsedSchema parse() {
		List<Declaration> declarations = new ArrayList<>();

		while (!check(TokenType.EOF)) {
			declarations.add(parseDeclaration());
		}
		advance(); // gathers any hints left before EOF

		List<String> trailing = List.copyOf(collectedHints);
		collectedHints.clear();
		return new ParsedSchema(declarations, trailing);
	}

	private Declaration parseDeclaration() {
		if (peek().isIdentifier("export")) {
			advance();
		}
		expectKeyword("type");
		String name = expect(TokenType.IDENTIFIER, "Expected declaration name").value();

		List<TypeParam> params = List.of();
		if (check(TokenType.LT)) {
			params = parseTypeParams();
		}

		expect(TokenType.EQUALS, "Expected '=' after declaration of '" + name + "'");
		TypeExpr body = parseType();

		if (check(TokenType.SEMICOLON)) {
			advance();
		}

		List<String> hints = List.copyOf(collectedHints);
		collectedHints.clear();
		return new Declaration(name, params, body, hints);
	}

	private List<TypeParam> parseTypeParams() {
		advance(); // '<'
		List<TypeParam> params = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		do {
			DialectToken nameToken = expect(TokenType.IDENTIFIER, "Expected type parameter name");
			if (!seen.add(nameToken.value())) {
				throw new DialectParseException("Duplicate type parameter '" + nameToken.value() + "'", nameToken);
			}
			TypeExpr constraint = null;
			if (peek().isIdentifier("extends")) {
				advance();
				constraint = parseType();
			}
			params.add(new TypeParam(nameToken.value(), constraint));
		} while (match(TokenType.COMMA));
		expect(TokenType.GT, "Expected '>' to close type parameters");
		return params;
	}

	private TypeExpr parseType() {
		match(TokenType.PIPE); // optional leading '|'
		List<TypeExpr> members = new ArrayList<>();
		members.add(parseArray());
		while (match(TokenType.PIPE)) {
			members.add(parseArray());
		}
		return members.size() == 1 ? members.get(0) : new TypeExpr.Union(members);
	}

	private TypeExpr parseArray() {
		TypeExpr type = parsePrimary();
		while (match(TokenType.LBRACKET)) {
			expect(TokenType.RBRACKET, "Expected ']' in array type");
			type = new TypeExpr.ArrayOf(type);
		}
		return type;
	}

	private TypeExpr parsePrimary() {
		DialectToken token = peek();

		return switch (token.type()) {
			case STRING -> {
				advance();
				yield TypeExpr.Literal.of(token.value());
			}
			case NUMBER -> {
				advance();
				yield TypeExpr.Literal.number(token.value());
			}
			case LBRACE -> parseStruct();
			case LPAREN -> {
				advance();
				TypeExpr inner = parseType();
				expect(TokenType.RPAREN, "Expected ')' to close parenthesized type");
				yield inner;
			}
			case IDENTIFIER -> parseNamedType();
			default -> throw new DialectParseException("Expected a type but found " + describe(token), token);
		};
	}

	private TypeExpr parseNamedType() {
		DialectToken token = advance();
		String name = token.value();
		boolean hasArgs = check(TokenType.LT);

		if (!hasArgs) {
			switch (name) {
				case "never":
					return TypeExpr.Special.NEVER;
				case "any":
					return TypeExpr.Special.ANY;
				case "CHOOSE":
					return TypeExpr.Special.CHOOSE;
				default:
					return TypeExpr.Reference.to(name);
			}
		}
		if (name.equals("LITERAL")) {
			return parseTemplate();
		}

		advance(); // '<'
		List<TypeExpr> args = new ArrayList<>();
		do {
			args.add(parseType());
		} while (match(TokenType.COMMA));
		expect(TokenType.GT, "Expected '>' to close type arguments of '" + name + "'");
		return new TypeExpr.Reference(name, args);
	}

	private TypeExpr parseTemplate() {
		advance(); // '<'
		String label = expect(TokenType.STRING, "Expected LITERAL label string").value();
		expect(TokenType.COMMA, "Expected ',' after LITERAL label");

		Set<String> aliases = new LinkedHashSet<>();
		if (match(TokenType.LBRACKET)) {
			if (!check(TokenType.RBRACKET)) {
				do {
					aliases.add(expect(TokenType.STRING, "Expected alias string").value());
				} while (match(TokenType.COMMA));
			}
			expect(TokenType.RBRACKET, "Expected ']' to close LITERAL aliases");
		} else {
			aliases.add(expect(TokenType.STRING, "Expected alias string or alias list").value());
		}
		expect(TokenType.COMMA, "Expected ',' after LITERAL aliases");

		DialectToken pinToken = expect(TokenType.IDENTIFIER, "Expected true or false for LITERAL pin flag");
		boolean pinned = switch (pinToken.value()) {
			case "true" -> true;
			case "false" -> false;
			default -> throw new DialectParseException(
					"Expected true or false for LITERAL pin flag but found '" + pinToken.value() + "'", pinToken);
		};
		expect(TokenType.GT, "Expected '>' to close LITERAL");
		return new TypeExpr.Template(label, aliases, pinned);
	}

	private TypeExpr parseStruct() {
		advance(); // '{'
		List<Field> fields = new ArrayList<>();
		Set<String> names = new HashSet<>();

		while (!check(TokenType.RBRACE)) {
			DialectToken nameToken = peek();
			if (!nameToken.isType(TokenType.IDENTIFIER) && !nameToken.isType(TokenType.STRING)) {
				throw new DialectParseException("Expected field name but found " + describe(nameToken), nameToken);
			}
			advance();
			if (!names.add(nameToken.value())) {
				throw new DialectParseException("Duplicate field '" + nameToken.value() + "'", nameToken);
			}
			boolean optional = match(TokenType.QUESTION);
			expect(TokenType.COLON, "Expected ':' after field '" + nameToken.value() + "'");
			fields.add(new Field(nameToken.value(), optional, parseType()));

			if (!match(TokenType.COMMA) && !match(TokenType.SEMICOLON)) {
				break;
			}
		}

		expect(TokenType.RBRACE, "Expected '}' to close struct");
		return new TypeExpr.Struct(fields);
	}

	private void expectKeyword(String keyword) {
		DialectToken token = peek();
		if (!token.isIdentifier(keyword)) {
			throw new DialectParseException("Expected '" + keyword + "' but found " + describe(token), token);
		}
		advance();
	}

	private DialectToken expect(TokenType type, String message) {
		DialectToken token = peek();
		if (token.type() != type) {
			throw new DialectParseException(message + " but found " + describe(token), token);
		}
		return advance();
	}

	private boolean match(TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	private boolean check(TokenType type) {
		return peek().type() == type;
	}

	private DialectToken peek() {
		return tokens.get(nextSignificant());
	}

	/**
	 * Consumes the next significant token, collecting any hints that precede it.
	 */
	private DialectToken advance() {
		int index = nextSignificant();
		for (int i = current; i < index; i++) {
			collectedHints.add(tokens.get(i).value());
		}
		DialectToken token = tokens.get(index);
		current = token.isType(TokenType.EOF) ? index : index + 1;
		return token;
	}

	private int nextSignificant() {
		int index = current;
		while (index < tokens.size() - 1 && tokens.get(index).isType(TokenType.HINT)) {
			index++;
		}
		return index;
	}

	private static String describe(DialectToken token) {
		return token.isType(TokenType.EOF) ? "end of input" : "'" + token.value() + "'";
	}
}
