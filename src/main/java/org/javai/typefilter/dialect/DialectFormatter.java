package org.javai.typefilter.dialect;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.javai.typefilter.graph.References;
import org.javai.typefilter.graph.TypeGraph;
import org.javai.typefilter.type.Declaration;
import org.javai.typefilter.type.Field;
import org.javai.typefilter.type.TypeExpr;
import org.javai.typefilter.type.TypeExprVisitor;
import org.javai.typefilter.type.TypeParam;

/**
 * Writes declarations back to dialect text with minimal whitespace, one declaration per line.
 * <p>
 * In compact mode a {@code LITERAL<...>} template is written as its plain label and a hint as a
 * bare comment, which is the form intended for prompts. Lossless mode writes templates in full
 * and keeps the {@code Hint:} marker, so that the output parses back to an identical schema.
 */
public class DialectFormatter {

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

	private static final DialectFormatter COMPACT = new DialectFormatter(false);
	private static final DialectFormatter LOSSLESS = new DialectFormatter(true);

	private final boolean lossless;

	public DialectFormatter(boolean lossless) {
		this.lossless = lossless;
	}

	public static DialectFormatter compact() {
		return COMPACT;
	}

	public static DialectFormatter lossless() {
		return LOSSLESS;
	}

	/**
	 * Formats the declarations reachable from {@code root}, each once, in first-discovery order,
	 * followed by the graph's trailing hints.
	 *
	 * @throws IllegalArgumentException if the root is not declared
	 */
	public String format(TypeGraph graph, String root) {
		Objects.requireNonNull(graph, "graph must not be null");
		Map<String, Declaration> reachable = new LinkedHashMap<>();
		discover(graph, root, reachable);
		return format(reachable.values(), graph.trailingHints());
	}

	/**
	 * Formats every declaration of the graph in iteration order, followed by its trailing hints.
	 */
	public String format(TypeGraph graph) {
		Objects.requireNonNull(graph, "graph must not be null");
		return format(graph.declarations(), graph.trailingHints());
	}

	/**
	 * Formats a parsed schema in source order, followed by its trailing hints.
	 */
	public String format(ParsedSchema schema) {
		Objects.requireNonNull(schema, "schema must not be null");
		return format(schema.declarations(), schema.trailingHints());
	}

	public String format(Declaration declaration) {
		Printer printer = new Printer();
		printer.declaration(declaration);
		return printer.toString();
	}

	public String format(TypeExpr type) {
		Printer printer = new Printer();
		type.accept(printer);
		return printer.toString();
	}

	private String format(Iterable<Declaration> declarations, List<String> trailingHints) {
		List<String> lines = new ArrayList<>();
		for (Declaration declaration : declarations) {
			lines.add(format(declaration));
		}
		for (String hint : trailingHints) {
			lines.add(hintLine(hint));
		}
		return String.join("\n", lines);
	}

	private static void discover(TypeGraph graph, String name, Map<String, Declaration> found) {
		if (found.containsKey(name)) {
			return;
		}
		Declaration declaration = graph.require(name);
		found.put(name, declaration);
		for (String target : References.of(declaration, graph)) {
			discover(graph, target, found);
		}
	}

	private String hintLine(String hint) {
		return lossless ? "// Hint: " + hint : "// " + hint;
	}

	static String quote(String value) {
		return '"' + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + '"';
	}

	private final class Printer implements TypeExprVisitor<Void> {

		private final StringBuilder output = new StringBuilder();

		void declaration(Declaration declaration) {
			for (String hint : declaration.hints()) {
				output.append(hintLine(hint)).append('\n');
			}
			output.append("type ").append(declaration.name());
			if (declaration.isGeneric()) {
				output.append('<');
				for (int i = 0; i < declaration.params().size(); i++) {
					if (i > 0) {
						output.append(',');
					}
					TypeParam param = declaration.params().get(i);
					output.append(param.name());
					param.constraintType().ifPresent(constraint -> {
						output.append(" extends ");
						constraint.accept(this);
					});
				}
				output.append('>');
			}
			output.append('=');
			declaration.body().accept(this);
			output.append(';');
		}

		@Override
		public Void visitReference(TypeExpr.Reference reference) {
			output.append(reference.name());
			if (reference.hasArgs()) {
				output.append('<');
				separated(reference.args(), ',');
				output.append('>');
			}
			return null;
		}

		@Override
		public Void visitUnion(TypeExpr.Union union) {
			for (int i = 0; i < union.members().size(); i++) {
				if (i > 0) {
					output.append('|');
				}
				TypeExpr member = union.members().get(i);
				// nested unions only arise from parentheses in the source
				grouped(member, member instanceof TypeExpr.Union);
			}
			return null;
		}

		@Override
		public Void visitStruct(TypeExpr.Struct struct) {
			output.append('{');
			for (int i = 0; i < struct.fields().size(); i++) {
				if (i > 0) {
					output.append(',');
				}
				Field field = struct.fields().get(i);
				output.append(IDENTIFIER.matcher(field.name()).matches() ? field.name() : quote(field.name()));
				if (field.optional()) {
					output.append('?');
				}
				output.append(':');
				field.type().accept(this);
			}
			output.append('}');
			return null;
		}

		@Override
		public Void visitArray(TypeExpr.ArrayOf array) {
			grouped(array.element(), array.element() instanceof TypeExpr.Union);
			output.append("[]");
			return null;
		}

		@Override
		public Void visitLiteral(TypeExpr.Literal literal) {
			output.append(literal.numeric() ? literal.value() : quote(literal.value()));
			return null;
		}

		@Override
		public Void visitSpecial(TypeExpr.Special special) {
			output.append(special.kind().keyword());
			return null;
		}

		@Override
		public Void visitTemplate(TypeExpr.Template template) {
			if (!lossless) {
				output.append(quote(template.label()));
				return null;
			}
			output.append("LITERAL<").append(quote(template.label())).append(",[");
			boolean first = true;
			for (String alias : template.aliases()) {
				if (!first) {
					output.append(',');
				}
				output.append(quote(alias));
				first = false;
			}
			output.append("],").append(template.pinned()).append('>');
			return null;
		}

		private void grouped(TypeExpr type, boolean parenthesize) {
			if (parenthesize) {
				output.append('(');
			}
			type.accept(this);
			if (parenthesize) {
				output.append(')');
			}
		}

		private void separated(List<TypeExpr> types, char separator) {
			for (int i = 0; i < types.size(); i++) {
				if (i > 0) {
					output.append(separator);
				}
				types.get(i).accept(this);
			}
		}

		@Override
		public String toString() {
			return output.toString();
		}
	}
}
