package org.javai.typefilter.graph;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.typefilter.dialect.ParsedSchema;
import org.javai.typefilter.type.Declaration;
import org.javai.typefilter.type.Field;
import org.javai.typefilter.type.TypeExpr;
import org.javai.typefilter.type.TypeExprVisitor;
import org.javai.typefilter.type.TypeParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves parsed declarations into a validated {@link TypeGraph}.
 * <p>
 * Every reference is resolved against, in order: the parameters of the enclosing
 * declaration, the declarations of the schema, and {@link TypeGraph#BUILTIN_TYPES}.
 * Cycles are legal and left intact.
 */
public final class TypeGraphBuilder {

	private static final Logger logger = LoggerFactory.getLogger(TypeGraphBuilder.class);

	private TypeGraphBuilder() {
	}

	public static TypeGraph build(ParsedSchema schema) {
		Objects.requireNonNull(schema, "schema must not be null");
		return build(schema.declarations(), schema.trailingHints());
	}

	/**
	 * @throws DuplicateDeclarationException if a name is declared twice
	 * @throws DanglingReferenceException if a reference cannot be resolved
	 * @throws ArityMismatchException if a reference has the wrong number of type arguments
	 */
	public static TypeGraph build(List<Declaration> declarations, List<String> trailingHints) {
		Objects.requireNonNull(declarations, "declarations must not be null");
		TypeGraph graph = TypeGraph.of(declarations, trailingHints);

		for (Declaration declaration : graph.declarations()) {
			Resolver resolver = new Resolver(graph, declaration);
			for (TypeParam param : declaration.params()) {
				param.constraintType().ifPresent(c -> c.accept(resolver));
			}
			declaration.body().accept(resolver);
		}

		logger.debug("Built type graph with {} declaration(s)", graph.size());
		return graph;
	}

	/**
	 * Validates one declaration's references; the symbol table is the graph itself.
	 */
	private static final class Resolver implements TypeExprVisitor<Void> {

		private final TypeGraph graph;
		private final Declaration owner;
		private final Set<String> params;

		private Resolver(TypeGraph graph, Declaration owner) {
			this.graph = graph;
			this.owner = owner;
			this.params = owner.paramNames();
		}

		@Override
		public Void visitReference(TypeExpr.Reference reference) {
			String name = reference.name();
			int actual = reference.args().size();
			int expected;
			if (params.contains(name)) {
				expected = 0;
			} else if (graph.contains(name)) {
				expected = graph.require(name).params().size();
			} else if (TypeGraph.isBuiltin(name)) {
				expected = 0;
			} else {
				throw new DanglingReferenceException(owner.name(), name);
			}
			if (expected != actual) {
				throw new ArityMismatchException(owner.name(), name, expected, actual);
			}
			reference.args().forEach(arg -> arg.accept(this));
			return null;
		}

		@Override
		public Void visitUnion(TypeExpr.Union union) {
			union.members().forEach(member -> member.accept(this));
			return null;
		}

		@Override
		public Void visitStruct(TypeExpr.Struct struct) {
			Set<String> seen = new HashSet<>();
			for (Field field : struct.fields()) {
				if (!seen.add(field.name())) {
					throw new DuplicateFieldException(owner.name(), field.name());
				}
				field.type().accept(this);
			}
			return null;
		}

		@Override
		public Void visitArray(TypeExpr.ArrayOf array) {
			return array.element().accept(this);
		}

		@Override
		public Void visitLiteral(TypeExpr.Literal literal) {
			return null;
		}

		@Override
		public Void visitSpecial(TypeExpr.Special special) {
			return null;
		}

		@Override
		public Void visitTemplate(TypeExpr.Template template) {
			return null;
		}
	}
}
