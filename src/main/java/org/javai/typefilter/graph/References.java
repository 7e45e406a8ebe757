package org.javai.typefilter.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.javai.typefilter.type.Declaration;
import org.javai.typefilter.type.Field;
import org.javai.typefilter.type.TypeExpr;
import org.javai.typefilter.type.TypeExprVisitor;
import org.javai.typefilter.type.TypeParam;

/**
 * Utility for extracting the outgoing edges of a declaration.
 */
public final class References {

	private References() {
		// Utility class - no instantiation
	}

	/**
	 * Names of the graph's declarations referenced by the given declaration's parameter
	 * constraints and body, in first-occurrence order. The declaration's own parameters and
	 * names the graph does not declare (built-ins) are excluded. A {@code CHOOSE} sentinel
	 * counts as an edge to a declaration named {@code CHOOSE} when the graph has one.
	 */
	public static List<String> of(Declaration declaration, TypeGraph graph) {
		Collector collector = new Collector(declaration.paramNames(), graph);
		for (TypeParam param : declaration.params()) {
			param.constraintType().ifPresent(c -> c.accept(collector));
		}
		declaration.body().accept(collector);
		return new ArrayList<>(collector.names);
	}

	private static final class Collector implements TypeExprVisitor<Void> {

		private final Set<String> params;
		private final TypeGraph graph;
		private final Set<String> names = new LinkedHashSet<>();

		private Collector(Set<String> params, TypeGraph graph) {
			this.params = params;
			this.graph = graph;
		}

		@Override
		public Void visitReference(TypeExpr.Reference reference) {
			String name = reference.name();
			if (!params.contains(name) && graph.contains(name)) {
				names.add(name);
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
			for (Field field : struct.fields()) {
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
			String choose = TypeExpr.Special.Kind.CHOOSE.keyword();
			if (special.kind() == TypeExpr.Special.Kind.CHOOSE && graph.contains(choose)) {
				names.add(choose);
			}
			return null;
		}

		@Override
		public Void visitTemplate(TypeExpr.Template template) {
			return null;
		}
	}
}
