package org.javai.typefilter.prune;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.typefilter.graph.TypeGraph;
import org.javai.typefilter.type.Declaration;
import org.javai.typefilter.type.Field;
import org.javai.typefilter.type.TypeExpr;
import org.javai.typefilter.type.TypeExprVisitor;
import org.javai.typefilter.type.TypeParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inlines trivial declarations left behind by pruning.
 * <p>
 * A declaration is trivial when it is not the root, has no parameters and no hints, and
 * its body is an argument-less reference to another declaration, a single literal or a
 * single template. Every use of it is replaced by its body (following chains of aliases)
 * and the declaration is removed. Aliases that form a cycle are left intact.
 */
public final class PathCompressor {

	private static final Logger logger = LoggerFactory.getLogger(PathCompressor.class);

	private static final String CHOOSE = TypeExpr.Special.Kind.CHOOSE.keyword();

	private PathCompressor() {
		// Utility class - no instantiation
	}

	public static TypeGraph compress(TypeGraph graph, String root) {
		Objects.requireNonNull(graph, "graph must not be null");
		Objects.requireNonNull(root, "root must not be null");

		Map<String, TypeExpr> replacements = resolveReplacements(graph, root);
		if (replacements.isEmpty()) {
			return graph;
		}

		List<Declaration> kept = new ArrayList<>();
		for (Declaration declaration : graph.declarations()) {
			if (replacements.containsKey(declaration.name())) {
				continue;
			}
			kept.add(inline(declaration, replacements));
		}
		logger.debug("Path compression inlined {} declaration(s)", replacements.size());
		return TypeGraph.of(kept, graph.trailingHints());
	}

	private static Map<String, TypeExpr> resolveReplacements(TypeGraph graph, String root) {
		Map<String, TypeExpr> trivial = new HashMap<>();
		for (Declaration declaration : graph.declarations()) {
			if (isTrivial(declaration, root, graph)) {
				trivial.put(declaration.name(), declaration.body());
			}
		}

		Map<String, TypeExpr> resolved = new HashMap<>();
		for (String name : trivial.keySet()) {
			Set<String> chain = new LinkedHashSet<>();
			String current = name;
			TypeExpr body = trivial.get(current);
			boolean cyclic = false;
			while (true) {
				if (!chain.add(current)) {
					cyclic = true;
					break;
				}
				if (body instanceof TypeExpr.Reference reference && trivial.containsKey(reference.name())) {
					current = reference.name();
					body = trivial.get(current);
				} else {
					break;
				}
			}
			if (!cyclic) {
				resolved.put(name, body);
			}
		}
		return resolved;
	}

	private static boolean isTrivial(Declaration declaration, String root, TypeGraph graph) {
		if (declaration.name().equals(root) || declaration.name().equals(CHOOSE)
				|| declaration.isGeneric() || !declaration.hints().isEmpty()) {
			return false;
		}
		TypeExpr body = declaration.body();
		if (body instanceof TypeExpr.Reference reference) {
			return !reference.hasArgs() && graph.contains(reference.name());
		}
		return body instanceof TypeExpr.Literal || body instanceof TypeExpr.Template;
	}

	private static Declaration inline(Declaration declaration, Map<String, TypeExpr> replacements) {
		Inliner inliner = new Inliner(replacements, declaration.paramNames());
		boolean changed = false;
		List<TypeParam> params = new ArrayList<>();
		for (TypeParam param : declaration.params()) {
			TypeParam rewritten = param;
			if (param.constraint() != null) {
				TypeExpr constraint = param.constraint().accept(inliner);
				if (constraint != param.constraint()) {
					rewritten = new TypeParam(param.name(), constraint);
				}
			}
			changed |= rewritten != param;
			params.add(rewritten);
		}
		TypeExpr body = declaration.body().accept(inliner);
		changed |= body != declaration.body();
		return changed ? declaration.withBody(params, body) : declaration;
	}

	/**
	 * Replaces references to trivial declarations, returning the same instance for
	 * subtrees that contain none.
	 */
	private static final class Inliner implements TypeExprVisitor<TypeExpr> {

		private final Map<String, TypeExpr> replacements;
		private final Set<String> params;

		private Inliner(Map<String, TypeExpr> replacements, Set<String> params) {
			this.replacements = replacements;
			this.params = params;
		}

		@Override
		public TypeExpr visitReference(TypeExpr.Reference reference) {
			if (!reference.hasArgs()) {
				TypeExpr replacement = params.contains(reference.name()) ? null : replacements.get(reference.name());
				return replacement != null ? replacement : reference;
			}
			List<TypeExpr> args = rewriteAll(reference.args());
			return args == reference.args() ? reference : new TypeExpr.Reference(reference.name(), args);
		}

		@Override
		public TypeExpr visitUnion(TypeExpr.Union union) {
			List<TypeExpr> members = rewriteAll(union.members());
			return members == union.members() ? union : new TypeExpr.Union(members);
		}

		@Override
		public TypeExpr visitStruct(TypeExpr.Struct struct) {
			List<Field> fields = new ArrayList<>(struct.fields().size());
			boolean changed = false;
			for (Field field : struct.fields()) {
				Field rewritten = field.withType(field.type().accept(this));
				changed |= rewritten != field;
				fields.add(rewritten);
			}
			return changed ? new TypeExpr.Struct(fields) : struct;
		}

		@Override
		public TypeExpr visitArray(TypeExpr.ArrayOf array) {
			TypeExpr element = array.element().accept(this);
			return element == array.element() ? array : new TypeExpr.ArrayOf(element);
		}

		@Override
		public TypeExpr visitLiteral(TypeExpr.Literal literal) {
			return literal;
		}

		@Override
		public TypeExpr visitSpecial(TypeExpr.Special special) {
			return special;
		}

		@Override
		public TypeExpr visitTemplate(TypeExpr.Template template) {
			return template;
		}

		private List<TypeExpr> rewriteAll(List<TypeExpr> source) {
			List<TypeExpr> result = new ArrayList<>(source.size());
			boolean changed = false;
			for (TypeExpr expr : source) {
				TypeExpr rewritten = expr.accept(this);
				changed |= rewritten != expr;
				result.add(rewritten);
			}
			return changed ? result : source;
		}
	}
}
