package org.javai.typefilter.index;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
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
 * Builds a {@link LiteralIndex} by visiting every declaration of a graph exactly once.
 * <p>
 * Each string literal and each template (label and aliases) is recorded under the
 * {@link LiteralKey} of its owning declaration. Literals in type arguments belong to the
 * declaration that writes the reference, not to the referenced one. Numeric literals are
 * not indexed.
 */
public final class LiteralIndexer {

	private static final Logger logger = LoggerFactory.getLogger(LiteralIndexer.class);

	private final TermNormalizer normalizer;

	public LiteralIndexer(TermNormalizer normalizer) {
		this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
	}

	public LiteralIndex index(TypeGraph graph) {
		Objects.requireNonNull(graph, "graph must not be null");
		Map<LiteralKey, Set<String>> termsByKey = new LinkedHashMap<>();
		Set<LiteralKey> pinned = new LinkedHashSet<>();

		for (Declaration declaration : graph.declarations()) {
			Recorder recorder = new Recorder(declaration.name(), termsByKey, pinned);
			for (TypeParam param : declaration.params()) {
				param.constraintType().ifPresent(c -> c.accept(recorder));
			}
			declaration.body().accept(recorder);
		}

		LiteralIndex index = new LiteralIndex(termsByKey, normalizer);
		logger.debug("Indexed {} literal occurrence(s) under {} term(s), {} pinned",
				index.size(), index.terms().size(), pinned.size());
		return index;
	}

	private final class Recorder implements TypeExprVisitor<Void> {

		private final String owner;
		private final Map<LiteralKey, Set<String>> termsByKey;
		private final Set<LiteralKey> pinned;

		private Recorder(String owner, Map<LiteralKey, Set<String>> termsByKey, Set<LiteralKey> pinned) {
			this.owner = owner;
			this.termsByKey = termsByKey;
			this.pinned = pinned;
		}

		private Set<String> entry(String value) {
			return termsByKey.computeIfAbsent(new LiteralKey(owner, value), k -> new LinkedHashSet<>());
		}

		@Override
		public Void visitLiteral(TypeExpr.Literal literal) {
			if (!literal.numeric()) {
				entry(literal.value()).addAll(normalizer.literalTerms(literal.value()));
			}
			return null;
		}

		@Override
		public Void visitTemplate(TypeExpr.Template template) {
			Set<String> terms = entry(template.label());
			terms.addAll(normalizer.literalTerms(template.label()));
			for (String alias : template.aliases()) {
				terms.addAll(normalizer.literalTerms(alias));
			}
			if (template.pinned()) {
				pinned.add(new LiteralKey(owner, template.label()));
			}
			return null;
		}

		@Override
		public Void visitReference(TypeExpr.Reference reference) {
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
		public Void visitSpecial(TypeExpr.Special special) {
			return null;
		}
	}
}
