package org.javai.typefilter.prune;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.typefilter.graph.References;
import org.javai.typefilter.graph.TypeGraph;
import org.javai.typefilter.index.LiveSet;
import org.javai.typefilter.type.Declaration;
import org.javai.typefilter.type.Field;
import org.javai.typefilter.type.TypeExpr;
import org.javai.typefilter.type.TypeExprVisitor;
import org.javai.typefilter.type.TypeParam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prunes a {@link TypeGraph} down to the declarations and alternatives that a query keeps alive.
 * <p>
 * The descent is memoized over {@link Instance}s: a declaration together with the set of its
 * parameters whose arguments were eliminated at the reference site. An instance met again
 * while it is still being pruned is assumed to survive. When a pass ends with such an
 * assumption contradicted, the pass is repeated with every instance found dead in it known
 * up front; the dead set only grows, so this terminates.
 * <p>
 * Elimination is modelled as an empty {@link Optional}, distinct from a {@code never} written
 * in the source, which passes through unchanged.
 * <p>
 * A reference with an {@code any} argument is a wildcard: it is kept verbatim and everything
 * reachable from it is emitted unfiltered.
 * <p>
 * The source graph is never modified; unchanged subtrees are shared with the result.
 */
public final class TypePruner {

	private static final Logger logger = LoggerFactory.getLogger(TypePruner.class);

	private static final String CHOOSE = TypeExpr.Special.Kind.CHOOSE.keyword();

	private final TypeGraph graph;

	public TypePruner(TypeGraph graph) {
		this.graph = Objects.requireNonNull(graph, "graph must not be null");
	}

	/**
	 * @param root name of the declaration the pruned schema is rooted at
	 * @param live the literal occurrences relevant to the query
	 * @return a new graph holding the root and everything it still needs, in first-discovery order
	 * @throws RootEliminatedException if nothing keeps the root inhabited
	 * @throws IllegalArgumentException if the root is not declared
	 */
	public TypeGraph prune(String root, LiveSet live) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(live, "live must not be null");
		graph.require(root);

		Instance rootInstance = Instance.of(root);
		Set<Instance> knownDead = new HashSet<>();
		int passes = 0;
		Pass pass;
		while (true) {
			passes++;
			pass = new Pass(live, knownDead);
			pass.alive(rootInstance);
			Set<Instance> dead = pass.deadInstances();
			if (!pass.contradicts(dead)) {
				break;
			}
			knownDead.addAll(dead);
		}

		if (!pass.alive(rootInstance)) {
			logger.debug("Root '{}' eliminated after {} pass(es)", root, passes);
			throw new RootEliminatedException(root);
		}

		TypeGraph pruned = assemble(root, pass);
		logger.debug("Pruned '{}' to {} of {} declaration(s) in {} pass(es)",
				root, pruned.size(), graph.size(), passes);
		return pruned;
	}

	/**
	 * Orders the surviving declarations by first discovery from the root. Declarations
	 * reachable through a wildcard reference are emitted with their original bodies.
	 */
	private TypeGraph assemble(String root, Pass pass) {
		Set<String> unfiltered = new HashSet<>();
		markUnfiltered(root, false, pass, new HashSet<>(), unfiltered);

		Map<String, Declaration> ordered = new LinkedHashMap<>();
		collect(root, pass, unfiltered, ordered);

		return TypeGraph.of(ordered.values(), graph.trailingHints());
	}

	private void markUnfiltered(String name, boolean wildcard, Pass pass, Set<String> filteredSeen,
			Set<String> unfiltered) {
		if (wildcard) {
			if (unfiltered.add(name)) {
				for (String target : References.of(graph.require(name), graph)) {
					markUnfiltered(target, true, pass, filteredSeen, unfiltered);
				}
			}
			return;
		}
		if (!filteredSeen.add(name)) {
			return;
		}
		Edges edges = Edges.of(pass.result(name), graph);
		for (String target : edges.filtered) {
			markUnfiltered(target, false, pass, filteredSeen, unfiltered);
		}
		for (String target : edges.unfiltered) {
			markUnfiltered(target, true, pass, filteredSeen, unfiltered);
		}
	}

	private void collect(String name, Pass pass, Set<String> unfiltered, Map<String, Declaration> ordered) {
		if (ordered.containsKey(name)) {
			return;
		}
		Declaration declaration = unfiltered.contains(name) ? graph.require(name) : pass.result(name);
		ordered.put(name, declaration);
		for (String target : References.of(declaration, graph)) {
			collect(target, pass, unfiltered, ordered);
		}
	}

	/**
	 * A declaration pruned under a binding in which the named parameters received
	 * eliminated arguments.
	 */
	record Instance(String declaration, Set<String> eliminatedParams) {
		Instance {
			eliminatedParams = Set.copyOf(eliminatedParams);
		}

		static Instance of(String declaration) {
			return new Instance(declaration, Set.of());
		}
	}

	/**
	 * State of one pruning pass. Not shared between threads or passes.
	 */
	private final class Pass {

		private final LiveSet live;
		private final Set<Instance> knownDead;
		private final Map<Instance, Optional<Declaration>> memo = new HashMap<>();
		private final Set<Instance> inProgress = new HashSet<>();
		private final Set<Instance> assumedAlive = new HashSet<>();

		private Pass(LiveSet live, Set<Instance> knownDead) {
			this.live = live;
			this.knownDead = knownDead;
		}

		boolean alive(Instance instance) {
			if (knownDead.contains(instance)) {
				return false;
			}
			Optional<Declaration> done = memo.get(instance);
			if (done != null) {
				return done.isPresent();
			}
			if (!inProgress.add(instance)) {
				assumedAlive.add(instance);
				return true;
			}

			Declaration declaration = graph.require(instance.declaration());
			Filter filter = new Filter(this, declaration, instance.eliminatedParams());
			Optional<TypeExpr> body = declaration.body().accept(filter);
			Optional<Declaration> result = body.map(b -> rebuild(declaration, filter, b));

			inProgress.remove(instance);
			memo.put(instance, result);
			return result.isPresent();
		}

		Declaration result(String name) {
			Optional<Declaration> result = memo.get(Instance.of(name));
			if (result == null || result.isEmpty()) {
				throw new IllegalStateException("No surviving pruned form of '" + name + "'");
			}
			return result.get();
		}

		Set<Instance> deadInstances() {
			Set<Instance> dead = new HashSet<>();
			memo.forEach((instance, result) -> {
				if (result.isEmpty()) {
					dead.add(instance);
				}
			});
			return dead;
		}

		boolean contradicts(Set<Instance> dead) {
			for (Instance instance : assumedAlive) {
				if (dead.contains(instance)) {
					return true;
				}
			}
			return false;
		}

		private Declaration rebuild(Declaration declaration, Filter filter, TypeExpr body) {
			boolean changed = body != declaration.body();
			List<TypeParam> params = new ArrayList<>();
			for (TypeParam param : declaration.params()) {
				TypeParam kept = param;
				if (param.constraint() != null) {
					// an eliminated constraint leaves the parameter unconstrained
					TypeExpr constraint = param.constraint().accept(filter).orElse(null);
					if (constraint != param.constraint()) {
						kept = new TypeParam(param.name(), constraint);
					}
				}
				changed |= kept != param;
				params.add(kept);
			}
			return changed ? declaration.withBody(params, body) : declaration;
		}
	}

	/**
	 * Applies the per-variant rules inside one declaration.
	 */
	private final class Filter implements TypeExprVisitor<Optional<TypeExpr>> {

		private final Pass pass;
		private final Declaration owner;
		private final Set<String> params;
		private final Set<String> eliminatedParams;

		private Filter(Pass pass, Declaration owner, Set<String> eliminatedParams) {
			this.pass = pass;
			this.owner = owner;
			this.params = owner.paramNames();
			this.eliminatedParams = eliminatedParams;
		}

		@Override
		public Optional<TypeExpr> visitReference(TypeExpr.Reference reference) {
			String name = reference.name();
			if (params.contains(name)) {
				return eliminatedParams.contains(name) ? Optional.empty() : Optional.of(reference);
			}
			if (!graph.contains(name) || isWildcard(reference)) {
				return Optional.of(reference);
			}

			Declaration target = graph.require(name);
			List<TypeExpr> args = new ArrayList<>(reference.args().size());
			Set<String> eliminated = new LinkedHashSet<>();
			boolean changed = false;
			for (int i = 0; i < reference.args().size(); i++) {
				TypeExpr arg = reference.args().get(i);
				Optional<TypeExpr> pruned = arg.accept(this);
				if (pruned.isEmpty()) {
					eliminated.add(target.params().get(i).name());
					args.add(TypeExpr.Special.NEVER);
					changed = true;
				} else {
					args.add(pruned.get());
					changed |= pruned.get() != arg;
				}
			}

			if (!pass.alive(new Instance(name, eliminated))) {
				return Optional.empty();
			}
			if (!eliminated.isEmpty() && !pass.alive(Instance.of(name))) {
				return Optional.empty();
			}
			return Optional.of(changed ? new TypeExpr.Reference(name, args) : reference);
		}

		@Override
		public Optional<TypeExpr> visitUnion(TypeExpr.Union union) {
			List<TypeExpr> survivors = new ArrayList<>();
			boolean changed = false;
			for (TypeExpr member : union.members()) {
				Optional<TypeExpr> pruned = member.accept(this);
				if (pruned.isPresent()) {
					survivors.add(pruned.get());
					changed |= pruned.get() != member;
				} else {
					changed = true;
				}
			}
			if (survivors.isEmpty()) {
				return Optional.empty();
			}
			// never adds no values to a union that has another member
			if (survivors.stream().anyMatch(member -> !TypeExpr.Special.NEVER.equals(member))) {
				changed |= survivors.removeIf(TypeExpr.Special.NEVER::equals);
			}
			if (!changed) {
				return Optional.of(union);
			}
			return Optional.of(survivors.size() == 1 ? survivors.get(0) : new TypeExpr.Union(survivors));
		}

		@Override
		public Optional<TypeExpr> visitStruct(TypeExpr.Struct struct) {
			List<Field> fields = new ArrayList<>();
			boolean changed = false;
			for (Field field : struct.fields()) {
				Optional<TypeExpr> pruned = field.type().accept(this);
				if (pruned.isEmpty()) {
					if (!field.optional()) {
						return Optional.empty();
					}
					changed = true;
					continue;
				}
				Field kept = field.withType(pruned.get());
				changed |= kept != field;
				fields.add(kept);
			}
			return Optional.of(changed ? new TypeExpr.Struct(fields) : struct);
		}

		@Override
		public Optional<TypeExpr> visitArray(TypeExpr.ArrayOf array) {
			return array.element().accept(this)
					.map(element -> element == array.element() ? array : new TypeExpr.ArrayOf(element));
		}

		@Override
		public Optional<TypeExpr> visitLiteral(TypeExpr.Literal literal) {
			if (literal.numeric() || pass.live.contains(owner.name(), literal.value())) {
				return Optional.of(literal);
			}
			return Optional.empty();
		}

		@Override
		public Optional<TypeExpr> visitSpecial(TypeExpr.Special special) {
			return Optional.of(special);
		}

		@Override
		public Optional<TypeExpr> visitTemplate(TypeExpr.Template template) {
			if (template.pinned() || pass.live.contains(owner.name(), template.label())) {
				return Optional.of(template);
			}
			return Optional.empty();
		}
	}

	static boolean isWildcard(TypeExpr.Reference reference) {
		for (TypeExpr arg : reference.args()) {
			if (arg instanceof TypeExpr.Special special && special.kind() == TypeExpr.Special.Kind.ANY) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Outgoing edges of a pruned declaration, split by whether the target is reached through
	 * a wildcard reference (or the {@code CHOOSE} sentinel) and must stay unfiltered.
	 */
	private static final class Edges implements TypeExprVisitor<Void> {

		private final Set<String> params;
		private final TypeGraph graph;
		private final Set<String> filtered = new LinkedHashSet<>();
		private final Set<String> unfiltered = new LinkedHashSet<>();
		private boolean insideWildcard;

		private Edges(Set<String> params, TypeGraph graph) {
			this.params = params;
			this.graph = graph;
		}

		static Edges of(Declaration declaration, TypeGraph graph) {
			Edges edges = new Edges(declaration.paramNames(), graph);
			for (TypeParam param : declaration.params()) {
				param.constraintType().ifPresent(c -> c.accept(edges));
			}
			declaration.body().accept(edges);
			return edges;
		}

		@Override
		public Void visitReference(TypeExpr.Reference reference) {
			boolean outer = insideWildcard;
			insideWildcard = outer || isWildcard(reference);
			String name = reference.name();
			if (!params.contains(name) && graph.contains(name)) {
				(insideWildcard ? unfiltered : filtered).add(name);
			}
			reference.args().forEach(arg -> arg.accept(this));
			insideWildcard = outer;
			return null;
		}

		@Override
		public Void visitUnion(TypeExpr.Union union) {
			union.members().forEach(member -> member.accept(this));
			return null;
		}

		@Override
		public Void visitStruct(TypeExpr.Struct struct) {
			struct.fields().forEach(field -> field.type().accept(this));
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
			if (special.kind() == TypeExpr.Special.Kind.CHOOSE && graph.contains(CHOOSE)) {
				unfiltered.add(CHOOSE);
			}
			return null;
		}

		@Override
		public Void visitTemplate(TypeExpr.Template template) {
			return null;
		}
	}
}
