package org.javai.typefilter.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.typefilter.type.Declaration;

/**
 * Immutable, name-indexed arena of declarations.
 * <p>
 * All edges are {@link org.javai.typefilter.type.TypeExpr.Reference} names, so cycles
 * (self or mutual recursion) are represented without object cycles. Iteration order is
 * the order in which declarations were supplied: source order for a loaded schema,
 * first-discovery order for a pruned one.
 * <p>
 * Instances are safe to share between threads.
 */
public final class TypeGraph {

	/**
	 * Names that resolve without a declaration and take no type arguments.
	 */
	public static final Set<String> BUILTIN_TYPES = Set.of("string", "number", "boolean", "null", "undefined", "unknown");

	private final Map<String, Declaration> declarations;
	private final List<String> trailingHints;

	private TypeGraph(Map<String, Declaration> declarations, List<String> trailingHints) {
		this.declarations = Collections.unmodifiableMap(declarations);
		this.trailingHints = List.copyOf(trailingHints);
	}

	/**
	 * Assemble a graph from declarations that are already known to be well formed.
	 * Only name uniqueness is checked; use {@link TypeGraphBuilder} for full validation.
	 *
	 * @throws DuplicateDeclarationException if two declarations share a name
	 */
	public static TypeGraph of(Collection<Declaration> declarations, List<String> trailingHints) {
		Map<String, Declaration> byName = new LinkedHashMap<>();
		for (Declaration declaration : declarations) {
			if (byName.putIfAbsent(declaration.name(), declaration) != null) {
				throw new DuplicateDeclarationException(declaration.name());
			}
		}
		return new TypeGraph(byName, trailingHints != null ? trailingHints : List.of());
	}

	public static TypeGraph of(Collection<Declaration> declarations) {
		return of(declarations, List.of());
	}

	public static boolean isBuiltin(String name) {
		return BUILTIN_TYPES.contains(name);
	}

	/**
	 * @throws IllegalArgumentException if no declaration has the given name
	 */
	public Declaration require(String name) {
		Declaration declaration = declarations.get(name);
		if (declaration == null) {
			throw new IllegalArgumentException("No declaration named '" + name + "'");
		}
		return declaration;
	}

	public boolean contains(String name) {
		return declarations.containsKey(name);
	}

	public Collection<Declaration> declarations() {
		return declarations.values();
	}

	public Set<String> names() {
		return declarations.keySet();
	}

	public int size() {
		return declarations.size();
	}

	public List<String> trailingHints() {
		return trailingHints;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TypeGraph other)) return false;
		return declarations.equals(other.declarations) && trailingHints.equals(other.trailingHints);
	}

	@Override
	public int hashCode() {
		return declarations.hashCode() * 31 + trailingHints.hashCode();
	}

	@Override
	public String toString() {
		return "TypeGraph" + declarations.keySet();
	}
}
