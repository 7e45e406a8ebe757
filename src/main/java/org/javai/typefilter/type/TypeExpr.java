package org.javai.typefilter.type;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A type expression in the declaration dialect. Sealed so that every consumer
 * (indexer, pruner, formatter) handles the complete set of variants.
 * <p>
 * Variants:
 * <ul>
 *   <li>{@link Reference} - use of a declared, built-in or parameter name, possibly with type arguments</li>
 *   <li>{@link Union} - alternation, member order preserved</li>
 *   <li>{@link Struct} - object type with ordered fields</li>
 *   <li>{@link ArrayOf} - array of an element type</li>
 *   <li>{@link Literal} - a string or numeric literal</li>
 *   <li>{@link Special} - the {@code any}, {@code never} and {@code CHOOSE} sentinels</li>
 *   <li>{@link Template} - a named literal with search aliases and a pin flag</li>
 * </ul>
 * Cross references are by name only, so cyclic schemas need no shared mutable pointers.
 */
public sealed interface TypeExpr {

	<R> R accept(TypeExprVisitor<R> visitor);

	/**
	 * @param name the referenced name
	 * @param args type arguments, empty when the reference is not instantiated
	 */
	record Reference(String name, List<TypeExpr> args) implements TypeExpr {
		public Reference {
			Objects.requireNonNull(name, "name must not be null");
			args = args != null ? List.copyOf(args) : List.of();
		}

		public static Reference to(String name) {
			return new Reference(name, List.of());
		}

		public boolean hasArgs() {
			return !args.isEmpty();
		}

		@Override
		public <R> R accept(TypeExprVisitor<R> visitor) {
			return visitor.visitReference(this);
		}
	}

	record Union(List<TypeExpr> members) implements TypeExpr {
		public Union {
			members = members != null ? List.copyOf(members) : List.of();
			if (members.isEmpty()) {
				throw new IllegalArgumentException("Union must have at least one member");
			}
		}

		public static Union of(TypeExpr... members) {
			return new Union(List.of(members));
		}

		@Override
		public <R> R accept(TypeExprVisitor<R> visitor) {
			return visitor.visitUnion(this);
		}
	}

	record Struct(List<Field> fields) implements TypeExpr {
		public Struct {
			fields = fields != null ? List.copyOf(fields) : List.of();
		}

		@Override
		public <R> R accept(TypeExprVisitor<R> visitor) {
			return visitor.visitStruct(this);
		}
	}

	record ArrayOf(TypeExpr element) implements TypeExpr {
		public ArrayOf {
			Objects.requireNonNull(element, "element must not be null");
		}

		@Override
		public <R> R accept(TypeExprVisitor<R> visitor) {
			return visitor.visitArray(this);
		}
	}

	/**
	 * @param value the literal text exactly as written (unquoted for strings)
	 * @param numeric true for numeric literals, which are never indexed or pruned
	 */
	record Literal(String value, boolean numeric) implements TypeExpr {
		public Literal {
			Objects.requireNonNull(value, "value must not be null");
		}

		public static Literal of(String value) {
			return new Literal(value, false);
		}

		public static Literal number(String text) {
			return new Literal(text, true);
		}

		@Override
		public <R> R accept(TypeExprVisitor<R> visitor) {
			return visitor.visitLiteral(this);
		}
	}

	record Special(Kind kind) implements TypeExpr {

		public static final Special ANY = new Special(Kind.ANY);
		public static final Special NEVER = new Special(Kind.NEVER);
		public static final Special CHOOSE = new Special(Kind.CHOOSE);

		public enum Kind {
			ANY("any"),
			NEVER("never"),
			CHOOSE("CHOOSE");

			private final String keyword;

			Kind(String keyword) {
				this.keyword = keyword;
			}

			public String keyword() {
				return keyword;
			}
		}

		public Special {
			Objects.requireNonNull(kind, "kind must not be null");
		}

		@Override
		public <R> R accept(TypeExprVisitor<R> visitor) {
			return visitor.visitSpecial(this);
		}
	}

	/**
	 * The {@code LITERAL<label, aliases, pinned>} construct.
	 *
	 * @param label the displayed literal value
	 * @param aliases extra search terms that make the template live
	 * @param pinned when true the template survives every query
	 */
	record Template(String label, Set<String> aliases, boolean pinned) implements TypeExpr {
		public Template {
			Objects.requireNonNull(label, "label must not be null");
			aliases = aliases != null ? Collections.unmodifiableSet(new LinkedHashSet<>(aliases)) : Set.of();
		}

		@Override
		public <R> R accept(TypeExprVisitor<R> visitor) {
			return visitor.visitTemplate(this);
		}
	}
}
