package org.javai.typefilter.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.typefilter.TypeFilterException;
import org.javai.typefilter.dialect.DialectParser;
import org.javai.typefilter.type.Declaration;
import org.javai.typefilter.type.Field;
import org.javai.typefilter.type.TypeExpr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TypeGraphBuilderTest {

	private static TypeGraph build(String source) {
		return TypeGraphBuilder.build(DialectParser.parse(source));
	}

	@Nested
	@DisplayName("Valid schemas")
	class Valid {

		@Test
		void keepsSourceOrderAndTrailingHints() {
			TypeGraph graph = build("type Cart = {a: A}; type A = 'x'; // Hint: end");

			assertThat(graph.names()).containsExactly("Cart", "A");
			assertThat(graph.trailingHints()).containsExactly("end");
			assertThat(graph.require("A").name()).isEqualTo("A");
		}

		@Test
		void cyclesAreLegal() {
			TypeGraph graph = build("type Node = {children?: Node[], peer?: Other}; type Other = Node | 'leaf';");

			assertThat(graph.size()).isEqualTo(2);
		}

		@Test
		void builtinsAndParametersResolve() {
			TypeGraph graph = build("type Box<T extends string> = {value: T, count: number, flag?: boolean | null};");

			assertThat(graph.contains("Box")).isTrue();
			assertThat(graph.contains("string")).isFalse();
		}

		@Test
		void declarationShadowsBuiltinName() {
			TypeGraph graph = build("type Cart = {s: string}; type string = 'only';");

			assertThat(References.of(graph.require("Cart"), graph)).containsExactly("string");
		}

		@Test
		void genericInstantiationWithMatchingArity() {
			assertThat(build("type Cart = Pair<'a', 'b'>; type Pair<A, B> = {a: A, b: B};").size()).isEqualTo(2);
		}
	}

	@Nested
	@DisplayName("Load-time errors")
	class Errors {

		@Test
		void duplicateDeclaration() {
			assertThatThrownBy(() -> build("type A = 'a'; type A = 'b';"))
					.isInstanceOf(DuplicateDeclarationException.class)
					.isInstanceOf(TypeFilterException.class)
					.hasMessageContaining("A");
		}

		@Test
		void danglingReference() {
			assertThatThrownBy(() -> build("type Cart = {item: Missing};"))
					.isInstanceOfSatisfying(DanglingReferenceException.class, e -> {
						assertThat(e.declaration()).isEqualTo("Cart");
						assertThat(e.target()).isEqualTo("Missing");
					});
		}

		@Test
		void danglingReferenceInConstraint() {
			assertThatThrownBy(() -> build("type Box<T extends Nowhere> = T;"))
					.isInstanceOf(DanglingReferenceException.class);
		}

		@Test
		void tooFewTypeArguments() {
			assertThatThrownBy(() -> build("type Cart = Foo<'a'>; type Foo<A, B> = {a: A, b: B};"))
					.isInstanceOfSatisfying(ArityMismatchException.class, e -> {
						assertThat(e.declaration()).isEqualTo("Cart");
						assertThat(e.target()).isEqualTo("Foo");
						assertThat(e.expected()).isEqualTo(2);
						assertThat(e.actual()).isEqualTo(1);
					});
		}

		@Test
		void argumentsOnBuiltin() {
			assertThatThrownBy(() -> build("type Cart = string<'a'>;"))
					.isInstanceOf(ArityMismatchException.class);
		}

		@Test
		void argumentsOnParameter() {
			assertThatThrownBy(() -> build("type Box<T> = T<'a'>;"))
					.isInstanceOf(ArityMismatchException.class);
		}

		@Test
		void duplicateFieldInAssembledDeclaration() {
			TypeExpr.Struct struct = new TypeExpr.Struct(List.of(
					new Field("size", false, TypeExpr.Literal.of("large")),
					new Field("size", true, TypeExpr.Literal.of("small"))));

			assertThatThrownBy(() -> TypeGraphBuilder.build(List.of(new Declaration("Cart", struct)), List.of()))
					.isInstanceOfSatisfying(DuplicateFieldException.class, e -> {
						assertThat(e.declaration()).isEqualTo("Cart");
						assertThat(e.field()).isEqualTo("size");
					})
					.isInstanceOf(TypeFilterException.class);
		}

		@Test
		void missingArgumentsOnGeneric() {
			assertThatThrownBy(() -> build("type Cart = Box; type Box<T> = {v: T};"))
					.isInstanceOf(ArityMismatchException.class);
		}
	}
}
