package org.javai.typefilter.index;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.typefilter.dialect.DialectParser;
import org.javai.typefilter.graph.TypeGraph;
import org.javai.typefilter.graph.TypeGraphBuilder;
import org.junit.jupiter.api.Test;

class LiteralIndexerTest {

	private final TermNormalizer normalizer = TermNormalizer.standard();

	private LiteralIndex index(String source) {
		TypeGraph graph = TypeGraphBuilder.build(DialectParser.parse(source));
		return new LiteralIndexer(normalizer).index(graph);
	}

	private String term(String word) {
		return normalizer.normalize(word).get(0);
	}

	@Test
	void indexesStringLiteralsUnderTheirDeclaration() {
		LiteralIndex index = index("type Size = 'small' | 'large'; type Other = {size: 'large'};");

		assertThat(index.lookup(term("large"))).containsExactlyInAnyOrder(
				new LiteralKey("Size", "large"), new LiteralKey("Other", "large"));
		assertThat(index.lookup(term("small"))).containsExactly(new LiteralKey("Size", "small"));
	}

	@Test
	void multiWordLiteralIsIndexedUnderEachWord() {
		LiteralIndex index = index("type Dip = 'house sauce';");

		LiteralKey key = new LiteralKey("Dip", "house sauce");
		assertThat(index.lookup(term("house"))).containsExactly(key);
		assertThat(index.lookup(term("sauce"))).containsExactly(key);
		assertThat(index.termsOf(key)).containsExactly(term("house"), term("sauce"));
	}

	@Test
	void numericLiteralsAreNotIndexed() {
		LiteralIndex index = index("type Count = 1 | 2 | 'many';");

		assertThat(index.keys()).containsExactly(new LiteralKey("Count", "many"));
	}

	@Test
	void templateAliasesAreIndexedUnderTheLabel() {
		LiteralIndex index = index("type Topping = LITERAL<'extra cheese', ['cheesy'], false>;");

		LiteralKey key = new LiteralKey("Topping", "extra cheese");
		assertThat(index.lookup(term("cheesy"))).containsExactly(key);
		assertThat(index.lookup(term("extra"))).containsExactly(key);
	}

	@Test
	void pinnedTemplatesAreIndexedLikeAnyOther() {
		LiteralIndex index = index("type Dip = LITERAL<'house sauce', [], true> | 'mayo';");

		assertThat(index.keys()).containsExactly(new LiteralKey("Dip", "house sauce"), new LiteralKey("Dip", "mayo"));
		assertThat(index.lookup(term("sauce"))).containsExactly(new LiteralKey("Dip", "house sauce"));
	}

	@Test
	void typeArgumentsBelongToTheReferencingDeclaration() {
		LiteralIndex index = index("type Cart = Box<'gift'>; type Box<T> = {content: T, kind: 'box'};");

		assertThat(index.lookup(term("gift"))).containsExactly(new LiteralKey("Cart", "gift"));
		assertThat(index.lookup(term("box"))).containsExactly(new LiteralKey("Box", "box"));
	}

	@Test
	void constraintsAreIndexed() {
		LiteralIndex index = index("type Box<T extends 'red' | 'blue'> = T;");

		assertThat(index.lookup(term("red"))).containsExactly(new LiteralKey("Box", "red"));
	}

	@Test
	void unknownTermHasNoKeys() {
		assertThat(index("type A = 'x';").lookup("zebra")).isEmpty();
	}
}
