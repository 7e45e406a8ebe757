package org.javai.typefilter.prune;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.typefilter.dialect.DialectFormatter;
import org.javai.typefilter.dialect.DialectParser;
import org.javai.typefilter.graph.TypeGraph;
import org.javai.typefilter.graph.TypeGraphBuilder;
import org.junit.jupiter.api.Test;

class PathCompressorTest {

	private static String compress(String source) {
		TypeGraph graph = TypeGraphBuilder.build(DialectParser.parse(source));
		return DialectFormatter.lossless().format(PathCompressor.compress(graph, "Cart"));
	}

	@Test
	void aliasChainIsCollapsed() {
		assertThat(compress("type Cart={a:A}; type A=B; type B=C; type C={v:'x'};"))
				.isEqualTo("type Cart={a:C};\ntype C={v:\"x\"};");
	}

	@Test
	void singleLiteralIsInlined() {
		assertThat(compress("type Cart={size:Size, other:Size[]}; type Size='large';"))
				.isEqualTo("type Cart={size:\"large\",other:\"large\"[]};");
	}

	@Test
	void singleTemplateIsInlined() {
		assertThat(compress("type Cart={dip:Dip}; type Dip=LITERAL<'house sauce',[],true>;"))
				.isEqualTo("type Cart={dip:LITERAL<\"house sauce\",[],true>};");
	}

	@Test
	void rootIsNeverInlined() {
		assertThat(compress("type Cart=A; type A={v:'x'};")).isEqualTo("type Cart=A;\ntype A={v:\"x\"};");
	}

	@Test
	void hintedDeclarationIsKept() {
		assertThat(compress("type Cart={s:Size}; // Hint: the size\ntype Size='large';"))
				.isEqualTo("type Cart={s:Size};\n// Hint: the size\ntype Size=\"large\";");
	}

	@Test
	void parameterShadowingTheInlinedNameIsLeftAlone() {
		assertThat(compress("type Cart=Box<'x'>; type Box<A>={v:A}; type A='shadow';"))
				.isEqualTo("type Cart=Box<\"x\">;\ntype Box<A>={v:A};");
	}

	@Test
	void aliasCycleIsLeftIntact() {
		assertThat(compress("type Cart={a:A}; type A=B; type B=A;")).isEqualTo("type Cart={a:A};\ntype A=B;\ntype B=A;");
	}

	@Test
	void chooseDeclarationIsKept() {
		assertThat(compress("type Cart={s:'a'|CHOOSE}; type CHOOSE='CHOOSE';"))
				.isEqualTo("type Cart={s:\"a\"|CHOOSE};\ntype CHOOSE=\"CHOOSE\";");
	}

	@Test
	void graphWithoutTrivialDeclarationsIsReturnedAsIs() {
		TypeGraph graph = TypeGraphBuilder.build(DialectParser.parse("type Cart={a:A}; type A={v:'x'|'y'};"));

		assertThat(PathCompressor.compress(graph, "Cart")).isSameAs(graph);
	}
}
