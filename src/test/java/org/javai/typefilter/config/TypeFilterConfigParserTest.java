package org.javai.typefilter.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class TypeFilterConfigParserTest {

	private final TypeFilterConfigParser parser = new TypeFilterConfigParser();

	@Test
	void shippedDefaultsMatchBuiltInDefaults() {
		assertThat(parser.loadDefaults()).isEqualTo(TypeFilterConfig.defaults());
	}

	@Test
	void builtInDefaults() {
		TypeFilterConfig config = TypeFilterConfig.defaults();

		assertThat(config.root()).isEqualTo("Cart");
		assertThat(config.pathCompression()).isTrue();
		assertThat(config.stemming()).isTrue();
		assertThat(config.lossless()).isFalse();
		assertThat(config.stopWords()).isEmpty();
	}

	@Test
	void missingKeysTakeDefaults() {
		TypeFilterConfig config = parser.parseString("lossless: true");

		assertThat(config).isEqualTo(TypeFilterConfig.defaults().withLossless(true));
	}

	@Test
	void emptyDocumentYieldsDefaults() {
		assertThat(parser.parseString("")).isEqualTo(TypeFilterConfig.defaults());
	}

	@Test
	void parsesFromReader() {
		TypeFilterConfig config = parser.parse(new StringReader("root: Order\nstemming: false\nstop_words: [the]"));

		assertThat(config.root()).isEqualTo("Order");
		assertThat(config.stemming()).isFalse();
		assertThat(config.stopWords()).containsExactly("the");
		assertThat(config.normalizer().normalize("the Pizzas")).containsExactly("pizzas");
	}

	@Test
	void parsesFromStream() throws Exception {
		try (InputStream stream = getClass().getClassLoader().getResourceAsStream("config/narrow.yml")) {
			TypeFilterConfig config = parser.parse(stream);

			assertThat(config.root()).isEqualTo("Order");
			assertThat(config.pathCompression()).isFalse();
			assertThat(config.stopWords()).containsExactly("please");
		}
	}

	@Test
	void parsesFromPath() throws Exception {
		Path path = Path.of(getClass().getClassLoader().getResource("config/narrow.yml").toURI());

		assertThat(parser.parse(path).root()).isEqualTo("Order");
	}

	@Test
	void wrongValueTypeIsRejected() {
		assertThatThrownBy(() -> parser.parseString("path_compression: sometimes"))
				.isInstanceOf(TypeFilterConfigException.class)
				.hasMessageContaining("'path_compression' must be true or false");
	}

	@Test
	void stopWordsMustBeStrings() {
		assertThatThrownBy(() -> parser.parseString("stop_words: [the, 3]"))
				.isInstanceOf(TypeFilterConfigException.class)
				.hasMessageContaining("'stop_words' must be a list of strings");
	}

	@Test
	void nonMappingDocumentIsRejected() {
		assertThatThrownBy(() -> parser.parseString("- just\n- a list"))
				.isInstanceOf(TypeFilterConfigException.class);
	}

	@Test
	void malformedYamlIsRejected() {
		assertThatThrownBy(() -> parser.parseString("root: [unclosed"))
				.isInstanceOf(TypeFilterConfigException.class)
				.hasMessageContaining("Failed to parse configuration");
	}

	@Test
	void missingFileIsRejected() {
		assertThatThrownBy(() -> parser.parse(Path.of("does-not-exist.yml")))
				.isInstanceOf(TypeFilterConfigException.class);
	}
}
