package org.javai.typefilter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.javai.typefilter.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaRegistryTest {

	@Test
	void registersClasspathResource() {
		SchemaRegistry registry = SchemaRegistry.create();

		TypeFilter filter = registry.registerResource("menu", "schemas/menu.ts");

		assertThat(registry.requireFilter("menu")).isSameAs(filter);
		assertThat(registry.ids()).containsExactly("menu");
	}

	@Test
	void registrationIsIdempotentPerId() {
		SchemaRegistry registry = SchemaRegistry.create();
		TypeFilter first = registry.registerSource("s", "type Cart={a:'x'};");

		TypeFilter second = registry.registerSource("s", "type Cart={b:'y'};");

		assertThat(second).isSameAs(first);
	}

	@Test
	void missingResourceIsRejected() {
		assertThatThrownBy(() -> SchemaRegistry.create().registerResource("x", "schemas/none.ts"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Resource not found");
	}

	@Test
	void unknownIdIsRejected() {
		SchemaRegistry registry = SchemaRegistry.create();

		assertThat(registry.filterFor("nope")).isEmpty();
		assertThatThrownBy(() -> registry.requireFilter("nope")).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void blankIdIsRejected() {
		assertThatThrownBy(() -> SchemaRegistry.create().registerSource(" ", "type Cart={};"))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void registersDirectorySkippingBrokenSchemas(@TempDir Path directory) throws Exception {
		Files.writeString(directory.resolve("drinks.ts"), "type Cart={drink:'cola'|'water'};");
		Files.writeString(directory.resolve("broken.ts"), "type Cart={items:Missing[]};");
		Files.writeString(directory.resolve("notes.txt"), "not a schema");
		SchemaRegistry registry = SchemaRegistry.create();

		try (LogCaptorAppender captor = LogCaptorAppender.attach(SchemaRegistry.class, Level.WARN)) {
			assertThat(registry.registerDirectory(directory)).containsExactly("drinks");
			assertThat(captor.messages(Level.WARN)).anyMatch(message -> message.contains("broken.ts"));
		}
		assertThat(registry.requireFilter("drinks").filter("water")).isEqualTo("type Cart={drink:\"water\"};");
	}

	@Test
	void registersPath(@TempDir Path directory) throws Exception {
		Path file = Files.writeString(directory.resolve("cart.ts"), "type Cart={size:'small'|'large'};");

		TypeFilter filter = SchemaRegistry.create().registerPath("cart", file);

		assertThat(filter.filter("small")).isEqualTo("type Cart={size:\"small\"};");
	}
}
