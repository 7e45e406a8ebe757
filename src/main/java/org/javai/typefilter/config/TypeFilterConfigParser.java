package org.javai.typefilter.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Parser for type filter configuration YAML.
 * <p>
 * Recognised keys are {@code root}, {@code path_compression}, {@code stemming},
 * {@code stop_words} and {@code lossless}. Missing keys take the values of
 * {@link TypeFilterConfig#defaults()}; an empty document yields the defaults.
 */
public class TypeFilterConfigParser {

	/**
	 * Classpath location of the default configuration document.
	 */
	public static final String DEFAULTS_RESOURCE = "META-INF/type-filter-defaults.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a configuration file from a path.
	 */
	public TypeFilterConfig parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (IOException e) {
			throw new TypeFilterConfigException("Failed to read configuration from path: " + path, e);
		}
	}

	/**
	 * Parse a configuration document from an input stream.
	 */
	public TypeFilterConfig parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (YAMLException e) {
			throw new TypeFilterConfigException("Failed to parse configuration from input stream", e);
		}
	}

	/**
	 * Parse a configuration document from a reader.
	 */
	public TypeFilterConfig parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (YAMLException e) {
			throw new TypeFilterConfigException("Failed to parse configuration from reader", e);
		}
	}

	/**
	 * Parse a configuration document from a string.
	 */
	public TypeFilterConfig parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (YAMLException e) {
			throw new TypeFilterConfigException("Failed to parse configuration from string", e);
		}
	}

	/**
	 * Load the default configuration document shipped on the classpath.
	 */
	public TypeFilterConfig loadDefaults() {
		InputStream stream = TypeFilterConfigParser.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
		if (stream == null) {
			throw new TypeFilterConfigException("Default configuration not found on classpath: " + DEFAULTS_RESOURCE);
		}
		try (stream) {
			return parse(stream);
		} catch (IOException e) {
			throw new TypeFilterConfigException("Failed to close " + DEFAULTS_RESOURCE, e);
		}
	}

	private TypeFilterConfig build(Object document) {
		TypeFilterConfig defaults = TypeFilterConfig.defaults();
		if (document == null) {
			return defaults;
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new TypeFilterConfigException("Configuration must be a mapping but was: " + document);
		}

		String root = string(data, "root", defaults.root());
		if (root.isBlank()) {
			throw new TypeFilterConfigException("Configuration key 'root' must not be blank");
		}
		return new TypeFilterConfig(
			root,
			bool(data, "path_compression", defaults.pathCompression()),
			bool(data, "stemming", defaults.stemming()),
			stringSet(data, "stop_words", defaults.stopWords()),
			bool(data, "lossless", defaults.lossless())
		);
	}

	private static String string(Map<?, ?> data, String key, String fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof String text)) {
			throw wrongType(key, "a string", value);
		}
		return text;
	}

	private static boolean bool(Map<?, ?> data, String key, boolean fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof Boolean flag)) {
			throw wrongType(key, "true or false", value);
		}
		return flag;
	}

	private static Set<String> stringSet(Map<?, ?> data, String key, Set<String> fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof List<?> items)) {
			throw wrongType(key, "a list of strings", value);
		}
		Set<String> result = new LinkedHashSet<>();
		for (Object item : items) {
			if (!(item instanceof String word)) {
				throw wrongType(key, "a list of strings", value);
			}
			result.add(word);
		}
		return result;
	}

	private static TypeFilterConfigException wrongType(String key, String expected, Object value) {
		return new TypeFilterConfigException(
				"Configuration key '" + key + "' must be " + expected + " but was: " + value);
	}
}
