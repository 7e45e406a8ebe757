package org.javai.typefilter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.javai.typefilter.config.TypeFilterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of loaded schemas.
 *
 * Applications register each schema once, under an id, and look up its {@link TypeFilter}
 * per request instead of re-parsing. Registrations are idempotent per id. All methods are
 * safe to call from multiple threads.
 */
public final class SchemaRegistry {

	private static final Logger logger = LoggerFactory.getLogger(SchemaRegistry.class);

	private static final String SCHEMA_SUFFIX = ".ts";

	private final Map<String, TypeFilter> filters = new LinkedHashMap<>();
	private final TypeFilterConfig config;

	private SchemaRegistry(TypeFilterConfig config) {
		this.config = config;
	}

	/**
	 * Create an empty registry that loads schemas with the default configuration.
	 */
	public static SchemaRegistry create() {
		return create(TypeFilterConfig.defaults());
	}

	public static SchemaRegistry create(TypeFilterConfig config) {
		return new SchemaRegistry(Objects.requireNonNull(config, "config must not be null"));
	}

	/**
	 * Register a loaded filter. If a filter with the same id is already present, the
	 * existing one is kept and returned.
	 */
	public synchronized TypeFilter register(String id, TypeFilter filter) {
		Objects.requireNonNull(filter, "filter must not be null");
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Schema id must not be blank");
		}
		TypeFilter existing = filters.get(id);
		if (existing != null) {
			logger.debug("Schema with id '{}' already registered; skipping", id);
			return existing;
		}
		filters.put(id, filter);
		return filter;
	}

	/**
	 * Load and register schema source text.
	 */
	public TypeFilter registerSource(String id, String source) {
		return register(id, TypeFilter.load(source, config));
	}

	/**
	 * Load a schema from a classpath resource using this class' loader.
	 */
	public TypeFilter registerResource(String id, String resourcePath) {
		return registerResource(id, resourcePath, SchemaRegistry.class.getClassLoader());
	}

	/**
	 * Load and register a schema from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws IllegalStateException if the resource cannot be read
	 */
	public TypeFilter registerResource(String id, String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		String source;
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			source = new String(is.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read schema from resource: " + resourcePath, e);
		}
		return registerSource(id, source);
	}

	/**
	 * Load and register a schema from a filesystem path.
	 *
	 * @throws IllegalStateException if the file cannot be read
	 */
	public TypeFilter registerPath(String id, Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try {
			return registerSource(id, Files.readString(path, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read schema from path: " + path, e);
		}
	}

	/**
	 * Register every {@code *.ts} file in a directory under its file name without the
	 * extension. Files that fail to load are logged and skipped.
	 *
	 * @return the ids registered by this call
	 */
	public List<String> registerDirectory(Path directory) {
		Objects.requireNonNull(directory, "directory must not be null");
		List<Path> files;
		try (Stream<Path> listing = Files.list(directory)) {
			files = listing
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(SCHEMA_SUFFIX))
					.sorted()
					.toList();
		} catch (IOException e) {
			throw new IllegalStateException("Failed to scan directory: " + directory, e);
		}

		List<String> registered = new ArrayList<>();
		for (Path file : files) {
			String fileName = file.getFileName().toString();
			String id = fileName.substring(0, fileName.length() - SCHEMA_SUFFIX.length());
			try {
				registerPath(id, file);
				registered.add(id);
			} catch (TypeFilterException | IllegalStateException e) {
				logger.warn("Failed to load schema from {}", file, e);
			}
		}
		return registered;
	}

	/**
	 * Retrieve a filter by schema id.
	 */
	public synchronized Optional<TypeFilter> filterFor(String id) {
		return Optional.ofNullable(filters.get(id));
	}

	/**
	 * Retrieve a filter by schema id or throw if not present.
	 */
	public TypeFilter requireFilter(String id) {
		return filterFor(id).orElseThrow(() -> new IllegalStateException("No schema registered for id: " + id));
	}

	/**
	 * All registered schema ids in insertion order.
	 */
	public synchronized List<String> ids() {
		return List.copyOf(filters.keySet());
	}
}
