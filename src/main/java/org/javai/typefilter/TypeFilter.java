package org.javai.typefilter;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import org.javai.typefilter.config.TypeFilterConfig;
import org.javai.typefilter.dialect.DialectFormatter;
import org.javai.typefilter.dialect.DialectParser;
import org.javai.typefilter.graph.TypeGraph;
import org.javai.typefilter.graph.TypeGraphBuilder;
import org.javai.typefilter.index.CartLiterals;
import org.javai.typefilter.index.LiteralIndex;
import org.javai.typefilter.index.LiteralIndexer;
import org.javai.typefilter.index.LiveSet;
import org.javai.typefilter.index.QueryMatcher;
import org.javai.typefilter.prune.PathCompressor;
import org.javai.typefilter.prune.RootEliminatedException;
import org.javai.typefilter.prune.TypePruner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: loads a schema once and answers any number of queries against it.
 * <p>
 * Loading parses the dialect text, validates it into a {@link TypeGraph} and indexes its
 * literals. Each query then yields the subset of the schema that still covers every value
 * the query or the cart mentions, serialized as compact dialect text.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class TypeFilter {

	private static final Logger logger = LoggerFactory.getLogger(TypeFilter.class);

	private final TypeFilterConfig config;
	private final TypeGraph graph;
	private final LiteralIndex index;
	private final QueryMatcher matcher;
	private final TypePruner pruner;
	private final DialectFormatter formatter;

	private TypeFilter(TypeFilterConfig config, TypeGraph graph) {
		this.config = config;
		this.graph = graph;
		this.index = new LiteralIndexer(config.normalizer()).index(graph);
		this.matcher = new QueryMatcher(index);
		this.pruner = new TypePruner(graph);
		this.formatter = new DialectFormatter(config.lossless());
	}

	/**
	 * Load a schema with the default configuration.
	 *
	 * @throws org.javai.typefilter.dialect.DialectParseException if the text is not valid dialect
	 * @throws org.javai.typefilter.graph.TypeGraphException if the declarations do not form a valid graph
	 */
	public static TypeFilter load(String source) {
		return load(source, TypeFilterConfig.defaults());
	}

	public static TypeFilter load(String source, TypeFilterConfig config) {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(config, "config must not be null");
		TypeGraph graph = TypeGraphBuilder.build(DialectParser.parse(source));
		TypeFilter filter = new TypeFilter(config, graph);
		logger.debug("Loaded schema with {} declaration(s) and {} indexed literal(s)",
				graph.size(), filter.index.size());
		return filter;
	}

	public TypeFilterConfig config() {
		return config;
	}

	public TypeGraph graph() {
		return graph;
	}

	public LiteralIndex index() {
		return index;
	}

	/**
	 * The literal occurrences made live by the phrase and the cart's literals.
	 */
	public LiveSet liveSet(String phrase, List<String> cartLiterals) {
		return matcher.match(phrase, cartLiterals);
	}

	/**
	 * Prune from the configured root, applying path compression when enabled.
	 *
	 * @throws RootEliminatedException if nothing keeps the root inhabited
	 */
	public TypeGraph prune(String phrase, List<String> cartLiterals) {
		return prune(config.root(), liveSet(phrase, cartLiterals));
	}

	/**
	 * Prune from the given root with an explicit live set.
	 *
	 * @throws RootEliminatedException if nothing keeps the root inhabited
	 * @throws IllegalArgumentException if the root is not declared
	 */
	public TypeGraph prune(String root, LiveSet live) {
		TypeGraph pruned = pruner.prune(root, live);
		return config.pathCompression() ? PathCompressor.compress(pruned, root) : pruned;
	}

	public String filter(String phrase) {
		return filter(phrase, List.<String>of());
	}

	public String filter(String phrase, JsonNode cart) {
		return filter(phrase, cart != null ? CartLiterals.collect(cart) : List.of());
	}

	/**
	 * Prune for the phrase and cart literals and serialize the result.
	 *
	 * @throws RootEliminatedException if nothing keeps the root inhabited
	 */
	public String filter(String phrase, List<String> cartLiterals) {
		return formatter.format(prune(phrase, cartLiterals), config.root());
	}

	/**
	 * Like {@link #filter(String, List)}, but falls back to the unpruned schema when the
	 * query would eliminate the root.
	 */
	public String filterOrOriginal(String phrase, List<String> cartLiterals) {
		try {
			return filter(phrase, cartLiterals);
		} catch (RootEliminatedException e) {
			logger.warn("Query '{}' eliminated root '{}'; using the unpruned schema", phrase, e.root());
			return unpruned();
		}
	}

	public String filterOrOriginal(String phrase, JsonNode cart) {
		return filterOrOriginal(phrase, cart != null ? CartLiterals.collect(cart) : List.of());
	}

	/**
	 * The declarations reachable from the configured root, without pruning.
	 *
	 * @throws IllegalArgumentException if the root is not declared
	 */
	public String unpruned() {
		return formatter.format(graph, config.root());
	}
}
