package org.javai.typefilter.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Collects every string value found at any depth of an in-progress order.
 * <p>
 * The walk knows nothing about the schema: objects are visited field by field in document
 * order, arrays element by element, and only textual scalars are collected. Field names,
 * numbers, booleans and nulls are ignored.
 */
public final class CartLiterals {

	private static final ObjectMapper mapper = new ObjectMapper();

	private CartLiterals() {
	}

	public static List<String> collect(JsonNode cart) {
		List<String> literals = new ArrayList<>();
		if (cart != null) {
			walk(cart, literals);
		}
		return literals;
	}

	/**
	 * Collects from plain Java values (maps, collections, arrays, beans) by first converting
	 * them to a JSON tree. Use ordered maps for a deterministic result.
	 */
	public static List<String> collect(Object cart) {
		if (cart == null) {
			return new ArrayList<>();
		}
		if (cart instanceof JsonNode node) {
			return collect(node);
		}
		return collect((JsonNode) mapper.valueToTree(cart));
	}

	/**
	 * Parses a JSON document and collects its string values.
	 *
	 * @throws IllegalArgumentException if the text is not valid JSON
	 */
	public static List<String> collectJson(String json) {
		try {
			return collect(mapper.readTree(json));
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Cart is not valid JSON", e);
		}
	}

	private static void walk(JsonNode node, List<String> literals) {
		if (node.isTextual()) {
			literals.add(node.textValue());
		} else if (node.isArray()) {
			for (JsonNode element : node) {
				walk(element, literals);
			}
		} else if (node.isObject()) {
			Iterator<JsonNode> values = node.elements();
			while (values.hasNext()) {
				walk(values.next(), literals);
			}
		}
	}
}
