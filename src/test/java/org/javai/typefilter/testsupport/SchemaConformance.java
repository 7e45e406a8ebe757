package org.javai.typefilter.testsupport;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import org.javai.typefilter.graph.TypeGraph;
import org.javai.typefilter.type.Declaration;
import org.javai.typefilter.type.Field;
import org.javai.typefilter.type.TypeExpr;

/**
 * Decides whether a JSON value is accepted by a declaration of a {@link TypeGraph}.
 * <p>
 * Structs are closed: a value with a field the struct does not declare is rejected.
 * {@code CHOOSE} and templates accept the text they stand for.
 */
public final class SchemaConformance {

	private final TypeGraph graph;

	public SchemaConformance(TypeGraph graph) {
		this.graph = graph;
	}

	public boolean accepts(String root, JsonNode value) {
		return check(graph.require(root).body(), Map.of(), value);
	}

	private record Bound(TypeExpr type, Map<String, Bound> scope) {
	}

	private boolean check(TypeExpr type, Map<String, Bound> scope, JsonNode value) {
		if (type instanceof TypeExpr.Reference reference) {
			return checkReference(reference, scope, value);
		}
		if (type instanceof TypeExpr.Union union) {
			return union.members().stream().anyMatch(member -> check(member, scope, value));
		}
		if (type instanceof TypeExpr.Struct struct) {
			return checkStruct(struct, scope, value);
		}
		if (type instanceof TypeExpr.ArrayOf array) {
			if (!value.isArray()) {
				return false;
			}
			for (JsonNode element : value) {
				if (!check(array.element(), scope, element)) {
					return false;
				}
			}
			return true;
		}
		if (type instanceof TypeExpr.Literal literal) {
			if (literal.numeric()) {
				return value.isNumber() && value.decimalValue().compareTo(new BigDecimal(literal.value())) == 0;
			}
			return value.isTextual() && value.textValue().equals(literal.value());
		}
		if (type instanceof TypeExpr.Template template) {
			return value.isTextual() && value.textValue().equals(template.label());
		}
		TypeExpr.Special special = (TypeExpr.Special) type;
		return switch (special.kind()) {
			case ANY -> true;
			case NEVER -> false;
			case CHOOSE -> value.isTextual() && value.textValue().equals("CHOOSE");
		};
	}

	private boolean checkReference(TypeExpr.Reference reference, Map<String, Bound> scope, JsonNode value) {
		Bound bound = scope.get(reference.name());
		if (bound != null) {
			return check(bound.type(), bound.scope(), value);
		}
		if (graph.contains(reference.name())) {
			Declaration target = graph.require(reference.name());
			Map<String, Bound> inner = new HashMap<>();
			for (int i = 0; i < target.params().size(); i++) {
				inner.put(target.params().get(i).name(), new Bound(reference.args().get(i), scope));
			}
			return check(target.body(), inner, value);
		}
		return switch (reference.name()) {
			case "string" -> value.isTextual();
			case "number" -> value.isNumber();
			case "boolean" -> value.isBoolean();
			case "null" -> value.isNull();
			case "unknown" -> true;
			default -> false;
		};
	}

	private boolean checkStruct(TypeExpr.Struct struct, Map<String, Bound> scope, JsonNode value) {
		if (!value.isObject()) {
			return false;
		}
		Set<String> declared = new HashSet<>();
		for (Field field : struct.fields()) {
			declared.add(field.name());
			JsonNode member = value.get(field.name());
			if (member == null) {
				if (!field.optional()) {
					return false;
				}
			} else if (!check(field.type(), scope, member)) {
				return false;
			}
		}
		Iterator<String> names = value.fieldNames();
		while (names.hasNext()) {
			if (!declared.contains(names.next())) {
				return false;
			}
		}
		return true;
	}
}
