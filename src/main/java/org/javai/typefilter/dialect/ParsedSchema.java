package org.javai.typefilter.dialect;

import java.util.List;
import org.javai.typefilter.type.Declaration;

/**
 * Result of parsing dialect source text.
 *
 * @param declarations declarations in source order
 * @param trailingHints hint comments that follow the last declaration
 */
public record ParsedSchema(List<Declaration> declarations, List<String> trailingHints) {

	public ParsedSchema {
		declarations = declarations != null ? List.copyOf(declarations) : List.of();
		trailingHints = trailingHints != null ? List.copyOf(trailingHints) : List.of();
	}
}
