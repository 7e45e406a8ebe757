package org.javai.typefilter;

/**
 * Base class for all failures raised while loading a schema or pruning it.
 */
public class TypeFilterException extends RuntimeException {

	public TypeFilterException(String message) {
		super(message);
	}

	public TypeFilterException(String message, Throwable cause) {
		super(message, cause);
	}
}
