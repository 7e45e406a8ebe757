package org.javai.typefilter.config;

import org.javai.typefilter.TypeFilterException;

/**
 * Exception thrown when a configuration document cannot be read or holds values of the wrong type.
 */
public class TypeFilterConfigException extends TypeFilterException {

	public TypeFilterConfigException(String message) {
		super(message);
	}

	public TypeFilterConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
