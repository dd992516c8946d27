package org.cellar.core.query;

import java.util.Locale;

/** Type of a filterable attribute. */
public enum AttributeType {
	KEYWORD,
	NUMBER;

	public static AttributeType parse(String value) {
		try {
			return AttributeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown attribute type '" + value + "'. Valid options: keyword, number", e);
		}
	}
}
