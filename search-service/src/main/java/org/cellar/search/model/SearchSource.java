package org.cellar.search.model;

import org.cellar.core.error.ValidationException;

import java.util.Locale;

/**
 * Which index answers a query.
 */
public enum SearchSource {
	PRIMARY,
	MIRROR;

	public static SearchSource parse(String value) {
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new ValidationException("Unknown source '" + value + "'. Valid options: primary, mirror", e);
		}
	}
}
