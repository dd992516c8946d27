package org.cellar.core.query;

import java.util.Objects;

/**
 * A hard predicate on a record attribute.
 *
 * <p>{@link Kind#EQUALS} compares keywords case-insensitively and numbers by value. {@link Kind#RANGE} is an
 * inclusive numeric range where either bound may be open ({@code null}).</p>
 */
public record Filter(String field, Kind kind, Object value, Double min, Double max) {

	public enum Kind {
		EQUALS,
		RANGE
	}

	public Filter {
		Objects.requireNonNull(field, "field");
		Objects.requireNonNull(kind, "kind");
	}

	public static Filter equalTo(String field, Object value) {
		return new Filter(field, Kind.EQUALS, Objects.requireNonNull(value, "value"), null, null);
	}

	public static Filter range(String field, Double min, Double max) {
		return new Filter(field, Kind.RANGE, null, min, max);
	}

	/**
	 * Tests an attribute value. A missing attribute never matches.
	 */
	public boolean matches(Object attribute) {
		if (attribute == null) {
			return false;
		}

		if (kind == Kind.RANGE) {
			Double number = asNumber(attribute);
			if (number == null) {
				return false;
			}
			return (min == null || number >= min) && (max == null || number <= max);
		}

		if (value instanceof Number expected) {
			Double number = asNumber(attribute);
			return number != null && Double.compare(number, expected.doubleValue()) == 0;
		}

		return attribute.toString().equalsIgnoreCase(value.toString());
	}

	static Double asNumber(Object value) {
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		try {
			return Double.parseDouble(value.toString().trim());
		} catch (NumberFormatException e) {
			return null;
		}
	}
}
