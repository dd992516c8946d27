package org.cellar.core.vector;

import java.util.Locale;

/**
 * Boost tiers for text fields, highest first.
 */
public enum WeightTier {
	A(1.0),
	B(0.4),
	C(0.2),
	D(0.1);

	private final double weight;

	WeightTier(double weight) {
		this.weight = weight;
	}

	public double weight() {
		return weight;
	}

	public static WeightTier parse(String value) {
		try {
			return WeightTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown weight tier '" + value + "'. Valid options: A, B, C, D", e);
		}
	}
}
