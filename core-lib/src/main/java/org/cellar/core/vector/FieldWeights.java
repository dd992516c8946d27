package org.cellar.core.vector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered mapping of text field name to boost weight.
 *
 * <p>Iteration order is the configured field order, which fixes the position layout of a
 * {@link SearchVector}.</p>
 */
public final class FieldWeights {
	private final Map<String, Double> weights;

	private FieldWeights(Map<String, Double> weights) {
		this.weights = Collections.unmodifiableMap(weights);
	}

	public static FieldWeights fromTiers(Map<String, WeightTier> tiers) {
		Map<String, Double> weights = new LinkedHashMap<>();
		tiers.forEach((field, tier) -> weights.put(field, tier.weight()));
		return new FieldWeights(weights);
	}

	public static FieldWeights of(Map<String, Double> weights) {
		return new FieldWeights(new LinkedHashMap<>(weights));
	}

	/**
	 * Returns a copy where the given fields take the supplied weight instead of their configured one.
	 */
	public FieldWeights withOverrides(Map<String, Double> overrides) {
		if (overrides.isEmpty()) {
			return this;
		}
		Map<String, Double> merged = new LinkedHashMap<>(weights);
		overrides.forEach((field, weight) -> {
			if (merged.containsKey(field)) {
				merged.put(field, weight);
			}
		});
		return new FieldWeights(merged);
	}

	public double weight(String field) {
		return weights.getOrDefault(field, 0.0);
	}

	public boolean contains(String field) {
		return weights.containsKey(field);
	}

	public Set<String> fields() {
		return weights.keySet();
	}

	public Map<String, Double> asMap() {
		return weights;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof FieldWeights other && weights.equals(other.weights);
	}

	@Override
	public int hashCode() {
		return weights.hashCode();
	}

	@Override
	public String toString() {
		return "FieldWeights" + weights;
	}
}
