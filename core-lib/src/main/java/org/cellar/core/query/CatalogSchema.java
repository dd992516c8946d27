package org.cellar.core.query;

import org.cellar.core.error.ValidationException;
import org.cellar.core.vector.FieldWeights;
import org.cellar.core.vector.WeightTier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The searchable text fields (with their weight tier) and the filterable attributes (with their type).
 *
 * <p>Text fields are kept in configured order; that order is also the order fields are laid out in a
 * search vector.</p>
 */
public final class CatalogSchema {
	private static final String RANGE_SEPARATOR = "..";

	private final Map<String, WeightTier> textFields;
	private final Map<String, AttributeType> filterFields;
	private final FieldWeights fieldWeights;

	public CatalogSchema(Map<String, WeightTier> textFields, Map<String, AttributeType> filterFields) {
		if (textFields.isEmpty()) {
			throw new IllegalArgumentException("At least one text field is required");
		}
		this.textFields = Collections.unmodifiableMap(new LinkedHashMap<>(textFields));
		this.filterFields = Collections.unmodifiableMap(new LinkedHashMap<>(filterFields));
		this.fieldWeights = FieldWeights.fromTiers(this.textFields);
	}

	/**
	 * Parses the configuration form, e.g. {@code "variety:A,winery:B"} and {@code "country:keyword,points:number"}.
	 */
	public static CatalogSchema parse(String textFieldConfig, String filterFieldConfig) {
		Map<String, WeightTier> text = new LinkedHashMap<>();
		for (String[] pair : pairs(textFieldConfig)) {
			text.put(pair[0], WeightTier.parse(pair[1]));
		}

		Map<String, AttributeType> filters = new LinkedHashMap<>();
		for (String[] pair : pairs(filterFieldConfig)) {
			filters.put(pair[0], AttributeType.parse(pair[1]));
		}

		return new CatalogSchema(text, filters);
	}

	private static List<String[]> pairs(String config) {
		List<String[]> pairs = new ArrayList<>();
		if (config == null || config.isBlank()) {
			return pairs;
		}
		for (String item : config.split(",")) {
			String trimmed = item.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			int idx = trimmed.indexOf(':');
			if (idx <= 0 || idx == trimmed.length() - 1) {
				throw new IllegalArgumentException("Expected 'name:value' but got '" + trimmed + "'");
			}
			pairs.add(new String[] {trimmed.substring(0, idx).trim(), trimmed.substring(idx + 1).trim()});
		}
		return pairs;
	}

	public Map<String, WeightTier> textFields() {
		return textFields;
	}

	public Map<String, AttributeType> filterFields() {
		return filterFields;
	}

	public FieldWeights fieldWeights() {
		return fieldWeights;
	}

	public boolean isFilterField(String field) {
		return filterFields.containsKey(field);
	}

	/**
	 * Field weights to rank a query with: configured tiers with the query's boost overrides applied.
	 */
	public FieldWeights weightsFor(SearchQuery query) {
		return fieldWeights.withOverrides(query.boosts());
	}

	/**
	 * Rejects filters on unknown attributes, filters that do not fit the attribute type, and boosts on
	 * unknown text fields.
	 */
	public void validate(SearchQuery query) {
		for (Filter filter : query.filters()) {
			AttributeType type = filterFields.get(filter.field());
			if (type == null) {
				throw new ValidationException("Unknown filter field '" + filter.field() + "'. Known fields: " + filterFields.keySet());
			}
			if (filter.kind() == Filter.Kind.RANGE) {
				if (type != AttributeType.NUMBER) {
					throw new ValidationException("Range filter is only allowed on number fields, '" + filter.field() + "' is " + type);
				}
				if (filter.min() != null && filter.max() != null && filter.min() > filter.max()) {
					throw new ValidationException("Empty range for '" + filter.field() + "': " + filter.min() + " > " + filter.max());
				}
			} else if (type == AttributeType.NUMBER && Filter.asNumber(filter.value()) == null) {
				throw new ValidationException("Filter '" + filter.field() + "' expects a number but got '" + filter.value() + "'");
			}
		}

		for (String field : query.boosts().keySet()) {
			if (!textFields.containsKey(field)) {
				throw new ValidationException("Unknown boost field '" + field + "'. Known fields: " + textFields.keySet());
			}
		}
	}

	/**
	 * Converts raw request parameters into typed filters. Number fields accept {@code 90}, {@code 90..95},
	 * {@code 90..} and {@code ..95}.
	 */
	public List<Filter> parseFilters(Map<String, String> raw) {
		List<Filter> filters = new ArrayList<>();
		for (Map.Entry<String, String> entry : raw.entrySet()) {
			String field = entry.getKey();
			String value = entry.getValue() == null ? "" : entry.getValue().trim();
			AttributeType type = filterFields.get(field);

			if (type == null) {
				throw new ValidationException("Unknown filter field '" + field + "'. Known fields: " + filterFields.keySet());
			}
			if (value.isEmpty()) {
				throw new ValidationException("Filter '" + field + "' has no value");
			}

			if (type == AttributeType.KEYWORD) {
				filters.add(Filter.equalTo(field, value));
			} else if (value.contains(RANGE_SEPARATOR)) {
				int idx = value.indexOf(RANGE_SEPARATOR);
				filters.add(Filter.range(field,
						parseBound(field, value.substring(0, idx)),
						parseBound(field, value.substring(idx + RANGE_SEPARATOR.length()))));
			} else {
				filters.add(Filter.equalTo(field, parseNumber(field, value)));
			}
		}
		return filters;
	}

	private static Double parseBound(String field, String bound) {
		String trimmed = bound.trim();
		return trimmed.isEmpty() ? null : parseNumber(field, trimmed);
	}

	private static Double parseNumber(String field, String value) {
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new ValidationException("Filter '" + field + "' expects a number but got '" + value + "'", e);
		}
	}

	@Override
	public String toString() {
		return "CatalogSchema{text=" + textFields + ", filters=" + filterFields + "}";
	}
}
