package org.cellar.core.query;

import org.cellar.core.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated-before-dispatch query: one free-text phrase, attribute filters, per-field boost overrides and
 * a minimum number of distinct query terms that must match.
 *
 * <p>Build with {@link #builder()}; check against a schema with {@link CatalogSchema#validate(SearchQuery)}.</p>
 */
public final class SearchQuery {
	public static final int DEFAULT_LIMIT = 10;

	private final String text;
	private final List<Filter> filters;
	private final Map<String, Double> boosts;
	private final int minimumMatch;
	private final int limit;

	private SearchQuery(Builder builder) {
		this.text = builder.text == null ? "" : builder.text;
		this.filters = Collections.unmodifiableList(new ArrayList<>(builder.filters));
		this.boosts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.boosts));
		this.minimumMatch = builder.minimumMatch;
		this.limit = builder.limit;
	}

	public static Builder builder() {
		return new Builder();
	}

	public String text() {
		return text;
	}

	public boolean hasText() {
		return !text.isBlank();
	}

	public List<Filter> filters() {
		return filters;
	}

	public Map<String, Double> boosts() {
		return boosts;
	}

	public int minimumMatch() {
		return minimumMatch;
	}

	public int limit() {
		return limit;
	}

	@Override
	public String toString() {
		return "SearchQuery{text='" + text + "', filters=" + filters + ", boosts=" + boosts
				+ ", minimumMatch=" + minimumMatch + ", limit=" + limit + "}";
	}

	public static final class Builder {
		private String text;
		private final List<Filter> filters = new ArrayList<>();
		private final Map<String, Double> boosts = new LinkedHashMap<>();
		private int minimumMatch = 1;
		private int limit = DEFAULT_LIMIT;

		private Builder() {
		}

		public Builder text(String text) {
			this.text = text;
			return this;
		}

		public Builder filter(Filter filter) {
			filters.add(filter);
			return this;
		}

		public Builder filters(List<Filter> filters) {
			this.filters.addAll(filters);
			return this;
		}

		public Builder boost(String field, double boost) {
			boosts.put(field, boost);
			return this;
		}

		public Builder minimumMatch(int minimumMatch) {
			this.minimumMatch = minimumMatch;
			return this;
		}

		public Builder limit(int limit) {
			this.limit = limit;
			return this;
		}

		public SearchQuery build() {
			if (limit <= 0) {
				throw new ValidationException("limit must be positive, got " + limit);
			}
			if (minimumMatch < 1) {
				throw new ValidationException("minimum match must be at least 1, got " + minimumMatch);
			}
			for (Map.Entry<String, Double> boost : boosts.entrySet()) {
				if (boost.getValue() == null || boost.getValue() < 0 || boost.getValue().isNaN()) {
					throw new ValidationException("boost for field '" + boost.getKey() + "' must be a non-negative number");
				}
			}
			return new SearchQuery(this);
		}
	}
}
