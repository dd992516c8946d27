package org.cellar.core.query;

import org.cellar.core.error.ValidationException;
import org.cellar.core.vector.WeightTier;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogSchemaTest {

	private final CatalogSchema schema = CatalogSchema.parse(
			"variety:A, winery:B, title:B, description:C",
			"country:keyword, province:keyword, points:number, price:number");

	@Test
	public void testParse() {
		assertEquals(List.of("variety", "winery", "title", "description"), List.copyOf(schema.textFields().keySet()));
		assertEquals(WeightTier.C, schema.textFields().get("description"));
		assertEquals(AttributeType.NUMBER, schema.filterFields().get("points"));
		assertEquals(0.4, schema.fieldWeights().weight("winery"), 1e-9);
		assertTrue(schema.isFilterField("country"));
		assertFalse(schema.isFilterField("variety"));
	}

	@Test
	public void testParseRejectsMalformedPair() {
		assertThrows(IllegalArgumentException.class, () -> CatalogSchema.parse("variety", ""));
		assertThrows(IllegalArgumentException.class, () -> CatalogSchema.parse("variety:Z", ""));
		assertThrows(IllegalArgumentException.class, () -> CatalogSchema.parse("", "country:keyword"));
	}

	@Test
	public void testParseFilters() {
		Map<String, String> raw = new LinkedHashMap<>();
		raw.put("country", "Italy");
		raw.put("points", "90..95");
		raw.put("price", "..20");

		List<Filter> filters = schema.parseFilters(raw);

		assertEquals(Filter.equalTo("country", "Italy"), filters.get(0));
		assertEquals(Filter.range("points", 90.0, 95.0), filters.get(1));
		assertEquals(Filter.range("price", null, 20.0), filters.get(2));
		assertEquals(Filter.equalTo("points", 92.0), schema.parseFilters(Map.of("points", "92")).get(0));
	}

	@Test
	public void testParseFiltersRejectsBadInput() {
		assertThrows(ValidationException.class, () -> schema.parseFilters(Map.of("colour", "red")));
		assertThrows(ValidationException.class, () -> schema.parseFilters(Map.of("points", "ninety")));
		assertThrows(ValidationException.class, () -> schema.parseFilters(Map.of("country", " ")));
	}

	@Test
	public void testValidate() {
		schema.validate(SearchQuery.builder().text("merlot").filter(Filter.equalTo("country", "France")).build());

		assertThrows(ValidationException.class, () -> schema.validate(
				SearchQuery.builder().filter(Filter.equalTo("vintage", 2015)).build()));
		assertThrows(ValidationException.class, () -> schema.validate(
				SearchQuery.builder().filter(Filter.range("country", 1.0, 2.0)).build()));
		assertThrows(ValidationException.class, () -> schema.validate(
				SearchQuery.builder().filter(Filter.range("points", 95.0, 90.0)).build()));
		assertThrows(ValidationException.class, () -> schema.validate(
				SearchQuery.builder().filter(Filter.equalTo("points", "high")).build()));
		assertThrows(ValidationException.class, () -> schema.validate(
				SearchQuery.builder().text("merlot").boost("region", 2.0).build()));
	}

	@Test
	public void testQueryBuilderRejectsBadValues() {
		assertThrows(ValidationException.class, () -> SearchQuery.builder().limit(0).build());
		assertThrows(ValidationException.class, () -> SearchQuery.builder().minimumMatch(0).build());
		assertThrows(ValidationException.class, () -> SearchQuery.builder().boost("variety", -1).build());
	}

	@Test
	public void testWeightsForQuery() {
		SearchQuery query = SearchQuery.builder().text("merlot").boost("description", 3.0).build();

		assertEquals(3.0, schema.weightsFor(query).weight("description"), 1e-9);
		assertEquals(1.0, schema.weightsFor(query).weight("variety"), 1e-9);
	}
}
