package org.cellar.search;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class SearchAppTest {

	@Test
	public void testParseArgumentsCollectsOverrides() {
		Properties overrides = SearchApp.parseArguments(new String[] {"--search.default.source", "mirror", "--server.port"});

		assertEquals("mirror", overrides.getProperty("search.default.source"));
		assertNull(overrides.getProperty("server.port"));
	}
}
