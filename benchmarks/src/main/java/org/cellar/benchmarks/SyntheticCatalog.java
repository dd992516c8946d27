package org.cellar.benchmarks;

import org.cellar.core.model.CatalogRecord;
import org.cellar.core.query.CatalogSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic wine records for benchmarks, so runs are comparable without a dataset on disk.
 */
final class SyntheticCatalog {

	static final CatalogSchema SCHEMA = CatalogSchema.parse(
			"variety:A,winery:B,title:B,description:C",
			"country:keyword,points:number,price:number");

	private static final String[] VARIETIES = {
			"Cabernet Sauvignon", "Merlot", "Pinot Noir", "Chardonnay", "Sauvignon Blanc", "Syrah", "Riesling",
			"Nebbiolo", "Sangiovese", "Tempranillo", "Malbec", "Zinfandel", "Grenache", "Barbera", "Gewurztraminer"
	};
	private static final String[] WINERIES = {
			"Chateau Lune", "Cantina Rossa", "Bodega Alta", "Hill Crest", "Domaine Vieux", "Stone Creek", "Weingut Berg"
	};
	private static final String[] COUNTRIES = {"France", "Italy", "Spain", "US", "Germany", "Argentina"};
	private static final String[] DESCRIPTORS = {
			"cherry", "blackberry", "plum", "cassis", "tobacco", "leather", "vanilla", "oak", "tannins", "acidity",
			"chewy", "silky", "earthy", "mineral", "citrus", "peach", "honey", "pepper", "spice", "violet", "rose",
			"tar", "cedar", "smoke", "butter", "toast", "herbal", "juicy", "structured", "elegant"
	};

	private SyntheticCatalog() {}

	static List<CatalogRecord> generate(int size, long seed) {
		Random random = new Random(seed);
		List<CatalogRecord> records = new ArrayList<>(size);
		for (int i = 0; i < size; i++) {
			String variety = pick(random, VARIETIES);
			String winery = pick(random, WINERIES);
			records.add(CatalogRecord.builder(String.format("wine-%06d", i))
					.text("variety", variety)
					.text("winery", winery)
					.text("title", winery + " " + (2000 + random.nextInt(22)) + " " + variety)
					.text("description", description(random))
					.attribute("country", pick(random, COUNTRIES))
					.attribute("points", 80 + random.nextInt(21))
					.attribute("price", 8 + random.nextInt(200))
					.build());
		}
		return records;
	}

	private static String description(Random random) {
		int words = 12 + random.nextInt(25);
		StringBuilder sb = new StringBuilder("Aromas of");
		for (int i = 0; i < words; i++) {
			sb.append(i % 6 == 5 ? ", with " : " ").append(pick(random, DESCRIPTORS));
		}
		return sb.append('.').toString();
	}

	private static String pick(Random random, String[] values) {
		return values[random.nextInt(values.length)];
	}
}
