package org.cellar.search.model;

import org.cellar.core.mirror.MirrorHit;
import org.cellar.core.model.CatalogRecord;

import java.util.Map;

public record SearchResultItem(
		String id,
		double score,
		Map<String, String> textFields,
		Map<String, Object> attributes,
		Map<String, String> highlights
) {
	public static SearchResultItem fromRecord(CatalogRecord record, double score, Map<String, String> highlights) {
		return new SearchResultItem(record.id(), score, record.textFields(), record.attributes(), highlights);
	}

	public static SearchResultItem fromHit(MirrorHit hit) {
		return new SearchResultItem(hit.id(), hit.score(), hit.textFields(), hit.attributes(), hit.highlights());
	}
}
