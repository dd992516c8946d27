package org.cellar.core.mirror;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.miscellaneous.PerFieldAnalyzerWrapper;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.DoublePoint;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.FieldDoc;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopFieldDocs;
import org.apache.lucene.search.spell.DirectSpellChecker;
import org.apache.lucene.search.spell.SuggestMode;
import org.apache.lucene.search.spell.SuggestWord;
import org.apache.lucene.search.uhighlight.DefaultPassageFormatter;
import org.apache.lucene.search.uhighlight.UnifiedHighlighter;
import org.apache.lucene.search.uhighlight.WholeBreakIterator;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.BytesRef;
import org.cellar.core.error.IndexUnavailableException;
import org.cellar.core.highlight.HighlightMarkers;
import org.cellar.core.query.AttributeType;
import org.cellar.core.query.CatalogSchema;
import org.cellar.core.query.Filter;
import org.cellar.core.query.SearchQuery;
import org.cellar.core.text.AnalysisProfile;
import org.cellar.core.text.TextAnalyzer;
import org.cellar.core.vector.FieldWeights;
import org.cellar.core.vocabulary.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link MirrorEngine} over a Lucene {@link Directory}.
 *
 * <p>A writable engine owns the {@link IndexWriter}; a read-only engine opens whatever the writer has
 * committed and refreshes before each request. Ranking is Lucene's BM25 with per-query field boosts,
 * highlighting uses the {@link UnifiedHighlighter} over whole field values, and suggestions come from a
 * {@link DirectSpellChecker} over an unstemmed catch-all field.</p>
 */
public class LuceneMirrorEngine implements MirrorEngine {
	private static final Logger logger = LoggerFactory.getLogger(LuceneMirrorEngine.class);

	static final String ID_FIELD = "_id";
	static final String SUGGEST_FIELD = "_suggest";

	private final Directory directory;
	private final CatalogSchema schema;
	private final TextAnalyzer textAnalyzer;
	private final AnalysisProfile searchProfile;
	private final Analyzer analyzer;
	private final IndexWriter writer;
	private final DirectSpellChecker spellChecker;
	private volatile SearcherManager searcherManager;
	private boolean closed;

	public LuceneMirrorEngine(
			Directory directory,
			CatalogSchema schema,
			TextAnalyzer textAnalyzer,
			AnalysisProfile searchProfile,
			AnalysisProfile suggestProfile,
			boolean writable
	) throws IOException {
		this.directory = directory;
		this.schema = schema;
		this.textAnalyzer = textAnalyzer;
		this.searchProfile = searchProfile;
		this.analyzer = new PerFieldAnalyzerWrapper(
				textAnalyzer.analyzer(searchProfile),
				Map.of(SUGGEST_FIELD, textAnalyzer.analyzer(suggestProfile)));
		this.spellChecker = createSpellChecker();

		if (writable) {
			IndexWriterConfig config = new IndexWriterConfig(analyzer);
			config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
			this.writer = new IndexWriter(directory, config);
			this.writer.commit();
			this.searcherManager = new SearcherManager(writer, null);
		} else {
			this.writer = null;
		}
		logger.info("Lucene mirror engine opened ({})", writable ? "read-write" : "read-only");
	}

	private static DirectSpellChecker createSpellChecker() {
		DirectSpellChecker checker = new DirectSpellChecker();
		checker.setMaxEdits(2);
		checker.setMinPrefix(1);
		checker.setMinQueryLength(3);
		checker.setThresholdFrequency(0.0f);
		checker.setAccuracy(0.5f);
		return checker;
	}

	@Override
	public void upsert(MirrorDocument document) throws IndexUnavailableException {
		IndexWriter w = requireWriter();
		try {
			w.updateDocument(new Term(ID_FIELD, document.id()), toLucene(document));
			w.commit();
			searcherManager.maybeRefreshBlocking();
		} catch (IOException | AlreadyClosedException e) {
			throw new IndexUnavailableException("Mirror upsert failed for " + document.id(), e);
		}
	}

	@Override
	public MirrorBulkResponse bulkUpsert(List<MirrorDocument> documents) throws IndexUnavailableException {
		IndexWriter w = requireWriter();
		Map<String, String> failures = new LinkedHashMap<>();
		int succeeded = 0;

		try {
			for (MirrorDocument document : documents) {
				try {
					w.updateDocument(new Term(ID_FIELD, document.id()), toLucene(document));
					succeeded++;
				} catch (IllegalArgumentException e) {
					failures.put(document.id(), e.getMessage());
				}
			}
			w.commit();
			searcherManager.maybeRefreshBlocking();
		} catch (IOException | AlreadyClosedException e) {
			throw new IndexUnavailableException("Mirror bulk write of " + documents.size() + " documents failed", e);
		}

		logger.debug("Bulk wrote {} documents to mirror, {} rejected", succeeded, failures.size());
		return new MirrorBulkResponse(succeeded, failures);
	}

	@Override
	public void delete(String id) throws IndexUnavailableException {
		IndexWriter w = requireWriter();
		try {
			w.deleteDocuments(new Term(ID_FIELD, id));
			w.commit();
			searcherManager.maybeRefreshBlocking();
		} catch (IOException | AlreadyClosedException e) {
			throw new IndexUnavailableException("Mirror delete failed for " + id, e);
		}
	}

	@Override
	public List<MirrorHit> search(SearchQuery query, FieldWeights boosts, HighlightMarkers markers) throws IndexUnavailableException {
		schema.validate(query);
		Query luceneQuery = buildQuery(query, boosts);
		if (luceneQuery == null) {
			return List.of();
		}

		SearcherManager manager = acquireManager();
		IndexSearcher searcher = null;
		try {
			searcher = manager.acquire();
			Sort sort = query.hasText()
					? new Sort(SortField.FIELD_SCORE, new SortField(ID_FIELD, SortField.Type.STRING))
					: new Sort(new SortField(ID_FIELD, SortField.Type.STRING));
			TopFieldDocs top = searcher.search(luceneQuery, query.limit(), sort, true);

			Map<String, String[]> highlights = markers == null || !query.hasText()
					? Map.of()
					: highlight(searcher, luceneQuery, top, markers);

			StoredFields storedFields = searcher.storedFields();
			List<MirrorHit> hits = new ArrayList<>(top.scoreDocs.length);
			for (int i = 0; i < top.scoreDocs.length; i++) {
				ScoreDoc scoreDoc = top.scoreDocs[i];
				Document doc = storedFields.document(scoreDoc.doc);
				double score = query.hasText() ? ((FieldDoc) scoreDoc).score : 0.0;
				hits.add(toHit(doc, score, highlights, i));
			}
			return hits;
		} catch (IOException | AlreadyClosedException e) {
			throw new IndexUnavailableException("Mirror search failed", e);
		} finally {
			release(manager, searcher);
		}
	}

	@Override
	public List<Suggestion> suggest(String term, int maxResults) throws IndexUnavailableException {
		if (term == null || term.isBlank()) {
			return List.of();
		}

		SearcherManager manager = acquireManager();
		IndexSearcher searcher = null;
		try {
			searcher = manager.acquire();
			Term probe = new Term(SUGGEST_FIELD, analyzer.normalize(SUGGEST_FIELD, term.trim()));
			IndexReader reader = searcher.getIndexReader();

			// the spell checker never returns the probe itself
			List<Suggestion> suggestions = new ArrayList<>();
			if (reader.docFreq(probe) > 0) {
				suggestions.add(new Suggestion(probe.text(), 1.0));
			}
			int remaining = maxResults - suggestions.size();
			if (remaining > 0) {
				for (SuggestWord word : spellChecker.suggestSimilar(probe, remaining, reader, SuggestMode.SUGGEST_ALWAYS)) {
					suggestions.add(new Suggestion(word.string, word.score));
				}
			}
			return suggestions;
		} catch (IOException | AlreadyClosedException e) {
			throw new IndexUnavailableException("Mirror suggestion failed", e);
		} finally {
			release(manager, searcher);
		}
	}

	@Override
	public long documentCount() throws IndexUnavailableException {
		SearcherManager manager = acquireManager();
		IndexSearcher searcher = null;
		try {
			searcher = manager.acquire();
			return searcher.getIndexReader().numDocs();
		} catch (IOException | AlreadyClosedException e) {
			throw new IndexUnavailableException("Mirror document count failed", e);
		} finally {
			release(manager, searcher);
		}
	}

	Query buildQuery(SearchQuery query, FieldWeights boosts) {
		BooleanQuery.Builder builder = new BooleanQuery.Builder();

		if (query.hasText()) {
			Set<String> terms = new LinkedHashSet<>(textAnalyzer.terms(query.text(), searchProfile));
			if (terms.isEmpty()) {
				return null;
			}
			for (String term : terms) {
				builder.add(termClause(term, boosts), BooleanClause.Occur.SHOULD);
			}
			builder.setMinimumNumberShouldMatch(query.minimumMatch());
		} else {
			builder.add(new MatchAllDocsQuery(), BooleanClause.Occur.MUST);
		}

		for (Filter filter : query.filters()) {
			builder.add(filterQuery(filter), BooleanClause.Occur.FILTER);
		}
		return builder.build();
	}

	private Query termClause(String term, FieldWeights boosts) {
		BooleanQuery.Builder perTerm = new BooleanQuery.Builder();
		for (String field : schema.textFields().keySet()) {
			double boost = boosts.weight(field);
			if (boost > 0) {
				perTerm.add(new BoostQuery(new TermQuery(new Term(field, term)), (float) boost), BooleanClause.Occur.SHOULD);
			}
		}
		return perTerm.build();
	}

	private Query filterQuery(Filter filter) {
		AttributeType type = schema.filterFields().get(filter.field());
		if (filter.kind() == Filter.Kind.RANGE) {
			double min = filter.min() == null ? Double.NEGATIVE_INFINITY : filter.min();
			double max = filter.max() == null ? Double.POSITIVE_INFINITY : filter.max();
			return DoublePoint.newRangeQuery(filter.field(), min, max);
		}
		if (type == AttributeType.NUMBER) {
			return DoublePoint.newExactQuery(filter.field(), Double.parseDouble(filter.value().toString()));
		}
		return new TermQuery(new Term(filter.field(), keyword(filter.value())));
	}

	private Map<String, String[]> highlight(IndexSearcher searcher, Query query, TopFieldDocs top, HighlightMarkers markers) throws IOException {
		UnifiedHighlighter highlighter = UnifiedHighlighter.builder(searcher, analyzer)
				.withBreakIterator(WholeBreakIterator::new)
				.withFormatter(new DefaultPassageFormatter(markers.start(), markers.end(), "", false))
				.withMaxNoHighlightPassages(0)
				.withMaxLength(Integer.MAX_VALUE - 1)
				.build();
		String[] fields = schema.textFields().keySet().toArray(new String[0]);
		int[] maxPassages = new int[fields.length];
		Arrays.fill(maxPassages, 1);
		return highlighter.highlightFields(fields, query, top, maxPassages);
	}

	Document toLucene(MirrorDocument document) {
		Document doc = new Document();
		doc.add(new StringField(ID_FIELD, document.id(), Field.Store.YES));
		doc.add(new SortedDocValuesField(ID_FIELD, new BytesRef(document.id())));

		StringBuilder suggestText = new StringBuilder();
		for (Map.Entry<String, String> field : document.textFields().entrySet()) {
			if (field.getValue() == null) {
				continue;
			}
			doc.add(new TextField(field.getKey(), field.getValue(), Field.Store.YES));
			suggestText.append(field.getValue()).append('\n');
		}
		doc.add(new TextField(SUGGEST_FIELD, suggestText.toString(), Field.Store.NO));

		for (Map.Entry<String, Object> attribute : document.attributes().entrySet()) {
			String name = attribute.getKey();
			Object value = attribute.getValue();
			if (value == null) {
				continue;
			}
			AttributeType type = schema.filterFields().get(name);
			if (type == AttributeType.NUMBER) {
				double number = toDouble(name, value);
				doc.add(new DoublePoint(name, number));
				doc.add(new StoredField(name, number));
			} else if (type == AttributeType.KEYWORD) {
				doc.add(new StringField(name, keyword(value), Field.Store.NO));
				doc.add(new StoredField(name, value.toString()));
			}
		}
		return doc;
	}

	private MirrorHit toHit(Document doc, double score, Map<String, String[]> highlights, int index) {
		Map<String, String> text = new LinkedHashMap<>();
		for (String field : schema.textFields().keySet()) {
			String value = doc.get(field);
			if (value != null) {
				text.put(field, value);
			}
		}

		Map<String, Object> attributes = new LinkedHashMap<>();
		for (Map.Entry<String, AttributeType> attribute : schema.filterFields().entrySet()) {
			IndexableField stored = doc.getField(attribute.getKey());
			if (stored == null) {
				continue;
			}
			attributes.put(attribute.getKey(),
					attribute.getValue() == AttributeType.NUMBER ? stored.numericValue() : stored.stringValue());
		}

		Map<String, String> marked = new LinkedHashMap<>();
		highlights.forEach((field, values) -> {
			if (values != null && index < values.length && values[index] != null) {
				marked.put(field, values[index]);
			}
		});

		return new MirrorHit(doc.get(ID_FIELD), score, text, attributes, marked);
	}

	private static double toDouble(String name, Object value) {
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		try {
			return Double.parseDouble(value.toString().trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Attribute '" + name + "' is not a number: '" + value + "'", e);
		}
	}

	private static String keyword(Object value) {
		return value.toString().trim().toLowerCase(Locale.ROOT);
	}

	private IndexWriter requireWriter() throws IndexUnavailableException {
		if (writer == null) {
			throw new IndexUnavailableException("Mirror engine was opened read-only");
		}
		return writer;
	}

	private SearcherManager acquireManager() throws IndexUnavailableException {
		SearcherManager manager = searcherManager;
		try {
			if (manager == null) {
				synchronized (this) {
					if (searcherManager == null) {
						if (!DirectoryReader.indexExists(directory)) {
							throw new IndexUnavailableException("Mirror index has not been created yet");
						}
						searcherManager = new SearcherManager(directory, null);
					}
					manager = searcherManager;
				}
			} else if (writer == null) {
				manager.maybeRefresh();
			}
			return manager;
		} catch (IOException e) {
			if (e instanceof IndexUnavailableException unavailable) {
				throw unavailable;
			}
			throw new IndexUnavailableException("Mirror index could not be opened", e);
		} catch (AlreadyClosedException e) {
			throw new IndexUnavailableException("Mirror engine is closed", e);
		}
	}

	private static void release(SearcherManager manager, IndexSearcher searcher) {
		if (searcher == null) {
			return;
		}
		try {
			manager.release(searcher);
		} catch (IOException e) {
			logger.warn("Failed to release mirror searcher", e);
		}
	}

	@Override
	public synchronized void close() throws IOException {
		if (closed) {
			return;
		}
		closed = true;
		if (searcherManager != null) {
			searcherManager.close();
		}
		if (writer != null) {
			writer.close();
		}
		logger.info("Lucene mirror engine closed");
	}
}
