package org.cellar.core.text;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.en.PorterStemFilter;
import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Lucene analyzer implementing an {@link AnalysisProfile}.
 *
 * <p>Token chain: {@code StandardTokenizer -> LowerCaseFilter -> ASCIIFoldingFilter -> StopFilter [-> PorterStemFilter]}</p>
 *
 * <p>The same chain feeds the primary index, the highlighter and the Lucene mirror index, so a term produced
 * at query time always lines up with the terms produced at index time.</p>
 */
public class CatalogAnalyzer extends Analyzer {

	private final AnalysisProfile profile;
	private final CharArraySet stopSet;

	public CatalogAnalyzer(AnalysisProfile profile) {
		this.profile = profile;
		this.stopSet = CharArraySet.unmodifiableSet(new CharArraySet(profile.stopWords(), true));
	}

	public AnalysisProfile profile() {
		return profile;
	}

	@Override
	protected TokenStreamComponents createComponents(String fieldName) {
		Tokenizer tokenizer = new StandardTokenizer();
		TokenStream stream = new LowerCaseFilter(tokenizer);
		stream = new ASCIIFoldingFilter(stream);
		stream = new StopFilter(stream, stopSet);
		if (profile.stemming()) {
			stream = new PorterStemFilter(stream);
		}
		return new TokenStreamComponents(tokenizer, stream);
	}

	@Override
	protected TokenStream normalize(String fieldName, TokenStream in) {
		return new ASCIIFoldingFilter(new LowerCaseFilter(in));
	}
}
