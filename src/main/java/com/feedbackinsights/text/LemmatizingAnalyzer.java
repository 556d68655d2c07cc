package com.feedbackinsights.text;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.KStemFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Word-boundary tokenization, stopword removal and dictionary-based
 * inflection reduction. KStem only rewrites a token when the reduced form is
 * a dictionary word, so its output reads as a lemma rather than a stem.
 */
final class LemmatizingAnalyzer extends Analyzer {
    private final CharArraySet stopwords;

    LemmatizingAnalyzer(CharArraySet stopwords) {
        this.stopwords = stopwords;
    }

    @Override
    protected TokenStreamComponents createComponents(String fieldName) {
        StandardTokenizer source = new StandardTokenizer();
        TokenStream result = new LowerCaseFilter(source);
        result = new StopFilter(result, stopwords);
        result = new KStemFilter(result);
        return new TokenStreamComponents(source, result);
    }
}
