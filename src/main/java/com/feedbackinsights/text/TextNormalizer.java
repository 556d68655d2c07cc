package com.feedbackinsights.text;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.WordlistLoader;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Deterministic text cleanup shared by sentiment-independent stages:
 * lowercase, keep letters and whitespace only, tokenize, drop stopwords,
 * reduce to lemma.
 */
public class TextNormalizer {
    public static final String ENGLISH_STOPWORDS_RESOURCE = "stopwords/english.txt";
    public static final String DOMAIN_STOPWORDS_RESOURCE = "stopwords/domain.txt";

    private static final Pattern NON_LETTER = Pattern.compile("[^a-zA-Z\\s]");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final CharArraySet stopwords;
    private final LemmatizingAnalyzer analyzer;

    public TextNormalizer() {
        this(List.of());
    }

    public TextNormalizer(Collection<String> extraStopwords) {
        CharArraySet words = new CharArraySet(256, true);
        words.addAll(loadWordList(ENGLISH_STOPWORDS_RESOURCE));
        words.addAll(loadWordList(DOMAIN_STOPWORDS_RESOURCE));
        for (String word : extraStopwords) {
            if (word != null && !word.isBlank()) {
                words.add(word.strip().toLowerCase(Locale.ROOT));
            }
        }
        this.stopwords = CharArraySet.unmodifiableSet(words);
        this.analyzer = new LemmatizingAnalyzer(stopwords);
    }

    public NormalizedText normalize(String text) {
        if (text == null || text.isBlank()) {
            return NormalizedText.empty();
        }
        String cleaned = NON_LETTER.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
        cleaned = DIGITS.matcher(cleaned).replaceAll("");
        if (cleaned.isBlank()) {
            return NormalizedText.empty();
        }

        List<String> tokens = new ArrayList<>();
        try (TokenStream stream = analyzer.tokenStream("text", new StringReader(cleaned))) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to normalize text", e);
        }
        return new NormalizedText(tokens);
    }

    public boolean isStopword(String word) {
        return word != null && stopwords.contains(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Snapshot of the active stopword list, lowercased.
     */
    public Set<String> stopwords() {
        Set<String> copy = new TreeSet<>();
        for (Object word : stopwords) {
            copy.add(new String((char[]) word));
        }
        return copy;
    }

    private static CharArraySet loadWordList(String resource) {
        InputStream stream = TextNormalizer.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new IllegalStateException("Missing stopword resource " + resource);
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return WordlistLoader.getWordSet(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load stopword resource " + resource, e);
        }
    }
}
