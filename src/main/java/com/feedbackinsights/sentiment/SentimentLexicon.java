package com.feedbackinsights.sentiment;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Word valences loaded from a tab-separated classpath resource
 * ({@code word<TAB>valence}, {@code #} starts a comment).
 */
public class SentimentLexicon {
    public static final String DEFAULT_RESOURCE = "sentiment/lexicon.tsv";

    private final Map<String, Double> valences;

    public SentimentLexicon() {
        this(DEFAULT_RESOURCE);
    }

    public SentimentLexicon(String resource) {
        this.valences = Collections.unmodifiableMap(load(resource));
    }

    SentimentLexicon(Map<String, Double> valences) {
        this.valences = Map.copyOf(valences);
    }

    public boolean contains(String word) {
        return word != null && valences.containsKey(word.toLowerCase(Locale.ROOT));
    }

    public double valence(String word) {
        return valences.getOrDefault(word.toLowerCase(Locale.ROOT), 0.0);
    }

    public int size() {
        return valences.size();
    }

    private static Map<String, Double> load(String resource) {
        InputStream stream = SentimentLexicon.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new IllegalStateException("Missing sentiment lexicon " + resource);
        }
        Map<String, Double> loaded = new HashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                int commentIdx = line.indexOf('#');
                String content = (commentIdx >= 0 ? line.substring(0, commentIdx) : line).strip();
                if (content.isEmpty()) {
                    continue;
                }
                String[] parts = content.split("\\s+");
                if (parts.length < 2) {
                    throw new IllegalStateException("Malformed lexicon line in " + resource + ": " + line);
                }
                loaded.put(parts[0].toLowerCase(Locale.ROOT), Double.parseDouble(parts[1]));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load sentiment lexicon from " + resource, e);
        }
        return loaded;
    }
}
