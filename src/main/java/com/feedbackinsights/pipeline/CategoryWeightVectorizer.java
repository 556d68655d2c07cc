package com.feedbackinsights.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.feedbackinsights.error.VectorizationException;
import com.feedbackinsights.text.NormalizedText;

/**
 * TF-IDF weighting over normalized token sequences.
 *
 * <p>Weights are raw term counts times the smoothed inverse document
 * frequency {@code ln((1 + n) / (1 + df)) + 1}, with every row scaled to unit
 * length. When the vocabulary is capped, terms are ranked by their total
 * count in the corpus (ties alphabetical); the kept vocabulary is then
 * sorted alphabetically, so feature positions only depend on the corpus.
 *
 * <p>Not thread-safe. Each run fits its own instance.
 */
public class CategoryWeightVectorizer {
    private static final int MIN_TOKEN_LENGTH = 2;

    private final VectorizerSettings settings;
    private List<String> vocabulary;
    private Map<String, Integer> positions;
    private double[] idf;

    public CategoryWeightVectorizer(VectorizerSettings settings) {
        this.settings = settings;
    }

    public CategoryWeightVectorizer fit(List<NormalizedText> corpus) {
        if (corpus.isEmpty()) {
            throw new VectorizationException("Cannot fit a vectorizer on an empty corpus");
        }
        Map<String, Integer> documentFrequency = new HashMap<>();
        Map<String, Integer> termFrequency = new HashMap<>();
        for (NormalizedText document : corpus) {
            List<String> terms = terms(document);
            for (String term : terms) {
                termFrequency.merge(term, 1, Integer::sum);
            }
            for (String term : new HashSet<>(terms)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        List<String> kept = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            if (entry.getValue() >= settings.minDocumentFrequency()) {
                kept.add(entry.getKey());
            }
        }
        if (kept.isEmpty()) {
            throw new VectorizationException("No terms reach document frequency " + settings.minDocumentFrequency()
                    + " in a corpus of " + corpus.size() + " documents");
        }
        if (settings.maxFeatures() > 0 && kept.size() > settings.maxFeatures()) {
            kept.sort(Comparator.<String>comparingInt(termFrequency::get).reversed()
                    .thenComparing(Comparator.naturalOrder()));
            kept = new ArrayList<>(kept.subList(0, settings.maxFeatures()));
        }
        Collections.sort(kept);

        int n = corpus.size();
        vocabulary = List.copyOf(kept);
        positions = new HashMap<>();
        idf = new double[vocabulary.size()];
        for (int i = 0; i < vocabulary.size(); i++) {
            String term = vocabulary.get(i);
            positions.put(term, i);
            idf[i] = Math.log((1.0 + n) / (1.0 + documentFrequency.get(term))) + 1.0;
        }
        return this;
    }

    public WeightedVector transform(NormalizedText document) {
        if (vocabulary == null) {
            throw new IllegalStateException("Vectorizer has not been fitted");
        }
        TreeMap<Integer, Integer> counts = new TreeMap<>();
        for (String term : terms(document)) {
            Integer position = positions.get(term);
            if (position != null) {
                counts.merge(position, 1, Integer::sum);
            }
        }

        int[] indices = new int[counts.size()];
        double[] weights = new double[counts.size()];
        double norm = 0.0;
        int i = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            indices[i] = entry.getKey();
            weights[i] = entry.getValue() * idf[entry.getKey()];
            norm += weights[i] * weights[i];
            i++;
        }
        if (norm > 0.0) {
            norm = Math.sqrt(norm);
            for (int j = 0; j < weights.length; j++) {
                weights[j] /= norm;
            }
        }
        return new WeightedVector(vocabulary.size(), indices, weights);
    }

    public List<WeightedVector> fitTransform(List<NormalizedText> corpus) {
        fit(corpus);
        return corpus.stream().map(this::transform).toList();
    }

    public double[][] toMatrix(List<WeightedVector> rows) {
        double[][] matrix = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            matrix[i] = rows.get(i).toDense();
        }
        return matrix;
    }

    public List<String> vocabulary() {
        if (vocabulary == null) {
            throw new IllegalStateException("Vectorizer has not been fitted");
        }
        return vocabulary;
    }

    private List<String> terms(NormalizedText document) {
        List<String> tokens = new ArrayList<>();
        for (String token : document.tokens()) {
            if (token.length() >= MIN_TOKEN_LENGTH && !settings.stopwords().contains(token)) {
                tokens.add(token);
            }
        }
        List<String> terms = new ArrayList<>();
        for (int size = settings.minNgram(); size <= settings.maxNgram(); size++) {
            for (int start = 0; start + size <= tokens.size(); start++) {
                terms.add(String.join(" ", tokens.subList(start, start + size)));
            }
        }
        return terms;
    }
}
