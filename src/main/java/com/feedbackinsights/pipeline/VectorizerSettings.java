package com.feedbackinsights.pipeline;

import java.util.Set;

/**
 * @param maxFeatures cap on vocabulary size, {@code 0} for unbounded
 * @param stopwords terms removed before n-grams are formed
 */
public record VectorizerSettings(
        int maxFeatures,
        int minNgram,
        int maxNgram,
        int minDocumentFrequency,
        Set<String> stopwords) {

    public VectorizerSettings {
        if (maxFeatures < 0) {
            throw new IllegalArgumentException("maxFeatures must be >= 0");
        }
        if (minNgram < 1 || maxNgram < minNgram) {
            throw new IllegalArgumentException("n-gram range must satisfy 1 <= min <= max");
        }
        if (minDocumentFrequency < 1) {
            throw new IllegalArgumentException("minDocumentFrequency must be >= 1");
        }
        stopwords = stopwords == null ? Set.of() : Set.copyOf(stopwords);
    }

    public static VectorizerSettings global() {
        return new VectorizerSettings(0, 1, 1, 1, Set.of());
    }

    public static VectorizerSettings categorySubset(Set<String> stopwords) {
        return new VectorizerSettings(200, 1, 2, 2, stopwords);
    }
}
