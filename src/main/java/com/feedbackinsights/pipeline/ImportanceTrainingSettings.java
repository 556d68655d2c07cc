package com.feedbackinsights.pipeline;

import java.util.Set;

import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.forest.ForestHyperparameters;

public record ImportanceTrainingSettings(
        int minSamples,
        double strengthThreshold,
        double lackingThreshold,
        int topKeywords,
        int maxFeatures,
        int maxNgram,
        int minDocumentFrequency,
        ForestHyperparameters forest,
        Set<String> noiseWords) {

    public static final Set<String> DEFAULT_NOISE_WORDS = Set.of(
            "feel", "company", "say", "job", "ive", "provided", "there", "work", "employee", "time",
            "good", "great", "well", "need", "make", "get", "would", "could", "should");

    public ImportanceTrainingSettings {
        if (minSamples < 2) {
            throw new IllegalArgumentException("minSamples must be >= 2");
        }
        if (topKeywords < 1) {
            throw new IllegalArgumentException("topKeywords must be >= 1");
        }
        noiseWords = noiseWords == null ? Set.of() : Set.copyOf(noiseWords);
    }

    public static ImportanceTrainingSettings defaults() {
        return new ImportanceTrainingSettings(
                10, 4.0, 3.0, 5, 200, 2, 2,
                ForestHyperparameters.wordImportanceDefaults(),
                DEFAULT_NOISE_WORDS);
    }

    public boolean inBucket(Polarity polarity, double score) {
        return polarity == Polarity.STRENGTH ? score >= strengthThreshold : score < lackingThreshold;
    }
}
