package com.feedbackinsights.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.feedbackinsights.feedback.Polarity;

/**
 * Keywords driving one category's score in one polarity bucket, ordered by
 * importance. Replaced wholesale on every retrain.
 */
public record ImportanceResult(
        String category,
        Polarity polarity,
        Map<String, Double> keywords,
        double modelR2,
        double mae,
        double rmse,
        int sampleSize,
        Instant trainedAt) {

    public ImportanceResult {
        keywords = keywords == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public List<String> words() {
        return List.copyOf(keywords.keySet());
    }

    public ImportanceResult withKeywords(Map<String, Double> refined) {
        return new ImportanceResult(category, polarity, refined, modelR2, mae, rmse, sampleSize, trainedAt);
    }
}
