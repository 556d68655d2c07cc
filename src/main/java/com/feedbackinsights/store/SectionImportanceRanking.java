package com.feedbackinsights.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Categories ordered by their influence on overall satisfaction. The
 * per-category importances sum to 1.
 */
public record SectionImportanceRanking(
        List<String> sortedCategories,
        Map<String, Double> importancePerCategory,
        double r2,
        double mae,
        int sampleSize,
        Instant trainedAt) {

    public SectionImportanceRanking {
        sortedCategories = sortedCategories == null ? List.of() : List.copyOf(sortedCategories);
        importancePerCategory = importancePerCategory == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(importancePerCategory));
    }
}
