package com.feedbackinsights.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Words with the highest summed importance across every lacking model.
 */
public record OverallKeywordSet(Map<String, Double> keywords, Instant computedAt) {

    public OverallKeywordSet {
        keywords = keywords == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public static OverallKeywordSet none() {
        return new OverallKeywordSet(Map.of(), null);
    }

    public List<String> words() {
        return List.copyOf(keywords.keySet());
    }
}
