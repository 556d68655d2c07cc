package com.feedbackinsights.feedback;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * One survey response. Unanswered categories are absent from
 * {@code categoryScores}; a {@code null} score in the source data is treated
 * the same way.
 */
public record FeedbackRecord(
        String id,
        String text,
        Map<String, Double> categoryScores,
        Instant submittedAt,
        boolean complete) {

    public FeedbackRecord {
        Map<String, Double> answered = new LinkedHashMap<>();
        if (categoryScores != null) {
            categoryScores.forEach((category, score) -> {
                if (category != null && score != null) {
                    answered.put(category, score);
                }
            });
        }
        categoryScores = Collections.unmodifiableMap(answered);
    }

    public OptionalDouble scoreFor(String category) {
        Double score = categoryScores.get(category);
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public OptionalDouble meanScore() {
        return categoryScores.values().stream().mapToDouble(Double::doubleValue).average();
    }
}
