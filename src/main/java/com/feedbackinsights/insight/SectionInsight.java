package com.feedbackinsights.insight;

import java.util.List;

/**
 * How one response scored a category, and what the lacking model suggests
 * about it.
 *
 * @param score the response's category score, {@code null} when it was not answered
 */
public record SectionInsight(
        String category,
        Double score,
        boolean low,
        boolean noData,
        List<String> lackingKeywords,
        List<String> recommendations) {

    public SectionInsight {
        lackingKeywords = lackingKeywords == null ? List.of() : List.copyOf(lackingKeywords);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static SectionInsight noData(String category) {
        return new SectionInsight(category, null, false, true, List.of(), List.of());
    }
}
