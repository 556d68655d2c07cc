package com.feedbackinsights.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.feedbackinsights.feedback.Polarity;

/**
 * Everything one training run derived. Committed and replaced as a unit.
 *
 * @param sectionRanking {@code null} when the run had too few satisfied responses
 */
public record CorrelationSnapshot(
        long version,
        String runId,
        String tenantId,
        Instant committedAt,
        List<ImportanceResult> importanceResults,
        SectionImportanceRanking sectionRanking,
        OverallKeywordSet overallKeywords) {

    public CorrelationSnapshot {
        importanceResults = importanceResults == null ? List.of() : List.copyOf(importanceResults);
        overallKeywords = overallKeywords == null ? OverallKeywordSet.none() : overallKeywords;
    }

    public static CorrelationSnapshot empty() {
        return new CorrelationSnapshot(0L, null, null, null, List.of(), null, OverallKeywordSet.none());
    }

    public Optional<ImportanceResult> find(String category, Polarity polarity) {
        return importanceResults.stream()
                .filter(result -> result.category().equals(category) && result.polarity() == polarity)
                .findFirst();
    }
}
