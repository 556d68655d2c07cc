package com.feedbackinsights.store;

import java.util.List;
import java.util.Optional;

import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.runtime.RunContext;

/**
 * Durable home of derived results. Readers only ever observe a fully
 * committed snapshot.
 */
public interface CorrelationStore {

    /**
     * Replaces every derived result in one step.
     *
     * @throws com.feedbackinsights.error.PersistenceException when the write fails; the previous
     *         snapshot stays current
     */
    CorrelationSnapshot replaceAll(
            RunContext context,
            List<ImportanceResult> importanceResults,
            SectionImportanceRanking sectionRanking,
            OverallKeywordSet overallKeywords);

    CorrelationSnapshot snapshot();

    default Optional<ImportanceResult> getLatest(String category, Polarity polarity) {
        return snapshot().find(category, polarity);
    }

    default Optional<SectionImportanceRanking> getOverallRanking() {
        return Optional.ofNullable(snapshot().sectionRanking());
    }

    default OverallKeywordSet getOverallKeywords() {
        return snapshot().overallKeywords();
    }

    default long currentVersion() {
        return snapshot().version();
    }
}
