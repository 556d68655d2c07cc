package com.feedbackinsights.store;

import java.time.Instant;

public record CorrelationCommit(
        long version,
        String runId,
        String tenantId,
        Instant committedAt,
        int importanceResults,
        boolean sectionRanking,
        int overallKeywords) {

    static CorrelationCommit of(CorrelationSnapshot snapshot) {
        return new CorrelationCommit(
                snapshot.version(),
                snapshot.runId(),
                snapshot.tenantId(),
                snapshot.committedAt(),
                snapshot.importanceResults().size(),
                snapshot.sectionRanking() != null,
                snapshot.overallKeywords().keywords().size());
    }
}
