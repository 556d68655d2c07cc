package com.feedbackinsights.feedback;

import java.time.Instant;

/**
 * Optional narrowing of the complete-record query. Null fields do not filter.
 */
public record RecordFilter(String category, Instant submittedFrom, Instant submittedTo) {

    public static RecordFilter none() {
        return new RecordFilter(null, null, null);
    }

    public boolean matches(FeedbackRecord record) {
        if (category != null && !record.categoryScores().containsKey(category)) {
            return false;
        }
        Instant submitted = record.submittedAt();
        if (submittedFrom != null && (submitted == null || submitted.isBefore(submittedFrom))) {
            return false;
        }
        return submittedTo == null || (submitted != null && submitted.isBefore(submittedTo));
    }
}
