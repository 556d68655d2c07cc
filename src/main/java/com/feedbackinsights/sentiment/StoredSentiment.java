package com.feedbackinsights.sentiment;

import java.time.Instant;

public record StoredSentiment(
        String recordId,
        SentimentResult result,
        int textLength,
        Instant analyzedAt) {
}
