package com.feedbackinsights.pipeline;

import java.util.List;

import com.feedbackinsights.store.ImportanceResult;
import com.feedbackinsights.store.OverallKeywordSet;

public record DeduplicationResult(
        List<ImportanceResult> refinedLacking,
        List<String> commonVocabulary,
        OverallKeywordSet overallKeywords) {

    public DeduplicationResult {
        refinedLacking = List.copyOf(refinedLacking);
        commonVocabulary = List.copyOf(commonVocabulary);
    }
}
