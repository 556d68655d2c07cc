package com.feedbackinsights.pipeline;

import java.util.Set;

/**
 * @param specializationThreshold minimum share of a word's overall lacking
 *        importance that must come from one category for it to count as
 *        specific to that category
 * @param minKeywords below this many specific words, a category falls back
 *        to its unfiltered ranking
 */
public record DeduplicationSettings(
        int commonVocabularySize,
        int overallKeywordCount,
        double specializationThreshold,
        int minKeywords,
        int maxKeywords,
        Set<String> ambiguousWords) {

    public static final Set<String> DEFAULT_AMBIGUOUS_WORDS = Set.of("good", "nice", "great", "positive");

    public DeduplicationSettings {
        if (commonVocabularySize < 0 || overallKeywordCount < 0) {
            throw new IllegalArgumentException("vocabulary sizes must be >= 0");
        }
        if (maxKeywords < 1) {
            throw new IllegalArgumentException("maxKeywords must be >= 1");
        }
        ambiguousWords = ambiguousWords == null ? Set.of() : Set.copyOf(ambiguousWords);
    }

    public static DeduplicationSettings defaults() {
        return new DeduplicationSettings(35, 10, 1.0, 5, 5, DEFAULT_AMBIGUOUS_WORDS);
    }
}
