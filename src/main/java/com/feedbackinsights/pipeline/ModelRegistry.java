package com.feedbackinsights.pipeline;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.forest.RegressionForest;
import com.feedbackinsights.text.NormalizedText;
import com.feedbackinsights.text.TextNormalizer;

/**
 * Models and normalized texts built during one training run. A new
 * registry is created per run and dropped when the run ends.
 */
public class ModelRegistry {
    public static final String SECTION_RANKING_KEY = "section-ranking";
    public static final String GLOBAL_KEY = "global";

    private final TextNormalizer normalizer;
    private final Map<String, NormalizedText> normalized = new HashMap<>();
    private final Map<String, CategoryWeightVectorizer> vectorizers = new LinkedHashMap<>();
    private final Map<String, RegressionForest> forests = new LinkedHashMap<>();

    public ModelRegistry(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public static String key(String category, Polarity polarity) {
        return category + "/" + polarity.label();
    }

    /**
     * Normalized tokens of the record's text, computed once per distinct text.
     */
    public synchronized NormalizedText normalized(FeedbackRecord record) {
        String text = record.text() == null ? "" : record.text();
        return normalized.computeIfAbsent(text, normalizer::normalize);
    }

    public TextNormalizer normalizer() {
        return normalizer;
    }

    /**
     * Fits the run-wide vectorizer on every non-empty normalized text.
     */
    public synchronized CategoryWeightVectorizer fitGlobalVectorizer(List<FeedbackRecord> records) {
        List<NormalizedText> corpus = records.stream()
                .filter(FeedbackRecord::hasText)
                .map(this::normalized)
                .filter(text -> !text.isEmpty())
                .toList();
        CategoryWeightVectorizer global = new CategoryWeightVectorizer(VectorizerSettings.global()).fit(corpus);
        vectorizers.put(GLOBAL_KEY, global);
        return global;
    }

    public synchronized void register(String key, CategoryWeightVectorizer vectorizer, RegressionForest forest) {
        if (vectorizer != null) {
            vectorizers.put(key, vectorizer);
        }
        forests.put(key, forest);
    }

    public synchronized Optional<CategoryWeightVectorizer> vectorizer(String key) {
        return Optional.ofNullable(vectorizers.get(key));
    }

    public synchronized Optional<RegressionForest> forest(String key) {
        return Optional.ofNullable(forests.get(key));
    }
}
