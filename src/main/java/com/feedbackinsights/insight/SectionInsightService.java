package com.feedbackinsights.insight;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.runtime.AppConfig;
import com.feedbackinsights.store.CorrelationStore;
import com.feedbackinsights.store.ImportanceResult;

public class SectionInsightService {
    private final CorrelationStore store;
    private final List<String> categories;
    private final AppConfig.RecommendationConfig recommendations;

    public SectionInsightService(CorrelationStore store, List<String> categories, AppConfig.RecommendationConfig recommendations) {
        this.store = store;
        this.categories = List.copyOf(categories);
        this.recommendations = recommendations;
    }

    /**
     * One insight per configured category, in configured order. Categories
     * the response did not score are marked as having no data.
     */
    public Map<String, SectionInsight> insightsFor(FeedbackRecord record) {
        Map<String, SectionInsight> insights = new LinkedHashMap<>();
        for (String category : categories) {
            OptionalDouble score = record.scoreFor(category);
            if (score.isEmpty()) {
                insights.put(category, SectionInsight.noData(category));
                continue;
            }
            List<String> keywords = store.getLatest(category, Polarity.LACKING)
                    .map(ImportanceResult::words)
                    .orElse(List.of());
            insights.put(category, new SectionInsight(
                    category,
                    score.getAsDouble(),
                    score.getAsDouble() < recommendations.getLowScoreThreshold(),
                    false,
                    keywords,
                    recommend(category, keywords)));
        }
        return insights;
    }

    List<String> recommend(String category, List<String> lackingKeywords) {
        if (lackingKeywords.isEmpty()) {
            return List.of();
        }
        Set<String> lines = new LinkedHashSet<>();
        String joined = String.join(" ", lackingKeywords).toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> trigger : recommendations.getKeywordTriggers().entrySet()) {
            if (joined.contains(trigger.getKey().toLowerCase(Locale.ROOT))) {
                lines.add(trigger.getValue());
                break;
            }
        }
        List<String> sectionLines = recommendations.getSections().getOrDefault(category, List.of());
        lines.addAll(sectionLines.subList(0, Math.min(recommendations.getSectionLinesPerInsight(), sectionLines.size())));
        return new ArrayList<>(lines);
    }
}
