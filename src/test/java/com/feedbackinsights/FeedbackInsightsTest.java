package com.feedbackinsights;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.insight.SectionInsight;
import com.feedbackinsights.pipeline.PipelineRunSummary;
import com.feedbackinsights.runtime.AppConfig;
import com.feedbackinsights.runtime.RunContext;
import com.feedbackinsights.sentiment.SentimentLabel;
import com.feedbackinsights.sentiment.SentimentResult;
import com.feedbackinsights.sentiment.SentimentResultStore;
import com.feedbackinsights.store.ImportanceResult;
import com.feedbackinsights.store.JsonFileCorrelationStore;
import com.feedbackinsights.text.TextNormalizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedbackInsightsTest {
    private static final RunContext CONTEXT = new RunContext("acme", "run-1", Instant.parse("2024-03-05T12:00:00Z"));

    @TempDir
    Path tempDir;

    @Test
    void shouldExposePayKeywordsAfterRetrain() throws Exception {
        FeedbackInsights insights = insights(payScenario());

        PipelineRunSummary summary = insights.trainAll(CONTEXT);

        assertTrue(summary.succeeded());
        assertEquals(List.of("Pay/strength"), summary.trained());
        assertTrue(summary.skipped().contains("Pay/lacking"));
        assertEquals(20, summary.sentimentsComputed());
        TextNormalizer normalizer = new TextNormalizer();
        Set<String> terms = new HashSet<>(normalizer.normalize("salary bonus raise").tokens());
        terms.addAll(normalizer.normalize("the office is fine").tokens());
        assertEquals(terms.size(), summary.globalVocabularySize());
        assertEquals(1L, insights.snapshotVersion());

        ImportanceResult pay = insights.getKeywords("Pay", Polarity.STRENGTH).orElseThrow();
        assertEquals(12, pay.sampleSize());
        for (String token : normalizer.normalize("salary bonus raise").tokens()) {
            assertTrue(pay.keywords().containsKey(token), token);
        }
        assertTrue(insights.getKeywords("Pay", Polarity.LACKING).isEmpty());
        assertTrue(insights.getKeywords("Culture", Polarity.STRENGTH).isEmpty());
        assertTrue(insights.getSectionRanking().isEmpty());
        assertTrue(insights.storedSentiment("p0").isPresent());
    }

    @Test
    void shouldKeepKeywordsWhenOnlyOneCategoryIsLacking() throws Exception {
        List<FeedbackRecord> records = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            boolean delayed = i % 2 == 0;
            records.add(TestRecords.complete("l" + i, delayed ? "bonus cut salary delay" : "bonus cut salary",
                    Map.of("Pay", delayed ? 1.0 : 2.5, "Culture", 4.5)));
        }
        FeedbackInsights insights = insights(records);

        PipelineRunSummary summary = insights.trainAll(CONTEXT);

        assertTrue(summary.trained().contains("Pay/lacking"));
        ImportanceResult lacking = insights.getKeywords("Pay", Polarity.LACKING).orElseThrow();
        assertFalse(lacking.keywords().isEmpty());
        assertTrue(lacking.keywords().size() <= 5);
        assertFalse(insights.getOverallKeywords().isEmpty());
    }

    @Test
    void shouldReadNothingBeforeFirstRun() throws Exception {
        FeedbackInsights insights = insights(payScenario());

        assertEquals(0L, insights.snapshotVersion());
        assertTrue(insights.getKeywords("Pay", Polarity.STRENGTH).isEmpty());
        assertTrue(insights.getOverallKeywords().isEmpty());
        assertTrue(insights.getSectionRanking().isEmpty());
    }

    @Test
    void shouldScoreEmptyTextAsNeutral() throws Exception {
        FeedbackInsights insights = insights(List.of());

        SentimentResult result = insights.analyzeSentiment("");

        assertEquals(SentimentLabel.NEUTRAL, result.label());
        assertEquals(0.0, result.compound());
        assertEquals(1.0, result.neu());
    }

    @Test
    void shouldMarkUnscoredCategoriesAsNoData() throws Exception {
        FeedbackInsights insights = insights(payScenario());
        insights.trainAll(CONTEXT);

        Map<String, SectionInsight> sections = insights.insightsFor(
                TestRecords.complete("x", "Pay is low", Map.of("Pay", 2.0)));

        assertEquals(List.of("Pay", "Culture"), List.copyOf(sections.keySet()));
        assertTrue(sections.get("Pay").low());
        assertTrue(sections.get("Culture").noData());
    }

    private FeedbackInsights insights(List<FeedbackRecord> records) throws Exception {
        AppConfig config = new AppConfig();
        config.setCategories(new ArrayList<>(List.of("Pay", "Culture")));
        return new FeedbackInsights(
                config,
                (context, filter) -> records,
                new JsonFileCorrelationStore(tempDir.resolve("store")),
                new SentimentResultStore(tempDir.resolve("sentiments.json")));
    }

    private static List<FeedbackRecord> payScenario() {
        List<FeedbackRecord> records = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            records.add(TestRecords.complete("p" + i, "salary bonus raise", Map.of("Pay", 4.5, "Culture", 3.0)));
        }
        for (int i = 0; i < 8; i++) {
            records.add(TestRecords.complete("g" + i, "the office is fine", Map.of("Pay", 3.0, "Culture", 3.0)));
        }
        return records;
    }
}
