package com.feedbackinsights.insight;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.feedbackinsights.TestRecords;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.runtime.AppConfig;
import com.feedbackinsights.runtime.RunContext;
import com.feedbackinsights.store.ImportanceResult;
import com.feedbackinsights.store.JsonFileCorrelationStore;
import com.feedbackinsights.store.OverallKeywordSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SectionInsightServiceTest {
    private static final Instant TRAINED = Instant.parse("2024-03-05T12:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldDescribeEveryConfiguredCategory() throws Exception {
        SectionInsightService service = service();
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("Work-Life Balance", 2.0);
        scores.put("Compensation & Benefits", 4.5);

        Map<String, SectionInsight> insights = service.insightsFor(TestRecords.complete("r1", "Too much overtime", scores));

        assertEquals(AppConfig.DEFAULT_CATEGORIES, List.copyOf(insights.keySet()));
        SectionInsight balance = insights.get("Work-Life Balance");
        assertTrue(balance.low());
        assertEquals(List.of("workload", "overtime"), balance.lackingKeywords());
        assertEquals(List.of(
                "Address workload concerns and resource allocation",
                "Review workload distribution and deadlines",
                "Implement flexible working arrangements"), balance.recommendations());

        SectionInsight pay = insights.get("Compensation & Benefits");
        assertFalse(pay.low());
        assertTrue(pay.lackingKeywords().isEmpty());
        assertTrue(pay.recommendations().isEmpty());

        SectionInsight culture = insights.get("Culture & Values");
        assertTrue(culture.noData());
        assertNull(culture.score());
    }

    @Test
    void shouldUseFirstMatchingTriggerOnly() throws Exception {
        SectionInsightService service = service();

        List<String> lines = service.recommend("Diversity & Inclusion", List.of("communication", "recognition"));

        assertEquals(List.of("Improve communication processes and transparency"), lines);
    }

    private SectionInsightService service() throws Exception {
        JsonFileCorrelationStore store = new JsonFileCorrelationStore(tempDir);
        Map<String, Double> keywords = new LinkedHashMap<>();
        keywords.put("workload", 0.4);
        keywords.put("overtime", 0.2);
        store.replaceAll(new RunContext("acme", "run-1", TRAINED),
                List.of(new ImportanceResult("Work-Life Balance", Polarity.LACKING, keywords, 0.5, 0.3, 0.4, 15, TRAINED)),
                null,
                OverallKeywordSet.none());
        AppConfig config = new AppConfig();
        return new SectionInsightService(store, config.getCategories(), config.getRecommendations());
    }
}
