package com.feedbackinsights.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.feedbackinsights.TestRecords;
import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.runtime.RunContext;
import com.feedbackinsights.store.ImportanceResult;
import com.feedbackinsights.text.TextNormalizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrossCategoryDeduplicatorTest {
    private static final Instant NOW = Instant.parse("2024-03-05T12:00:00Z");

    @Test
    void shouldKeepCategorySpecificWordsAndDropCommonOnes() {
        DeduplicationSettings settings = new DeduplicationSettings(1, 3, 1.0, 1, 5, DeduplicationSettings.DEFAULT_AMBIGUOUS_WORDS);

        DeduplicationResult result = new CrossCategoryDeduplicator(settings).deduplicate(sampleModels(), NOW);

        assertEquals(List.of("manager"), result.commonVocabulary());
        assertEquals(List.of("manager", "payroll", "training"), result.overallKeywords().words());
        assertEquals(1.1, result.overallKeywords().keywords().get("manager"), 1e-9);
        assertEquals(2, result.refinedLacking().size());
        assertEquals(List.of("payroll"), result.refinedLacking().get(0).words());
        assertEquals(List.of("training"), result.refinedLacking().get(1).words());
        assertEquals(0.3, result.refinedLacking().get(0).keywords().get("payroll"), 1e-9);
    }

    @Test
    void shouldFallBackToUnfilteredRankingWhenTooFewSpecificWords() {
        DeduplicationSettings settings = new DeduplicationSettings(1, 10, 1.0, 2, 5, DeduplicationSettings.DEFAULT_AMBIGUOUS_WORDS);

        DeduplicationResult result = new CrossCategoryDeduplicator(settings).deduplicate(sampleModels(), NOW);

        assertEquals(List.of("payroll", "overtime"), result.refinedLacking().get(0).words());
        assertEquals(List.of("training", "overtime"), result.refinedLacking().get(1).words());
        assertTrue(result.refinedLacking().stream().noneMatch(r -> r.keywords().containsKey("nice")));
        assertFalse(result.overallKeywords().words().contains("nice"));
    }

    @Test
    void shouldKeepMetricsAndIgnoreStrengthModels() {
        List<CategoryModel> models = new ArrayList<>(sampleModels());
        models.add(model("Pay", Polarity.STRENGTH, Map.of("salary", 0.9)));

        DeduplicationResult result = new CrossCategoryDeduplicator(DeduplicationSettings.defaults()).deduplicate(models, NOW);

        assertEquals(2, result.refinedLacking().size());
        ImportanceResult refined = result.refinedLacking().get(0);
        assertEquals(14, refined.sampleSize());
        assertEquals(0.42, refined.modelR2());
        assertFalse(result.overallKeywords().words().contains("salary"));
    }

    @Test
    void shouldExcludeWordSharedByEveryLackingBucket() {
        List<String> categories = List.of("Hours", "Growth");
        List<FeedbackRecord> records = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            boolean worst = i % 2 == 0;
            records.add(TestRecords.complete("h" + i, worst ? "manager slow" : "manager slow shifts",
                    Map.of("Hours", worst ? 1.0 : 2.5, "Growth", 3.5)));
            records.add(TestRecords.complete("g" + i, worst ? "manager rude" : "manager rude staff",
                    Map.of("Hours", 3.5, "Growth", worst ? 1.0 : 2.5)));
        }
        TextNormalizer normalizer = new TextNormalizer();
        String manager = normalizer.normalize("manager").tokens().get(0);
        RunContext context = new RunContext("acme", "run-dedup", NOW);
        PerCategoryImportanceTrainer trainer = new PerCategoryImportanceTrainer(categories, ImportanceTrainingSettings.defaults());
        ModelRegistry registry = new ModelRegistry(normalizer);
        List<CategoryModel> lacking = List.of(
                trainer.train(context, records, "Hours", Polarity.LACKING, registry),
                trainer.train(context, records, "Growth", Polarity.LACKING, registry));
        assertTrue(lacking.get(0).result().keywords().containsKey(manager));

        DeduplicationResult result = new CrossCategoryDeduplicator(DeduplicationSettings.defaults()).deduplicate(lacking, NOW);

        assertTrue(result.commonVocabulary().contains(manager));
        for (ImportanceResult refined : result.refinedLacking()) {
            assertFalse(refined.keywords().containsKey(manager), refined.category());
            assertFalse(refined.keywords().isEmpty(), refined.category());
        }
        assertTrue(result.overallKeywords().words().contains(manager));
    }

    @Test
    void shouldKeepKeywordsForOnlyLackingCategory() {
        Map<String, Double> pay = new LinkedHashMap<>();
        pay.put("delay", 0.88);
        pay.put("cut salary", 0.10);
        pay.put("bonus", 0.02);
        pay.put("bonus cut", 0.0);
        pay.put("cut", 0.0);

        DeduplicationResult result = new CrossCategoryDeduplicator(DeduplicationSettings.defaults())
                .deduplicate(List.of(model("Pay", Polarity.LACKING, pay)), NOW);

        assertTrue(result.commonVocabulary().isEmpty());
        assertEquals(List.of("delay", "cut salary", "bonus", "bonus cut", "cut"), result.refinedLacking().get(0).words());
        assertEquals(List.of("delay", "cut salary", "bonus"), result.overallKeywords().words());
    }

    @Test
    void shouldFallBackToOwnRankingWhenEveryWordIsCommon() {
        Map<String, Double> pay = new LinkedHashMap<>();
        pay.put("manager", 0.7);
        pay.put("nice", 0.2);
        pay.put("overtime", 0.1);
        Map<String, Double> growth = new LinkedHashMap<>();
        growth.put("manager", 0.6);
        growth.put("overtime", 0.4);

        DeduplicationResult result = new CrossCategoryDeduplicator(DeduplicationSettings.defaults())
                .deduplicate(List.of(model("Pay", Polarity.LACKING, pay), model("Growth", Polarity.LACKING, growth)), NOW);

        assertEquals(List.of("manager", "overtime"), result.commonVocabulary());
        assertEquals(List.of("manager", "overtime"), result.refinedLacking().get(0).words());
        assertEquals(List.of("manager", "overtime"), result.refinedLacking().get(1).words());
    }

    private static List<CategoryModel> sampleModels() {
        Map<String, Double> pay = new LinkedHashMap<>();
        pay.put("manager", 0.5);
        pay.put("payroll", 0.3);
        pay.put("nice", 0.1);
        pay.put("overtime", 0.1);
        Map<String, Double> growth = new LinkedHashMap<>();
        growth.put("manager", 0.6);
        growth.put("training", 0.3);
        growth.put("overtime", 0.1);
        return List.of(model("Pay", Polarity.LACKING, pay), model("Growth", Polarity.LACKING, growth));
    }

    private static CategoryModel model(String category, Polarity polarity, Map<String, Double> importances) {
        Map<String, Double> top = new LinkedHashMap<>();
        importances.entrySet().stream().limit(5).forEach(entry -> top.put(entry.getKey(), entry.getValue()));
        ImportanceResult result = new ImportanceResult(category, polarity, top, 0.42, 0.3, 0.4, 14, NOW);
        return new CategoryModel(result, importances);
    }
}
