package com.feedbackinsights.pipeline;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.feedbackinsights.TestRecords;
import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.text.TextNormalizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelRegistryTest {
    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void shouldNormalizeRecordsSharingAnIdSeparately() {
        ModelRegistry registry = new ModelRegistry(normalizer);
        FeedbackRecord first = TestRecords.complete("dup", "salary frozen", Map.of("Pay", 2.0));
        FeedbackRecord second = TestRecords.complete("dup", "manager rude", Map.of("Pay", 2.0));

        assertEquals(normalizer.normalize("salary frozen"), registry.normalized(first));
        assertEquals(normalizer.normalize("manager rude"), registry.normalized(second));
        assertNotEquals(registry.normalized(first), registry.normalized(second));
    }

    @Test
    void shouldReuseTokensForIdenticalText() {
        ModelRegistry registry = new ModelRegistry(normalizer);

        assertSame(
                registry.normalized(TestRecords.complete("a", "long hours", Map.of())),
                registry.normalized(TestRecords.complete("b", "long hours", Map.of())));
    }

    @Test
    void shouldRegisterGlobalVectorizerForTheRun() {
        ModelRegistry registry = new ModelRegistry(normalizer);
        List<FeedbackRecord> records = List.of(
                TestRecords.complete("a", "salary frozen", Map.of()),
                TestRecords.complete("b", "manager rude", Map.of()),
                TestRecords.complete("c", "", Map.of()));

        CategoryWeightVectorizer global = registry.fitGlobalVectorizer(records);

        assertSame(global, registry.vectorizer(ModelRegistry.GLOBAL_KEY).orElseThrow());
        assertEquals(4, global.vocabulary().size());
        assertTrue(registry.vectorizer(ModelRegistry.key("Pay", Polarity.LACKING)).isEmpty());
    }
}
