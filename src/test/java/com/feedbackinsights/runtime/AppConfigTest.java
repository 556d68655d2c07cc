package com.feedbackinsights.runtime;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.feedbackinsights.forest.ForestHyperparameters;
import com.feedbackinsights.pipeline.DeduplicationSettings;
import com.feedbackinsights.pipeline.ImportanceTrainingSettings;
import com.feedbackinsights.pipeline.RankingSettings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldDefaultToDocumentedPipelineSettings() {
        AppConfig config = new AppConfig();

        assertEquals(6, config.getCategories().size());
        assertEquals(ImportanceTrainingSettings.defaults(), config.getTraining().toSettings());
        assertEquals(RankingSettings.defaults(), config.getRanking().toSettings());
        assertEquals(DeduplicationSettings.defaults(), config.getDeduplication().toSettings());
        assertEquals(ForestHyperparameters.wordImportanceDefaults(), config.getTraining().toHyperparameters());
        assertEquals(Path.of(".feedback-insights", "sentiments.json"), config.getStorage().sentimentPath());
    }

    @Test
    void shouldLoadYamlOverridesAndKeepOtherDefaults() throws Exception {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, """
                categories: [Pay, Hours]
                training:
                  minSamples: 5
                  trees: 10
                deduplication:
                  minKeywords: 3
                storage:
                  directory: /tmp/insights
                unknownSection:
                  ignored: true
                """);

        AppConfig config = AppConfig.load(file);

        assertEquals(2, config.getCategories().size());
        assertEquals(5, config.getTraining().getMinSamples());
        assertEquals(10, config.getTraining().toSettings().forest().trees());
        assertEquals(20, config.getTraining().getMaxDepth());
        assertEquals(3, config.getDeduplication().toSettings().minKeywords());
        assertEquals(0, config.getRanking().getMaxDepth());
        assertEquals(Path.of("/tmp/insights"), config.getStorage().directoryPath());
    }

    @Test
    void shouldReturnDefaultsForMissingFile() throws Exception {
        AppConfig config = AppConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(AppConfig.DEFAULT_CATEGORIES, config.getCategories());
        assertTrue(config.getRecommendations().getKeywordTriggers().containsKey("workload"));
    }

    @Test
    void shouldMatchBundledApplicationYaml() throws Exception {
        AppConfig config = AppConfig.load(Path.of("src/main/resources/application.yml"));

        assertEquals(ImportanceTrainingSettings.defaults(), config.getTraining().toSettings());
        assertEquals(DeduplicationSettings.defaults(), config.getDeduplication().toSettings());
        assertEquals(RankingSettings.defaults(), config.getRanking().toSettings());
    }
}
