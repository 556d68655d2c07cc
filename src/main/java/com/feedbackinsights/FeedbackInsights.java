package com.feedbackinsights;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.feedback.FeedbackRecordSource;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.insight.SectionInsight;
import com.feedbackinsights.insight.SectionInsightService;
import com.feedbackinsights.pipeline.CrossCategoryDeduplicator;
import com.feedbackinsights.pipeline.PerCategoryImportanceTrainer;
import com.feedbackinsights.pipeline.PipelineOrchestrator;
import com.feedbackinsights.pipeline.PipelineRunSummary;
import com.feedbackinsights.pipeline.SectionImportanceRanker;
import com.feedbackinsights.runtime.AppConfig;
import com.feedbackinsights.runtime.RunContext;
import com.feedbackinsights.sentiment.SentimentResult;
import com.feedbackinsights.sentiment.SentimentResultStore;
import com.feedbackinsights.sentiment.SentimentScorer;
import com.feedbackinsights.sentiment.StoredSentiment;
import com.feedbackinsights.store.CorrelationStore;
import com.feedbackinsights.store.ImportanceResult;
import com.feedbackinsights.store.JsonFileCorrelationStore;
import com.feedbackinsights.store.SectionImportanceRanking;
import com.feedbackinsights.text.TextNormalizer;

/**
 * Entry point for callers: retrain on demand and read the latest committed
 * results.
 */
public class FeedbackInsights {
    private final PipelineOrchestrator orchestrator;
    private final CorrelationStore correlationStore;
    private final SentimentResultStore sentimentStore;
    private final SentimentScorer sentimentScorer;
    private final SectionInsightService insightService;

    public FeedbackInsights(
            AppConfig config,
            FeedbackRecordSource source,
            CorrelationStore correlationStore,
            SentimentResultStore sentimentStore) {
        this.correlationStore = correlationStore;
        this.sentimentStore = sentimentStore;
        this.sentimentScorer = new SentimentScorer();
        List<String> categories = config.getCategories();
        this.orchestrator = new PipelineOrchestrator(
                source,
                sentimentStore,
                correlationStore,
                new TextNormalizer(),
                sentimentScorer,
                new PerCategoryImportanceTrainer(categories, config.getTraining().toSettings()),
                new CrossCategoryDeduplicator(config.getDeduplication().toSettings()),
                new SectionImportanceRanker(categories, config.getRanking().toSettings()));
        this.insightService = new SectionInsightService(correlationStore, categories, config.getRecommendations());
    }

    /**
     * Wires file-backed stores under the configured storage directory.
     */
    public static FeedbackInsights create(AppConfig config, FeedbackRecordSource source) throws IOException {
        AppConfig.StorageConfig storage = config.getStorage();
        return new FeedbackInsights(
                config,
                source,
                new JsonFileCorrelationStore(storage.directoryPath()),
                new SentimentResultStore(storage.sentimentPath()));
    }

    public PipelineRunSummary trainAll() {
        return trainAll(RunContext.forTenant(RunContext.DEFAULT_TENANT));
    }

    public PipelineRunSummary trainAll(RunContext context) {
        return orchestrator.trainAll(context);
    }

    public Optional<ImportanceResult> getKeywords(String category, Polarity polarity) {
        return correlationStore.getLatest(category, polarity);
    }

    public List<String> getOverallKeywords() {
        return correlationStore.getOverallKeywords().words();
    }

    public Optional<SectionImportanceRanking> getSectionRanking() {
        return correlationStore.getOverallRanking();
    }

    public SentimentResult analyzeSentiment(String text) {
        return sentimentScorer.analyze(text);
    }

    public Optional<StoredSentiment> storedSentiment(String recordId) {
        return sentimentStore.get(recordId);
    }

    public Map<String, SectionInsight> insightsFor(FeedbackRecord record) {
        return insightService.insightsFor(record);
    }

    public long snapshotVersion() {
        return correlationStore.currentVersion();
    }
}
