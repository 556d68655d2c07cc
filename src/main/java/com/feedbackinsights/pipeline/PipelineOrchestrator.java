package com.feedbackinsights.pipeline;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feedbackinsights.error.PersistenceException;
import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.feedback.FeedbackRecordSource;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.runtime.RunContext;
import com.feedbackinsights.sentiment.SentimentResultStore;
import com.feedbackinsights.sentiment.SentimentScorer;
import com.feedbackinsights.sentiment.StoredSentiment;
import com.feedbackinsights.store.CorrelationSnapshot;
import com.feedbackinsights.store.CorrelationStore;
import com.feedbackinsights.store.ImportanceResult;
import com.feedbackinsights.store.OverallKeywordSet;
import com.feedbackinsights.store.SectionImportanceRanking;
import com.feedbackinsights.text.TextNormalizer;

/**
 * Runs a full retrain: load records, backfill sentiment, train every
 * category model, deduplicate, rank categories and commit one snapshot.
 *
 * <p>Runs are serialized. Stage failures become {@link StageError}s in the
 * returned summary; nothing is thrown to the caller.
 */
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final FeedbackRecordSource source;
    private final SentimentResultStore sentimentStore;
    private final CorrelationStore correlationStore;
    private final TextNormalizer normalizer;
    private final SentimentScorer sentimentScorer;
    private final PerCategoryImportanceTrainer trainer;
    private final CrossCategoryDeduplicator deduplicator;
    private final SectionImportanceRanker ranker;
    private final ReentrantLock runLock = new ReentrantLock();

    public PipelineOrchestrator(
            FeedbackRecordSource source,
            SentimentResultStore sentimentStore,
            CorrelationStore correlationStore,
            TextNormalizer normalizer,
            SentimentScorer sentimentScorer,
            PerCategoryImportanceTrainer trainer,
            CrossCategoryDeduplicator deduplicator,
            SectionImportanceRanker ranker) {
        this.source = source;
        this.sentimentStore = sentimentStore;
        this.correlationStore = correlationStore;
        this.normalizer = normalizer;
        this.sentimentScorer = sentimentScorer;
        this.trainer = trainer;
        this.deduplicator = deduplicator;
        this.ranker = ranker;
    }

    public PipelineRunSummary trainAll(RunContext context) {
        runLock.lock();
        try {
            return run(context);
        } finally {
            runLock.unlock();
        }
    }

    private PipelineRunSummary run(RunContext context) {
        Instant startedAt = Instant.now();
        RunState state = new RunState();
        log.info("pipeline.run.started runId={} tenant={}", context.runId(), context.tenantId());
        try {
            List<FeedbackRecord> records;
            try {
                records = source.loadComplete(context);
            } catch (IOException | RuntimeException e) {
                log.error("pipeline.stage.failed stage=load tenant={}", context.tenantId(), e);
                state.errors.add(StageError.of("load", context.tenantId(), StageError.Kind.SOURCE, e));
                return state.summary(context, startedAt, false, correlationStore.currentVersion());
            }

            state.sentimentsComputed = backfillSentiment(context, records, state);

            ModelRegistry registry = new ModelRegistry(normalizer);
            StageResult<CategoryWeightVectorizer> global = StageResult.capture(
                    "vectorize", "global", () -> registry.fitGlobalVectorizer(records));
            global.error().ifPresent(state::record);
            state.globalVocabularySize = global.value().map(vectorizer -> vectorizer.vocabulary().size()).orElse(0);

            List<CategoryModel> models = new ArrayList<>();
            for (StageResult<CategoryModel> result : trainer.trainAll(context, records, registry)) {
                result.value().ifPresent(models::add);
                result.error().ifPresent(state::record);
            }
            models.forEach(model -> state.trained.add(model.key()));

            StageResult<DeduplicationResult> deduplication = StageResult.capture(
                    CrossCategoryDeduplicator.STAGE,
                    "lacking",
                    () -> deduplicator.deduplicate(models, context.requestedAt()));
            deduplication.error().ifPresent(state::record);

            StageResult<SectionImportanceRanking> ranking = ranker.tryRank(context, records, registry);
            ranking.error().ifPresent(state::record);

            List<ImportanceResult> results = collect(models, deduplication.value());
            OverallKeywordSet overall = deduplication.value()
                    .map(DeduplicationResult::overallKeywords)
                    .orElse(OverallKeywordSet.none());

            try {
                CorrelationSnapshot snapshot = correlationStore.replaceAll(
                        context,
                        results,
                        ranking.value().orElse(null),
                        overall);
                return state.summary(context, startedAt, true, snapshot.version());
            } catch (PersistenceException e) {
                log.error("pipeline.stage.failed stage=persist runId={}", context.runId(), e);
                state.errors.add(StageError.of("persist", "snapshot", StageError.Kind.PERSISTENCE, e));
                return state.summary(context, startedAt, false, correlationStore.currentVersion());
            }
        } catch (RuntimeException e) {
            log.error("pipeline.run.failed runId={}", context.runId(), e);
            state.errors.add(StageError.of("run", context.runId(), StageError.Kind.UNEXPECTED, e));
            return state.summary(context, startedAt, false, correlationStore.currentVersion());
        }
    }

    private int backfillSentiment(RunContext context, List<FeedbackRecord> records, RunState state) {
        List<FeedbackRecord> missing = sentimentStore.missing(records);
        if (missing.isEmpty()) {
            return 0;
        }
        Instant analyzedAt = Instant.now();
        List<StoredSentiment> computed = new ArrayList<>();
        for (FeedbackRecord record : missing) {
            String text = record.text() == null ? "" : record.text();
            computed.add(new StoredSentiment(record.id(), sentimentScorer.analyze(text), text.length(), analyzedAt));
        }
        try {
            sentimentStore.upsertAll(computed);
        } catch (IOException e) {
            log.warn("pipeline.stage.failed stage=sentiment runId={} records={}", context.runId(), computed.size(), e);
            state.errors.add(StageError.of("sentiment", "records", StageError.Kind.PERSISTENCE, e));
            return 0;
        }
        log.info("pipeline.sentiment.completed runId={} computed={}", context.runId(), computed.size());
        return computed.size();
    }

    /**
     * Strength results as trained, lacking results as refined by
     * deduplication, in configured category order.
     */
    private List<ImportanceResult> collect(List<CategoryModel> models, Optional<DeduplicationResult> deduplication) {
        List<ImportanceResult> results = new ArrayList<>();
        for (CategoryModel model : models) {
            if (model.result().polarity() == Polarity.STRENGTH || deduplication.isEmpty()) {
                results.add(model.result());
            }
        }
        deduplication.ifPresent(value -> results.addAll(value.refinedLacking()));
        List<String> categories = trainer.categories();
        results.sort(Comparator.<ImportanceResult>comparingInt(result -> categories.indexOf(result.category()))
                .thenComparing(ImportanceResult::polarity));
        return results;
    }

    private static final class RunState {
        private final List<String> trained = new ArrayList<>();
        private final List<String> skipped = new ArrayList<>();
        private final List<StageError> errors = new ArrayList<>();
        private int sentimentsComputed;
        private int globalVocabularySize;

        void record(StageError error) {
            if (error.kind() == StageError.Kind.INSUFFICIENT_DATA) {
                skipped.add(error.subject());
            } else {
                errors.add(error);
            }
        }

        PipelineRunSummary summary(RunContext context, Instant startedAt, boolean succeeded, long version) {
            PipelineRunSummary summary = new PipelineRunSummary(
                    context.runId(),
                    trained,
                    skipped,
                    errors,
                    sentimentsComputed,
                    globalVocabularySize,
                    version,
                    succeeded,
                    startedAt,
                    Instant.now());
            log.info("pipeline.run.finished runId={} succeeded={} trained={} skipped={} errors={} vocabulary={} version={}",
                    summary.runId(),
                    summary.succeeded(),
                    summary.trained().size(),
                    summary.skipped().size(),
                    summary.errors().size(),
                    summary.globalVocabularySize(),
                    summary.snapshotVersion());
            return summary;
        }
    }
}
