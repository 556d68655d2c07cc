package com.feedbackinsights.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feedbackinsights.error.InsufficientDataException;
import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.forest.RegressionForest;
import com.feedbackinsights.forest.RegressionMetrics;
import com.feedbackinsights.forest.TrainTestSplit;
import com.feedbackinsights.runtime.RunContext;
import com.feedbackinsights.store.SectionImportanceRanking;

/**
 * Ranks categories by how strongly their scores drive the overall score of
 * satisfied respondents.
 */
public class SectionImportanceRanker {
    public static final String STAGE = "rank";

    private static final Logger log = LoggerFactory.getLogger(SectionImportanceRanker.class);

    private final List<String> categories;
    private final RankingSettings settings;

    public SectionImportanceRanker(List<String> categories, RankingSettings settings) {
        if (categories.isEmpty()) {
            throw new IllegalArgumentException("At least one category is required");
        }
        this.categories = List.copyOf(categories);
        this.settings = settings;
    }

    public StageResult<SectionImportanceRanking> tryRank(RunContext context, List<FeedbackRecord> records, ModelRegistry registry) {
        return StageResult.capture(STAGE, ModelRegistry.SECTION_RANKING_KEY, () -> rank(context, records, registry));
    }

    public SectionImportanceRanking rank(RunContext context, List<FeedbackRecord> records, ModelRegistry registry) {
        List<FeedbackRecord> satisfied = records.stream()
                .filter(this::hasUsableScores)
                .filter(record -> record.meanScore().getAsDouble() >= settings.satisfiedThreshold())
                .toList();
        if (satisfied.size() < settings.minSamples()) {
            throw new InsufficientDataException(ModelRegistry.SECTION_RANKING_KEY, satisfied.size(), settings.minSamples());
        }

        double[] fill = new double[categories.size()];
        for (int c = 0; c < categories.size(); c++) {
            String category = categories.get(c);
            OptionalDouble mean = satisfied.stream()
                    .map(record -> record.scoreFor(category))
                    .filter(OptionalDouble::isPresent)
                    .mapToDouble(OptionalDouble::getAsDouble)
                    .average();
            fill[c] = mean.orElse(settings.defaultScore());
        }

        double[][] x = new double[satisfied.size()][categories.size()];
        double[] y = new double[satisfied.size()];
        for (int i = 0; i < satisfied.size(); i++) {
            FeedbackRecord record = satisfied.get(i);
            for (int c = 0; c < categories.size(); c++) {
                x[i][c] = record.scoreFor(categories.get(c)).orElse(fill[c]);
            }
            y[i] = record.meanScore().getAsDouble();
        }

        TrainTestSplit split = TrainTestSplit.shuffled(x.length, settings.forest().testFraction(), settings.forest().seed());
        RegressionForest forest = new RegressionForest(settings.forest())
                .fit(TrainTestSplit.select(x, split.trainIndices()), TrainTestSplit.select(y, split.trainIndices()));
        RegressionMetrics metrics = RegressionMetrics.evaluate(
                TrainTestSplit.select(y, split.testIndices()),
                forest.predict(TrainTestSplit.select(x, split.testIndices())));
        registry.register(ModelRegistry.SECTION_RANKING_KEY, null, forest);

        double[] importances = normalize(forest.featureImportances());
        List<Integer> order = new ArrayList<>();
        for (int c = 0; c < categories.size(); c++) {
            order.add(c);
        }
        order.sort(Comparator.<Integer>comparingDouble(c -> importances[c]).reversed());

        List<String> sorted = new ArrayList<>();
        Map<String, Double> perCategory = new LinkedHashMap<>();
        for (int c : order) {
            sorted.add(categories.get(c));
            perCategory.put(categories.get(c), importances[c]);
        }
        log.info("pipeline.rank.completed runId={} samples={} r2={} order={}",
                context.runId(),
                satisfied.size(),
                String.format("%.4f", metrics.r2()),
                sorted);
        return new SectionImportanceRanking(sorted, perCategory, metrics.r2(), metrics.mae(), satisfied.size(), context.requestedAt());
    }

    public List<String> categories() {
        return categories;
    }

    private boolean hasUsableScores(FeedbackRecord record) {
        if (record.categoryScores().isEmpty()) {
            return false;
        }
        return record.categoryScores().values().stream().allMatch(Double::isFinite);
    }

    private static double[] normalize(double[] importances) {
        double total = 0.0;
        for (double value : importances) {
            total += value;
        }
        double[] normalized = new double[importances.length];
        for (int i = 0; i < importances.length; i++) {
            normalized[i] = total > 0.0 ? importances[i] / total : 1.0 / importances.length;
        }
        return normalized;
    }
}
