package com.feedbackinsights.pipeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feedbackinsights.error.InsufficientDataException;
import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.forest.RegressionForest;
import com.feedbackinsights.forest.RegressionMetrics;
import com.feedbackinsights.forest.TrainTestSplit;
import com.feedbackinsights.runtime.RunContext;
import com.feedbackinsights.store.ImportanceResult;
import com.feedbackinsights.text.NormalizedText;

/**
 * Learns, for every category and polarity bucket, which words predict the
 * category score. Each bucket gets its own vectorizer and forest.
 */
public class PerCategoryImportanceTrainer {
    public static final String STAGE = "train";

    private static final Logger log = LoggerFactory.getLogger(PerCategoryImportanceTrainer.class);

    private final List<String> categories;
    private final ImportanceTrainingSettings settings;

    public PerCategoryImportanceTrainer(List<String> categories, ImportanceTrainingSettings settings) {
        this.categories = List.copyOf(categories);
        this.settings = settings;
    }

    public List<StageResult<CategoryModel>> trainAll(RunContext context, List<FeedbackRecord> records, ModelRegistry registry) {
        List<StageResult<CategoryModel>> results = new ArrayList<>();
        for (String category : categories) {
            for (Polarity polarity : Polarity.values()) {
                String key = ModelRegistry.key(category, polarity);
                results.add(StageResult.capture(STAGE, key, () -> train(context, records, category, polarity, registry)));
            }
        }
        return results;
    }

    public CategoryModel train(
            RunContext context,
            List<FeedbackRecord> records,
            String category,
            Polarity polarity,
            ModelRegistry registry) {
        String key = ModelRegistry.key(category, polarity);
        List<FeedbackRecord> bucket = records.stream()
                .filter(FeedbackRecord::hasText)
                .filter(record -> record.scoreFor(category).isPresent())
                .filter(record -> settings.inBucket(polarity, record.scoreFor(category).getAsDouble()))
                .toList();
        if (bucket.size() < settings.minSamples()) {
            throw new InsufficientDataException(key, bucket.size(), settings.minSamples());
        }

        List<NormalizedText> texts = bucket.stream().map(registry::normalized).toList();
        CategoryWeightVectorizer vectorizer = new CategoryWeightVectorizer(new VectorizerSettings(
                settings.maxFeatures(),
                1,
                settings.maxNgram(),
                settings.minDocumentFrequency(),
                registry.normalizer().stopwords()));
        double[][] x = vectorizer.toMatrix(vectorizer.fitTransform(texts));
        double[] y = bucket.stream().mapToDouble(record -> record.scoreFor(category).getAsDouble()).toArray();

        TrainTestSplit split = TrainTestSplit.shuffled(x.length, settings.forest().testFraction(), settings.forest().seed());
        RegressionForest forest = new RegressionForest(settings.forest())
                .fit(TrainTestSplit.select(x, split.trainIndices()), TrainTestSplit.select(y, split.trainIndices()));
        RegressionMetrics metrics = RegressionMetrics.evaluate(
                TrainTestSplit.select(y, split.testIndices()),
                forest.predict(TrainTestSplit.select(x, split.testIndices())));
        registry.register(key, vectorizer, forest);

        Map<String, Double> ranked = rankFeatures(vectorizer.vocabulary(), forest.featureImportances());
        Map<String, Double> keywords = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : ranked.entrySet()) {
            if (keywords.size() == settings.topKeywords()) {
                break;
            }
            keywords.put(entry.getKey(), entry.getValue());
        }

        ImportanceResult result = new ImportanceResult(
                category,
                polarity,
                keywords,
                metrics.r2(),
                metrics.mae(),
                metrics.rmse(),
                bucket.size(),
                context.requestedAt());
        log.info("pipeline.train.completed runId={} key={} samples={} features={} r2={} keywords={}",
                context.runId(),
                key,
                bucket.size(),
                vectorizer.vocabulary().size(),
                String.format("%.4f", metrics.r2()),
                keywords.keySet());
        return new CategoryModel(result, ranked);
    }

    public List<String> categories() {
        return categories;
    }

    /**
     * Non-noise features by importance, highest first. Equal importances keep
     * vocabulary order.
     */
    private Map<String, Double> rankFeatures(List<String> vocabulary, double[] importances) {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < vocabulary.size(); i++) {
            if (!settings.noiseWords().contains(vocabulary.get(i))) {
                order.add(i);
            }
        }
        order.sort(Comparator.<Integer>comparingDouble(i -> importances[i]).reversed()
                .thenComparingInt(i -> i));
        Map<String, Double> ranked = new LinkedHashMap<>();
        for (int i : order) {
            ranked.put(vocabulary.get(i), importances[i]);
        }
        return ranked;
    }
}
