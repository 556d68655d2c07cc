package com.feedbackinsights.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.store.ImportanceResult;
import com.feedbackinsights.store.OverallKeywordSet;

/**
 * Removes generic complaints from the per-category lacking keywords.
 *
 * <p>Positive importances from every lacking model are summed per word. The
 * highest scoring words that at least two categories share form the common
 * vocabulary, which no category may list, and the top of the full ranking
 * becomes the overall keyword set. A category keeps the words it owns most
 * of, ordered by share times score. When every word a category has is
 * common, it keeps its own ranking minus the ambiguous words.
 */
public class CrossCategoryDeduplicator {
    public static final String STAGE = "deduplicate";

    private static final Logger log = LoggerFactory.getLogger(CrossCategoryDeduplicator.class);

    private final DeduplicationSettings settings;

    public CrossCategoryDeduplicator(DeduplicationSettings settings) {
        this.settings = settings;
    }

    public DeduplicationResult deduplicate(List<CategoryModel> models, Instant computedAt) {
        List<CategoryModel> lacking = models.stream()
                .filter(model -> model.result().polarity() == Polarity.LACKING)
                .toList();

        Map<String, Double> aggregate = new HashMap<>();
        Map<String, Integer> modelCount = new HashMap<>();
        for (CategoryModel model : lacking) {
            for (Map.Entry<String, Double> entry : model.allImportances().entrySet()) {
                if (entry.getValue() > 0.0 && !settings.ambiguousWords().contains(entry.getKey())) {
                    aggregate.merge(entry.getKey(), entry.getValue(), Double::sum);
                    modelCount.merge(entry.getKey(), 1, Integer::sum);
                }
            }
        }
        List<String> ranked = new ArrayList<>(aggregate.keySet());
        ranked.sort(Comparator.<String>comparingDouble(aggregate::get).reversed()
                .thenComparing(Comparator.naturalOrder()));

        // a word one category owns alone is never generic
        List<String> common = ranked.stream()
                .filter(word -> modelCount.get(word) >= 2)
                .limit(settings.commonVocabularySize())
                .toList();
        Set<String> excluded = new HashSet<>(common);
        excluded.addAll(settings.ambiguousWords());

        Map<String, Double> overall = new LinkedHashMap<>();
        for (String word : ranked.subList(0, Math.min(settings.overallKeywordCount(), ranked.size()))) {
            overall.put(word, aggregate.get(word));
        }

        List<ImportanceResult> refined = new ArrayList<>();
        for (CategoryModel model : lacking) {
            Map<String, Double> keywords = refine(model, aggregate, excluded);
            refined.add(model.result().withKeywords(keywords));
            log.debug("pipeline.deduplicate.category key={} before={} after={}",
                    model.key(),
                    model.result().keywords().keySet(),
                    keywords.keySet());
        }
        log.info("pipeline.deduplicate.completed models={} common={} overall={}",
                lacking.size(),
                common.size(),
                overall.keySet());
        return new DeduplicationResult(refined, common, new OverallKeywordSet(overall, computedAt));
    }

    private Map<String, Double> refine(CategoryModel model, Map<String, Double> aggregate, Set<String> excluded) {
        List<String> candidates = new ArrayList<>();
        List<String> specific = new ArrayList<>();
        Map<String, Double> weight = new HashMap<>();
        for (Map.Entry<String, Double> entry : model.allImportances().entrySet()) {
            String word = entry.getKey();
            if (excluded.contains(word)) {
                continue;
            }
            candidates.add(word);
            double score = entry.getValue();
            double overall = aggregate.getOrDefault(word, 0.0);
            double ratio = overall == 0.0 ? 1.0 : score / overall;
            if (overall == 0.0 || ratio >= settings.specializationThreshold()) {
                specific.add(word);
                weight.put(word, ratio * score);
            }
        }
        // stable sort keeps importance order between equal weights
        specific.sort(Comparator.<String>comparingDouble(weight::get).reversed());

        List<String> chosen = specific.size() >= settings.minKeywords() ? specific : candidates;
        if (chosen.isEmpty()) {
            chosen = model.allImportances().keySet().stream()
                    .filter(word -> !settings.ambiguousWords().contains(word))
                    .toList();
        }
        Map<String, Double> keywords = new LinkedHashMap<>();
        for (String word : chosen) {
            if (keywords.size() == settings.maxKeywords()) {
                break;
            }
            keywords.put(word, model.allImportances().get(word));
        }
        return keywords;
    }
}
