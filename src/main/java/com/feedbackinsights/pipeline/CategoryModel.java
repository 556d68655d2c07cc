package com.feedbackinsights.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.feedbackinsights.store.ImportanceResult;

/**
 * A trained (category, polarity) model.
 *
 * @param allImportances every non-noise feature ranked by importance; used by
 *        deduplication and never persisted
 */
public record CategoryModel(ImportanceResult result, Map<String, Double> allImportances) {

    public CategoryModel {
        allImportances = Collections.unmodifiableMap(new LinkedHashMap<>(allImportances));
    }

    public String key() {
        return ModelRegistry.key(result.category(), result.polarity());
    }
}
