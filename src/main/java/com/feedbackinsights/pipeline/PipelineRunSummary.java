package com.feedbackinsights.pipeline;

import java.time.Instant;
import java.util.List;

/**
 * @param trained keys ({@code category/polarity}) that produced a result
 * @param skipped keys and stages omitted for lack of data
 * @param errors every other stage failure
 * @param globalVocabularySize terms in the run-wide vectorizer, {@code 0} when it could not be fitted
 * @param snapshotVersion store version visible after the run
 * @param succeeded {@code false} when records could not be loaded, the
 *        snapshot could not be committed or the run failed unexpectedly
 */
public record PipelineRunSummary(
        String runId,
        List<String> trained,
        List<String> skipped,
        List<StageError> errors,
        int sentimentsComputed,
        int globalVocabularySize,
        long snapshotVersion,
        boolean succeeded,
        Instant startedAt,
        Instant finishedAt) {

    public PipelineRunSummary {
        trained = List.copyOf(trained);
        skipped = List.copyOf(skipped);
        errors = List.copyOf(errors);
    }
}
