package com.feedbackinsights.pipeline;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outcome of one pipeline stage: either a value or a {@link StageError}.
 */
public final class StageResult<T> {
    private static final Logger log = LoggerFactory.getLogger(StageResult.class);

    private final T value;
    private final StageError error;

    private StageResult(T value, StageError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> StageResult<T> failure(StageError error) {
        return new StageResult<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * Runs {@code work}, turning any runtime failure into a failed result.
     * Insufficient data is logged at info since it is an expected outcome.
     */
    public static <T> StageResult<T> capture(String stage, String subject, Supplier<T> work) {
        try {
            return success(work.get());
        } catch (RuntimeException e) {
            StageError error = StageError.from(stage, subject, e);
            if (error.kind() == StageError.Kind.INSUFFICIENT_DATA) {
                log.info("pipeline.stage.skipped stage={} subject={} reason={}", stage, subject, error.message());
            } else if (error.kind() == StageError.Kind.UNEXPECTED) {
                log.error("pipeline.stage.failed stage={} subject={} kind={}", stage, subject, error.kind(), e);
            } else {
                log.warn("pipeline.stage.failed stage={} subject={} kind={} reason={}",
                        stage,
                        subject,
                        error.kind(),
                        error.message());
            }
            return failure(error);
        }
    }

    public boolean succeeded() {
        return error == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<StageError> error() {
        return Optional.ofNullable(error);
    }
}
