package com.feedbackinsights.pipeline;

import com.feedbackinsights.error.InsufficientDataException;
import com.feedbackinsights.error.PersistenceException;
import com.feedbackinsights.error.TrainingException;
import com.feedbackinsights.error.VectorizationException;

/**
 * A stage failure reported as data.
 *
 * @param subject what the stage was working on, e.g. {@code Work-Life Balance/lacking}
 */
public record StageError(String stage, String subject, Kind kind, String message) {

    public enum Kind {
        INSUFFICIENT_DATA,
        VECTORIZATION,
        TRAINING,
        PERSISTENCE,
        SOURCE,
        UNEXPECTED
    }

    public static StageError from(String stage, String subject, Throwable failure) {
        return new StageError(stage, subject, kindOf(failure), describe(failure));
    }

    public static StageError of(String stage, String subject, Kind kind, Throwable failure) {
        return new StageError(stage, subject, kind, describe(failure));
    }

    static Kind kindOf(Throwable failure) {
        if (failure instanceof InsufficientDataException) {
            return Kind.INSUFFICIENT_DATA;
        }
        if (failure instanceof VectorizationException) {
            return Kind.VECTORIZATION;
        }
        if (failure instanceof TrainingException) {
            return Kind.TRAINING;
        }
        if (failure instanceof PersistenceException) {
            return Kind.PERSISTENCE;
        }
        return Kind.UNEXPECTED;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }
}
