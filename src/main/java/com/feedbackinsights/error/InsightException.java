package com.feedbackinsights.error;

/**
 * Base type for pipeline failures that are reported as data rather than
 * propagated out of a training run.
 */
public abstract class InsightException extends RuntimeException {
    protected InsightException(String message) {
        super(message);
    }

    protected InsightException(String message, Throwable cause) {
        super(message, cause);
    }
}
