package com.feedbackinsights.error;

public class TrainingException extends InsightException {
    public TrainingException(String message) {
        super(message);
    }

    public TrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
