package com.feedbackinsights.error;

public class PersistenceException extends InsightException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
