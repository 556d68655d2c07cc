package com.feedbackinsights.error;

public class VectorizationException extends InsightException {
    public VectorizationException(String message) {
        super(message);
    }
}
