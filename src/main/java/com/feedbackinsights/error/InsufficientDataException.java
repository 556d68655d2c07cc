package com.feedbackinsights.error;

public class InsufficientDataException extends InsightException {
    private final int available;
    private final int required;

    public InsufficientDataException(String subject, int available, int required) {
        super(subject + " has " + available + " samples, requires at least " + required);
        this.available = available;
        this.required = required;
    }

    public int available() {
        return available;
    }

    public int required() {
        return required;
    }
}
