package com.feedbackinsights.sentiment;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SentimentLabel {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SentimentLabel fromLabel(String value) {
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
