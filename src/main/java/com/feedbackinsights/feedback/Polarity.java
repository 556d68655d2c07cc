package com.feedbackinsights.feedback;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Score bucket a per-category model is trained on.
 */
public enum Polarity {
    /** Category score at or above the strength threshold. */
    STRENGTH,
    /** Category score strictly below the lacking threshold. */
    LACKING;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Polarity fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Polarity must not be blank");
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "strength", "positive" -> STRENGTH;
            case "lacking", "negative" -> LACKING;
            default -> throw new IllegalArgumentException("Unknown polarity: " + value);
        };
    }
}
