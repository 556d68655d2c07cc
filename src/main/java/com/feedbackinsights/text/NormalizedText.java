package com.feedbackinsights.text;

import java.util.List;

public record NormalizedText(List<String> tokens) {

    public NormalizedText {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public static NormalizedText empty() {
        return new NormalizedText(List.of());
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public String joined() {
        return String.join(" ", tokens);
    }
}
