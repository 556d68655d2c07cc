package com.feedbackinsights.sentiment;

/**
 * Compound valence in [-1, 1] plus the positive, neutral and negative shares
 * of the text, which sum to 1.
 */
public record SentimentResult(
        double compound,
        double pos,
        double neu,
        double neg,
        SentimentLabel label,
        double confidence) {

    public static final double POSITIVE_THRESHOLD = 0.05;
    public static final double NEGATIVE_THRESHOLD = -0.05;

    public static SentimentResult empty() {
        return new SentimentResult(0.0, 0.0, 1.0, 0.0, SentimentLabel.NEUTRAL, 0.0);
    }

    public static SentimentResult fromScores(double compound, double pos, double neu, double neg) {
        if (compound >= POSITIVE_THRESHOLD) {
            return new SentimentResult(compound, pos, neu, neg, SentimentLabel.POSITIVE, compound);
        }
        if (compound <= NEGATIVE_THRESHOLD) {
            return new SentimentResult(compound, pos, neu, neg, SentimentLabel.NEGATIVE, Math.abs(compound));
        }
        return new SentimentResult(compound, pos, neu, neg, SentimentLabel.NEUTRAL, neu);
    }
}
