package com.feedbackinsights.sentiment;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SentimentScorerTest {
    private final SentimentScorer scorer = new SentimentScorer();

    @Test
    void shouldReturnExactNeutralResultForEmptyText() {
        SentimentResult result = scorer.analyze("");

        assertEquals(0.0, result.compound());
        assertEquals(0.0, result.pos());
        assertEquals(1.0, result.neu());
        assertEquals(0.0, result.neg());
        assertEquals(SentimentLabel.NEUTRAL, result.label());
        assertEquals(0.0, result.confidence());
        assertEquals(SentimentResult.empty(), scorer.analyze(null));
    }

    @Test
    void shouldLabelPositiveAndNegativeText() {
        SentimentResult positive = scorer.analyze("My team is great and I love the culture");
        SentimentResult negative = scorer.analyze("The manager is rude and the workload is terrible");

        assertEquals(SentimentLabel.POSITIVE, positive.label());
        assertEquals(positive.compound(), positive.confidence());
        assertEquals(SentimentLabel.NEGATIVE, negative.label());
        assertEquals(Math.abs(negative.compound()), negative.confidence());
    }

    @Test
    void shouldTreatTextWithoutLexiconWordsAsNeutral() {
        SentimentResult result = scorer.analyze("The report is on the desk");

        assertEquals(SentimentLabel.NEUTRAL, result.label());
        assertEquals(0.0, result.compound());
        assertEquals(1.0, result.confidence());
    }

    @Test
    void shouldFlipValenceWhenNegated() {
        SentimentResult plain = scorer.analyze("The benefits are great");
        SentimentResult negated = scorer.analyze("The benefits are not great");

        assertTrue(plain.compound() > 0);
        assertTrue(negated.compound() < 0);
    }

    @Test
    void shouldAmplifyWithBoostersAndExclamations() {
        double base = scorer.analyze("The office is good").compound();

        assertTrue(scorer.analyze("The office is very good").compound() > base);
        assertTrue(scorer.analyze("The office is good!!!").compound() > base);
    }

    @Test
    void shouldWeightClauseAfterBut() {
        SentimentResult result = scorer.analyze("The pay is good but the hours are horrible");

        assertEquals(SentimentLabel.NEGATIVE, result.label());
    }

    @Test
    void shouldKeepCompoundWithinBoundsAndProportionsSummingToOne() {
        List<String> texts = List.of(
                "LOVE LOVE LOVE this amazing wonderful excellent company!!!!!!",
                "hate hate HATE awful horrible terrible bad worst place???",
                "ok",
                "not bad, not good, kind of fine",
                "Never so happy, without doubt the best");
        for (String text : texts) {
            SentimentResult result = scorer.analyze(text);
            assertTrue(result.compound() >= -1.0 && result.compound() <= 1.0, text);
            assertEquals(1.0, result.pos() + result.neu() + result.neg(), 0.002, text);
        }
    }

    @Test
    void shouldApplyExactLabelThresholds() {
        assertEquals(SentimentLabel.POSITIVE, SentimentResult.fromScores(0.05, 0.2, 0.8, 0.0).label());
        assertEquals(SentimentLabel.NEUTRAL, SentimentResult.fromScores(0.0499, 0.1, 0.9, 0.0).label());
        assertEquals(SentimentLabel.NEUTRAL, SentimentResult.fromScores(-0.0499, 0.0, 0.9, 0.1).label());
        SentimentResult negative = SentimentResult.fromScores(-0.05, 0.0, 0.8, 0.2);
        assertEquals(SentimentLabel.NEGATIVE, negative.label());
        assertEquals(0.05, negative.confidence());
        assertEquals(0.9, SentimentResult.fromScores(0.0, 0.05, 0.9, 0.05).confidence());
    }
}
