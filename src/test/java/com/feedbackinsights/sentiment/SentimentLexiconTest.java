package com.feedbackinsights.sentiment;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SentimentLexiconTest {

    @Test
    void shouldLoadBundledLexicon() {
        SentimentLexicon lexicon = new SentimentLexicon();

        assertTrue(lexicon.size() > 100);
        assertTrue(lexicon.contains("great"));
        assertTrue(lexicon.valence("great") > 0);
        assertTrue(lexicon.valence("terrible") < 0);
        assertFalse(lexicon.contains("desk"));
        assertEquals(0.0, lexicon.valence("desk"));
    }

    @Test
    void shouldFailForMissingResource() {
        assertThrows(IllegalStateException.class, () -> new SentimentLexicon("sentiment/missing.tsv"));
    }
}
