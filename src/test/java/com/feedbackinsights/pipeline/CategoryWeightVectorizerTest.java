package com.feedbackinsights.pipeline;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.feedbackinsights.error.VectorizationException;
import com.feedbackinsights.text.NormalizedText;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CategoryWeightVectorizerTest {
    private static final List<NormalizedText> CORPUS = List.of(
            text("pay", "low"),
            text("pay", "low", "late"),
            text("manager", "rude"));

    @Test
    void shouldBuildAlphabeticalVocabularyWithSmoothedIdf() {
        CategoryWeightVectorizer vectorizer = new CategoryWeightVectorizer(VectorizerSettings.global()).fit(CORPUS);

        assertEquals(List.of("late", "low", "manager", "pay", "rude"), vectorizer.vocabulary());

        WeightedVector row = vectorizer.transform(text("pay", "low"));
        double expected = 1.0 / Math.sqrt(2.0);
        assertEquals(expected, row.weight(vectorizer.vocabulary().indexOf("pay")), 1e-12);
        assertEquals(expected, row.weight(vectorizer.vocabulary().indexOf("low")), 1e-12);
        assertEquals(0.0, row.weight(vectorizer.vocabulary().indexOf("rude")));
    }

    @Test
    void shouldWeightRareTermsAboveCommonOnes() {
        CategoryWeightVectorizer vectorizer = new CategoryWeightVectorizer(VectorizerSettings.global()).fit(CORPUS);

        WeightedVector row = vectorizer.transform(text("pay", "late"));

        assertTrue(row.weight(vectorizer.vocabulary().indexOf("late")) > row.weight(vectorizer.vocabulary().indexOf("pay")));
        double norm = 0.0;
        for (double value : row.toDense()) {
            norm += value * value;
        }
        assertEquals(1.0, norm, 1e-12);
    }

    @Test
    void shouldCapVocabularyByCorpusFrequency() {
        CategoryWeightVectorizer vectorizer = new CategoryWeightVectorizer(
                new VectorizerSettings(2, 1, 1, 1, Set.of())).fit(CORPUS);

        assertEquals(List.of("low", "pay"), vectorizer.vocabulary());
    }

    @Test
    void shouldFormBigramsAndApplyMinimumDocumentFrequency() {
        CategoryWeightVectorizer vectorizer = new CategoryWeightVectorizer(
                new VectorizerSettings(200, 1, 2, 2, Set.of())).fit(CORPUS);

        assertEquals(List.of("low", "pay", "pay low"), vectorizer.vocabulary());
    }

    @Test
    void shouldDropStopwordsAndSingleLetterTokens() {
        CategoryWeightVectorizer vectorizer = new CategoryWeightVectorizer(
                new VectorizerSettings(0, 1, 1, 1, Set.of("late"))).fit(List.of(text("x", "late", "pay")));

        assertEquals(List.of("pay"), vectorizer.vocabulary());
    }

    @Test
    void shouldIgnoreUnknownTermsWhenTransforming() {
        CategoryWeightVectorizer vectorizer = new CategoryWeightVectorizer(VectorizerSettings.global()).fit(CORPUS);

        WeightedVector row = vectorizer.transform(text("parking"));

        assertTrue(row.isEmpty());
        assertEquals(5, row.dimension());
    }

    @Test
    void shouldRejectTransformBeforeFit() {
        CategoryWeightVectorizer vectorizer = new CategoryWeightVectorizer(VectorizerSettings.global());

        assertThrows(IllegalStateException.class, () -> vectorizer.transform(text("pay")));
    }

    @Test
    void shouldFailWhenNoTermSurvives() {
        CategoryWeightVectorizer vectorizer = new CategoryWeightVectorizer(
                new VectorizerSettings(200, 1, 2, 2, Set.of()));

        assertThrows(VectorizationException.class, () -> vectorizer.fit(List.of(text("pay"), text("rude"))));
        assertThrows(VectorizationException.class, () -> vectorizer.fit(List.of()));
    }

    private static NormalizedText text(String... tokens) {
        return new NormalizedText(List.of(tokens));
    }
}
