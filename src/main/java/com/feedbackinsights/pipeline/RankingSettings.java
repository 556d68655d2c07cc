package com.feedbackinsights.pipeline;

import com.feedbackinsights.forest.ForestHyperparameters;

/**
 * @param satisfiedThreshold minimum mean category score for a response to be used
 * @param defaultScore fill value for a category nobody scored
 */
public record RankingSettings(
        double satisfiedThreshold,
        int minSamples,
        double defaultScore,
        ForestHyperparameters forest) {

    public static RankingSettings defaults() {
        return new RankingSettings(4.0, 10, 3.0, ForestHyperparameters.sectionRankingDefaults());
    }
}
