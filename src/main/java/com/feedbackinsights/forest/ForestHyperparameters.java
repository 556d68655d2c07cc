package com.feedbackinsights.forest;

/**
 * @param maxDepth maximum tree depth; {@code 0} grows until leaves are pure
 */
public record ForestHyperparameters(
        int trees,
        long seed,
        int maxDepth,
        int minSamplesSplit,
        double testFraction) {

    public ForestHyperparameters {
        if (trees < 1) {
            throw new IllegalArgumentException("trees must be >= 1");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        if (minSamplesSplit < 2) {
            throw new IllegalArgumentException("minSamplesSplit must be >= 2");
        }
        if (testFraction <= 0.0 || testFraction >= 1.0) {
            throw new IllegalArgumentException("testFraction must be in (0, 1)");
        }
    }

    public static ForestHyperparameters wordImportanceDefaults() {
        return new ForestHyperparameters(100, 42L, 20, 5, 0.2);
    }

    public static ForestHyperparameters sectionRankingDefaults() {
        return new ForestHyperparameters(100, 42L, 0, 2, 0.2);
    }
}
