package com.feedbackinsights.forest;

import java.util.Arrays;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.util.MathArrays;

import com.feedbackinsights.error.TrainingException;

/**
 * Seeded shuffle of row indices into a training and a held-out test part.
 * The test part holds {@code ceil(testFraction * n)} rows.
 */
public record TrainTestSplit(int[] trainIndices, int[] testIndices) {

    public static TrainTestSplit shuffled(int rows, double testFraction, long seed) {
        int testSize = (int) Math.ceil(testFraction * rows);
        int trainSize = rows - testSize;
        if (testSize < 1 || trainSize < 1) {
            throw new TrainingException("Cannot split " + rows + " rows with test fraction " + testFraction);
        }
        int[] order = MathArrays.natural(rows);
        MathArrays.shuffle(order, new MersenneTwister(seed));
        return new TrainTestSplit(
                Arrays.copyOfRange(order, testSize, rows),
                Arrays.copyOfRange(order, 0, testSize));
    }

    public static double[][] select(double[][] rows, int[] indices) {
        double[][] selected = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = rows[indices[i]];
        }
        return selected;
    }

    public static double[] select(double[] values, int[] indices) {
        double[] selected = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = values[indices[i]];
        }
        return selected;
    }
}
