package com.feedbackinsights.pipeline;

import java.util.Arrays;

/**
 * Sparse row of term weights. Indices are ascending feature positions in
 * the vocabulary of the vectorizer that produced it.
 */
public record WeightedVector(int dimension, int[] indices, double[] weights) {

    public WeightedVector {
        if (indices.length != weights.length) {
            throw new IllegalArgumentException("indices and weights differ in length");
        }
    }

    public double weight(int feature) {
        int position = Arrays.binarySearch(indices, feature);
        return position >= 0 ? weights[position] : 0.0;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    public double[] toDense() {
        double[] dense = new double[dimension];
        for (int i = 0; i < indices.length; i++) {
            dense[indices[i]] = weights[i];
        }
        return dense;
    }
}
