package com.feedbackinsights.forest;

import org.apache.commons.math3.stat.StatUtils;

public record RegressionMetrics(double r2, double mae, double rmse) {

    /**
     * Coefficient of determination uses the finite convention: when the
     * actual values have no variance it is 1.0 for an exact prediction and
     * 0.0 otherwise.
     */
    public static RegressionMetrics evaluate(double[] actual, double[] predicted) {
        if (actual.length == 0 || actual.length != predicted.length) {
            throw new IllegalArgumentException("actual and predicted must be non-empty and of equal length");
        }
        double mean = StatUtils.mean(actual);
        double residualSum = 0.0;
        double totalSum = 0.0;
        double absoluteSum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double residual = actual[i] - predicted[i];
            residualSum += residual * residual;
            absoluteSum += Math.abs(residual);
            double deviation = actual[i] - mean;
            totalSum += deviation * deviation;
        }
        double r2;
        if (totalSum == 0.0) {
            r2 = residualSum == 0.0 ? 1.0 : 0.0;
        } else {
            r2 = 1.0 - residualSum / totalSum;
        }
        return new RegressionMetrics(r2, absoluteSum / actual.length, Math.sqrt(residualSum / actual.length));
    }
}
