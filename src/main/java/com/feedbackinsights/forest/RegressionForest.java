package com.feedbackinsights.forest;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

import com.feedbackinsights.error.TrainingException;

/**
 * Bagged ensemble of least-squares regression trees. Each tree sees a
 * bootstrap sample drawn from one seeded generator, so a fit on the same
 * rows always yields the same forest.
 */
public class RegressionForest {
    private final ForestHyperparameters hyperparameters;
    private final List<RegressionTree> trees = new ArrayList<>();
    private int featureCount;

    public RegressionForest(ForestHyperparameters hyperparameters) {
        this.hyperparameters = hyperparameters;
    }

    public RegressionForest fit(double[][] x, double[] y) {
        validate(x, y);
        featureCount = x[0].length;
        trees.clear();

        RandomGenerator random = new MersenneTwister(hyperparameters.seed());
        int rows = x.length;
        for (int t = 0; t < hyperparameters.trees(); t++) {
            int[] bootstrap = new int[rows];
            for (int i = 0; i < rows; i++) {
                bootstrap[i] = random.nextInt(rows);
            }
            RegressionTree tree = new RegressionTree(hyperparameters.maxDepth(), hyperparameters.minSamplesSplit());
            tree.fit(x, y, bootstrap, featureCount);
            trees.add(tree);
        }
        return this;
    }

    public double predict(double[] row) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Forest has not been fitted");
        }
        double sum = 0.0;
        for (RegressionTree tree : trees) {
            sum += tree.predict(row);
        }
        return sum / trees.size();
    }

    public double[] predict(double[][] rows) {
        double[] predictions = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            predictions[i] = predict(rows[i]);
        }
        return predictions;
    }

    /**
     * Mean decrease in squared error per feature, averaged over trees and
     * scaled to sum to 1. All zeros when no tree found a useful split.
     */
    public double[] featureImportances() {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Forest has not been fitted");
        }
        double[] mean = new double[featureCount];
        for (RegressionTree tree : trees) {
            double[] treeImportances = tree.normalizedImportances();
            for (int i = 0; i < featureCount; i++) {
                mean[i] += treeImportances[i] / trees.size();
            }
        }
        double total = 0.0;
        for (double value : mean) {
            total += value;
        }
        if (total > 0.0) {
            for (int i = 0; i < featureCount; i++) {
                mean[i] /= total;
            }
        }
        return mean;
    }

    public int treeCount() {
        return trees.size();
    }

    private static void validate(double[][] x, double[] y) {
        if (x == null || y == null || x.length == 0) {
            throw new TrainingException("Cannot fit a forest on an empty training set");
        }
        if (x.length != y.length) {
            throw new TrainingException("Feature rows (" + x.length + ") and targets (" + y.length + ") differ in length");
        }
        int width = x[0].length;
        if (width == 0) {
            throw new TrainingException("Cannot fit a forest without features");
        }
        for (int i = 0; i < x.length; i++) {
            if (x[i].length != width) {
                throw new TrainingException("Ragged feature matrix at row " + i);
            }
            if (!Double.isFinite(y[i])) {
                throw new TrainingException("Non-finite target at row " + i);
            }
            for (double value : x[i]) {
                if (!Double.isFinite(value)) {
                    throw new TrainingException("Non-finite feature value at row " + i);
                }
            }
        }
    }
}
