package com.feedbackinsights.forest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Least-squares regression tree. Split gain is the drop in summed squared
 * error, which is also what the tree credits to the split feature.
 */
final class RegressionTree {
    private static final double MIN_GAIN = 1e-12;

    private final int maxDepth;
    private final int minSamplesSplit;
    private final List<Node> nodes = new ArrayList<>();
    private double[] importances;

    RegressionTree(int maxDepth, int minSamplesSplit) {
        this.maxDepth = maxDepth;
        this.minSamplesSplit = minSamplesSplit;
    }

    void fit(double[][] x, double[] y, int[] samples, int featureCount) {
        nodes.clear();
        importances = new double[featureCount];
        grow(x, y, samples, 0);
    }

    double predict(double[] row) {
        Node node = nodes.get(0);
        while (!node.isLeaf()) {
            node = nodes.get(row[node.feature] <= node.threshold ? node.left : node.right);
        }
        return node.value;
    }

    /**
     * Gain per feature scaled to sum to 1, or all zeros when the tree never split.
     */
    double[] normalizedImportances() {
        double total = Arrays.stream(importances).sum();
        double[] normalized = importances.clone();
        if (total > 0.0) {
            for (int i = 0; i < normalized.length; i++) {
                normalized[i] /= total;
            }
        }
        return normalized;
    }

    int nodeCount() {
        return nodes.size();
    }

    private int grow(double[][] x, double[] y, int[] samples, int depth) {
        int index = nodes.size();
        Node node = new Node();
        nodes.add(node);

        double sum = 0.0;
        double sumSquares = 0.0;
        for (int sample : samples) {
            sum += y[sample];
            sumSquares += y[sample] * y[sample];
        }
        int n = samples.length;
        node.value = sum / n;
        double sse = sumSquares - sum * sum / n;

        boolean depthExhausted = maxDepth > 0 && depth >= maxDepth;
        if (n < minSamplesSplit || depthExhausted || sse <= MIN_GAIN) {
            return index;
        }

        Split best = bestSplit(x, y, samples, sse);
        if (best == null) {
            return index;
        }
        importances[best.feature] += best.gain;

        int leftCount = 0;
        for (int sample : samples) {
            if (x[sample][best.feature] <= best.threshold) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[n - leftCount];
        int l = 0;
        int r = 0;
        for (int sample : samples) {
            if (x[sample][best.feature] <= best.threshold) {
                left[l++] = sample;
            } else {
                right[r++] = sample;
            }
        }

        node.feature = best.feature;
        node.threshold = best.threshold;
        node.left = grow(x, y, left, depth + 1);
        node.right = grow(x, y, right, depth + 1);
        return index;
    }

    private Split bestSplit(double[][] x, double[] y, int[] samples, double parentSse) {
        Split best = null;
        int n = samples.length;
        for (int feature = 0; feature < importances.length; feature++) {
            if (isConstant(x, samples, feature)) {
                continue;
            }
            final int f = feature;
            int[] sorted = Arrays.stream(samples)
                    .boxed()
                    .sorted((a, b) -> Double.compare(x[a][f], x[b][f]))
                    .mapToInt(Integer::intValue)
                    .toArray();

            double totalSum = 0.0;
            double totalSquares = 0.0;
            for (int sample : sorted) {
                totalSum += y[sample];
                totalSquares += y[sample] * y[sample];
            }

            double leftSum = 0.0;
            double leftSquares = 0.0;
            for (int i = 1; i < n; i++) {
                double value = y[sorted[i - 1]];
                leftSum += value;
                leftSquares += value * value;
                double previous = x[sorted[i - 1]][f];
                double current = x[sorted[i]][f];
                if (previous == current) {
                    continue;
                }
                double rightSum = totalSum - leftSum;
                double rightSquares = totalSquares - leftSquares;
                double leftSse = leftSquares - leftSum * leftSum / i;
                double rightSse = rightSquares - rightSum * rightSum / (n - i);
                double gain = parentSse - leftSse - rightSse;
                if (gain > MIN_GAIN && (best == null || gain > best.gain + MIN_GAIN)) {
                    double threshold = previous + (current - previous) / 2.0;
                    if (threshold >= current) {
                        threshold = previous;
                    }
                    best = new Split(feature, threshold, gain);
                }
            }
        }
        return best;
    }

    private static boolean isConstant(double[][] x, int[] samples, int feature) {
        double first = x[samples[0]][feature];
        for (int i = 1; i < samples.length; i++) {
            if (x[samples[i]][feature] != first) {
                return false;
            }
        }
        return true;
    }

    private record Split(int feature, double threshold, double gain) {
    }

    private static final class Node {
        int feature = -1;
        double threshold;
        int left = -1;
        int right = -1;
        double value;

        boolean isLeaf() {
            return feature < 0;
        }
    }
}
