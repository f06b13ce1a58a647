package com.logwatch.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over fixed-length feature vectors. Points that are isolated in few
 * random splits score close to 1.0; typical points score around or below 0.5.
 */
public class IsolationForest {

    private List<IsolationTree> trees = new ArrayList<>();
    private int sampleSize;

    public IsolationForest() {}

    /**
     * @param data       training rows, all of the same length
     * @param numTrees   number of trees
     * @param sampleSize rows drawn (without replacement) per tree
     * @param random     source of randomness; pass a seeded instance for reproducible models
     */
    public static IsolationForest fit(double[][] data, int numTrees, int sampleSize, Random random) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
        }
        IsolationForest forest = new IsolationForest();
        forest.sampleSize = Math.min(sampleSize, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(2, forest.sampleSize)) / Math.log(2));

        for (int i = 0; i < numTrees; i++) {
            forest.trees.add(IsolationTree.grow(drawSample(data, forest.sampleSize, random), heightLimit, random));
        }
        return forest;
    }

    public double score(double[] point) {
        if (trees.isEmpty()) return 0.0;
        double c = IsolationNode.expectedPathLength(sampleSize);
        if (c <= 0) return 0.0;

        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    public double[] scoreAll(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = score(data[i]);
        }
        return scores;
    }

    /**
     * Per feature, how much the score drops when that feature is replaced by its training mean.
     */
    public double[] featureContributions(double[] point, double[] featureMeans) {
        double base = score(point);
        double[] contributions = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            double[] neutralized = Arrays.copyOf(point, point.length);
            neutralized[i] = featureMeans[i];
            contributions[i] = Math.max(0.0, base - score(neutralized));
        }
        return contributions;
    }

    /**
     * Nearest-rank percentile of the given scores, {@code percentile} in (0, 100].
     */
    public static double percentile(double[] scores, double percentile) {
        if (scores.length == 0) return 0.0;
        double[] sorted = Arrays.copyOf(scores, scores.length);
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length, rank) - 1)];
    }

    private static List<double[]> drawSample(double[][] data, int size, Random random) {
        int[] order = new int[data.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        List<double[]> sample = new ArrayList<>(size);
        // partial Fisher-Yates
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(order.length - i);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
            sample.add(data[order[i]]);
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
}
