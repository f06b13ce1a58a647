package com.logwatch.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(List<double[]> points, int heightLimit, Random random) {
        return new IsolationTree(grow(points, 0, heightLimit, random));
    }

    private static IsolationNode grow(List<double[]> points, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || points.size() <= 1) {
            return IsolationNode.leaf(points.size());
        }

        int dimensions = points.get(0).length;
        double[] lo = new double[dimensions];
        double[] hi = new double[dimensions];
        Arrays.fill(lo, Double.POSITIVE_INFINITY);
        Arrays.fill(hi, Double.NEGATIVE_INFINITY);
        for (double[] p : points) {
            for (int i = 0; i < dimensions; i++) {
                lo[i] = Math.min(lo[i], p[i]);
                hi[i] = Math.max(hi[i], p[i]);
            }
        }

        // Only split on features that still vary; constant ones cannot separate anything
        List<Integer> varying = new ArrayList<>(dimensions);
        for (int i = 0; i < dimensions; i++) {
            if (hi[i] > lo[i]) varying.add(i);
        }
        if (varying.isEmpty()) {
            return IsolationNode.leaf(points.size());
        }
        int feature = varying.get(random.nextInt(varying.size()));

        double cut = lo[feature] + random.nextDouble() * (hi[feature] - lo[feature]);
        List<double[]> below = new ArrayList<>();
        List<double[]> above = new ArrayList<>();
        for (double[] p : points) {
            (p[feature] < cut ? below : above).add(p);
        }

        return IsolationNode.split(feature, cut,
                grow(below, depth + 1, heightLimit, random),
                grow(above, depth + 1, heightLimit, random));
    }

    public double pathLength(double[] point) {
        return root.depthOf(point);
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
