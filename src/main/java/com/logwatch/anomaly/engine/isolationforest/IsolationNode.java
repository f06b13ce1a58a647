package com.logwatch.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of an isolation tree. Leaves carry the number of training points that reached them;
 * internal nodes carry the split. Short JSON property names keep persisted models small.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    @JsonProperty("f")
    private int feature;

    @JsonProperty("v")
    private double threshold;

    @JsonProperty("l")
    private IsolationNode below;

    @JsonProperty("r")
    private IsolationNode above;

    @JsonProperty("n")
    private int leafSize;

    public IsolationNode() {}

    static IsolationNode split(int feature, double threshold, IsolationNode below, IsolationNode above) {
        IsolationNode node = new IsolationNode();
        node.feature = feature;
        node.threshold = threshold;
        node.below = below;
        node.above = above;
        return node;
    }

    static IsolationNode leaf(int size) {
        IsolationNode node = new IsolationNode();
        node.leafSize = size;
        return node;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return below == null && above == null;
    }

    double depthOf(double[] point) {
        IsolationNode node = this;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.feature] < node.threshold ? node.below : node.above;
            depth++;
        }
        return depth + expectedPathLength(node.leafSize);
    }

    /**
     * c(n): expected path length of an unsuccessful BST search over n points,
     * used to normalize depths and to credit leaves that stopped early.
     */
    public static double expectedPathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }

    public int getFeature() { return feature; }
    public double getThreshold() { return threshold; }
    public IsolationNode getBelow() { return below; }
    public IsolationNode getAbove() { return above; }
    public int getLeafSize() { return leafSize; }
}
