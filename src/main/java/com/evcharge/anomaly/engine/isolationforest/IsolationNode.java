package com.evcharge.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of an isolation tree. Short JSON property names keep serialized forests compact.
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
    private IsolationNode atOrAbove;

    // Training rows that ended in this leaf
    @JsonProperty("s")
    private int leafSize;

    @JsonProperty("e")
    private boolean leaf;

    public IsolationNode() {}

    static IsolationNode split(int feature, double threshold, IsolationNode below, IsolationNode atOrAbove) {
        IsolationNode node = new IsolationNode();
        node.feature = feature;
        node.threshold = threshold;
        node.below = below;
        node.atOrAbove = atOrAbove;
        return node;
    }

    static IsolationNode leaf(int size) {
        IsolationNode node = new IsolationNode();
        node.leafSize = size;
        node.leaf = true;
        return node;
    }

    /**
     * Depth at which the point is isolated, plus the expected remaining depth for leaves
     * that still held several training rows.
     */
    double pathLength(double[] point, int depth) {
        IsolationNode node = this;
        int d = depth;
        while (!node.leaf) {
            node = point[node.feature] < node.threshold ? node.below : node.atOrAbove;
            d++;
        }
        return d + expectedPathLength(node.leafSize);
    }

    /**
     * c(n): mean path length of an unsuccessful binary-search-tree lookup among n items,
     * used to normalise isolation depths.
     */
    public static double expectedPathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    /**
     * @throws IllegalArgumentException if a split node lacks a child or refers to a negative feature
     */
    int maxFeatureIndex() {
        if (leaf) return -1;
        if (below == null || atOrAbove == null) {
            throw new IllegalArgumentException(String.format(
                    "isolation tree split on feature %d at %s is missing a child node", feature, threshold));
        }
        if (feature < 0) {
            throw new IllegalArgumentException("isolation tree splits on negative feature index " + feature);
        }
        return Math.max(feature, Math.max(below.maxFeatureIndex(), atOrAbove.maxFeatureIndex()));
    }

    public int getFeature() { return feature; }
    public double getThreshold() { return threshold; }
    public IsolationNode getBelow() { return below; }
    public IsolationNode getAtOrAbove() { return atOrAbove; }
    public int getLeafSize() { return leafSize; }
    public boolean isLeaf() { return leaf; }
}
