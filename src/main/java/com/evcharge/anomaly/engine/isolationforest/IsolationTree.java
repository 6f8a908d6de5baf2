package com.evcharge.anomaly.engine.isolationforest;

public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    int maxFeatureIndex() {
        if (root == null) {
            throw new IllegalArgumentException("isolation tree has no root node");
        }
        return root.maxFeatureIndex();
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
