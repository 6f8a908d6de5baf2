package com.evcharge.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.List;

/**
 * Isolation Forest (Liu, Ting and Zhou, 2008) over fixed-length feature vectors.
 *
 * Scores range from 0.0 to 1.0. Points isolated after few splits score close to 1.0;
 * a score around 0.5 or below means the point is not distinguishable from the fitted data.
 *
 * Forests are fitted offline and shipped inside scorer artifacts; serving code only calls {@link #score}.
 */
public class IsolationForest {

    private List<IsolationTree> trees;
    private int sampleSize;

    public IsolationForest() {
        this.trees = new ArrayList<>();
    }

    public IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * s(x, n) = 2^(-E[h(x)] / c(n))
     */
    public double score(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double meanPath = 0.0;
        for (IsolationTree tree : trees) {
            meanPath += tree.pathLength(point);
        }
        meanPath /= trees.size();

        double normaliser = IsolationNode.expectedPathLength(sampleSize);
        if (normaliser <= 0) return 0.0;
        return Math.pow(2.0, -meanPath / normaliser);
    }

    /**
     * Highest feature index any split refers to, or -1 for a forest of single leaves.
     *
     * @throws IllegalArgumentException if a tree is structurally incomplete
     */
    public int maxFeatureIndex() {
        int max = -1;
        for (IsolationTree tree : trees) {
            if (tree == null) {
                throw new IllegalArgumentException("isolation forest contains an empty tree entry");
            }
            max = Math.max(max, tree.maxFeatureIndex());
        }
        return max;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
}
