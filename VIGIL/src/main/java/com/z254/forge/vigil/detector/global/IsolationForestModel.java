package com.z254.forge.vigil.detector.global;

import com.z254.forge.vigil.domain.model.FeatureVector;

import java.util.List;

/**
 * Isolation forest scored from an exported tree ensemble.
 * <p>
 * The path length of a point in one tree is the depth of the leaf it lands in plus the
 * expected path length {@code c(n)} of the {@code n} training samples left unsplit in
 * that leaf. The anomaly score is {@code -2^(-mean(h)/c(maxSamples))}; the decision
 * value subtracts the offset learned at training time.
 */
public class IsolationForestModel implements GlobalOutlierScorer {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final String version;
    private final List<IsolationTree> trees;
    private final double offset;
    private final double normalizer;

    public IsolationForestModel(String version, List<IsolationTree> trees, int maxSamples, double offset) {
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("Isolation forest has no trees");
        }
        this.version = version;
        this.trees = List.copyOf(trees);
        this.offset = offset;
        this.normalizer = averagePathLength(maxSamples);
    }

    /**
     * Anomaly score in [-1, 0); lower is more anomalous.
     */
    public double score(FeatureVector vector) {
        double[] x = vector.toArray();
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(x);
        }
        double mean = total / trees.size();
        return -Math.pow(2.0, -mean / normalizer);
    }

    @Override
    public double decision(FeatureVector vector) {
        return score(vector) - offset;
    }

    @Override
    public String version() {
        return version;
    }

    public int treeCount() {
        return trees.size();
    }

    /**
     * Expected path length of an unsuccessful search in a binary search tree of n nodes.
     */
    static double averagePathLength(double n) {
        if (n <= 1.0) {
            return 0.0;
        }
        if (n <= 2.0) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    /**
     * One tree stored as flat node arrays. A node is a leaf when {@code feature[i] < 0}.
     */
    public static final class IsolationTree {
        private final int[] feature;
        private final double[] threshold;
        private final int[] left;
        private final int[] right;
        private final double[] leafAdjustment;

        public IsolationTree(int[] feature, double[] threshold, int[] left, int[] right, int[] leafSamples) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.leafAdjustment = new double[leafSamples.length];
            for (int i = 0; i < leafSamples.length; i++) {
                leafAdjustment[i] = feature[i] < 0 ? averagePathLength(leafSamples[i]) : 0.0;
            }
        }

        double pathLength(double[] x) {
            int node = 0;
            int depth = 0;
            while (feature[node] >= 0) {
                node = x[feature[node]] <= threshold[node] ? left[node] : right[node];
                depth++;
            }
            return depth + leafAdjustment[node];
        }
    }
}
