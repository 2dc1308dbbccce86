package com.project.hyperspectral.anomaly.algorithms;

import java.util.Random;

/**
 * One randomized isolation structure: a binary tree of axis-aligned splits grown on a
 * subsample until points are isolated or the depth limit is reached.
 */
final class IsolationTree {

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    /**
     * Grows a tree over {@code data[indices[0..count)]}.
     */
    static IsolationTree grow(double[][] data, int[] indices, int count, int maxDepth, Random rnd) {
        return new IsolationTree(build(data, indices, 0, count, 0, maxDepth, rnd));
    }

    /** Depth at which {@code point} reaches a leaf, plus the expected depth inside that leaf. */
    double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.feature] < node.threshold ? node.left : node.right;
            depth++;
        }
        return depth + IsolationForest.averagePathLength(node.size);
    }

    private static Node build(double[][] data, int[] idx, int from, int to,
                              int depth, int maxDepth, Random rnd) {
        int size = to - from;
        if (depth >= maxDepth || size <= 1) {
            return Node.leaf(size);
        }

        int dims = data[idx[from]].length;
        double[] min = new double[dims];
        double[] max = new double[dims];
        for (int d = 0; d < dims; d++) {
            min[d] = Double.POSITIVE_INFINITY;
            max[d] = Double.NEGATIVE_INFINITY;
        }
        for (int i = from; i < to; i++) {
            double[] p = data[idx[i]];
            for (int d = 0; d < dims; d++) {
                if (p[d] < min[d]) min[d] = p[d];
                if (p[d] > max[d]) max[d] = p[d];
            }
        }

        // Only features with some spread can separate the points.
        int[] candidates = new int[dims];
        int nCandidates = 0;
        for (int d = 0; d < dims; d++) {
            if (max[d] > min[d]) candidates[nCandidates++] = d;
        }
        if (nCandidates == 0) {
            return Node.leaf(size);
        }

        int feature = candidates[rnd.nextInt(nCandidates)];
        double threshold = min[feature] + rnd.nextDouble() * (max[feature] - min[feature]);
        if (threshold <= min[feature]) {
            // nextDouble() returned 0; nothing would fall left of the split.
            threshold = Math.nextUp(min[feature]);
        }

        // Partition idx[from..to) so points below the threshold come first.
        int lo = from, hi = to - 1;
        while (lo <= hi) {
            if (data[idx[lo]][feature] < threshold) {
                lo++;
            } else {
                int tmp = idx[lo];
                idx[lo] = idx[hi];
                idx[hi] = tmp;
                hi--;
            }
        }

        Node left = build(data, idx, from, lo, depth + 1, maxDepth, rnd);
        Node right = build(data, idx, lo, to, depth + 1, maxDepth, rnd);
        return Node.split(feature, threshold, left, right);
    }

    private static final class Node {
        final int feature;
        final double threshold;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double threshold, Node left, Node right, int size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, left.size + right.size);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
