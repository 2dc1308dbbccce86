package com.project.hyperspectral.anomaly.algorithms;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of isolation trees (Liu, Ting &amp; Zhou, 2008).
 * <p>
 * Each tree is grown on a random subsample without replacement. A point's anomaly score is
 * {@code 2^(-E[h(x)] / c(psi))}, where {@code h(x)} is its path length in a tree and
 * {@code psi} the subsample size: points isolated after fewer splits score closer to 1.
 * <p>
 * All randomness comes from the seed passed to {@link #fit}, so the same data and seed yield
 * the same trees and the same scores.
 */
public final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param data points to fit on, all of the same dimension and finite
     * @param estimators number of trees
     * @param maxSamples subsample size per tree (capped at {@code data.length})
     * @param seed random seed
     */
    public static IsolationForest fit(double[][] data, int estimators, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on no data");
        }
        if (estimators < 1) {
            throw new IllegalArgumentException("estimators must be >= 1");
        }
        if (maxSamples < 1) {
            throw new IllegalArgumentException("maxSamples must be >= 1");
        }
        checkFinite(data);

        int n = data.length;
        int psi = Math.min(maxSamples, n);
        int maxDepth = (int) Math.ceil(log2(Math.max(psi, 2)));

        Random rnd = new Random(seed);
        int[] pool = new int[n];
        List<IsolationTree> trees = new ArrayList<>(estimators);
        for (int t = 0; t < estimators; t++) {
            for (int i = 0; i < n; i++) pool[i] = i;
            // Partial Fisher-Yates: the first psi entries become the subsample.
            for (int i = 0; i < psi; i++) {
                int j = i + rnd.nextInt(n - i);
                int tmp = pool[i];
                pool[i] = pool[j];
                pool[j] = tmp;
            }
            int[] sample = Arrays.copyOf(pool, psi);
            trees.add(IsolationTree.grow(data, sample, psi, maxDepth, new Random(rnd.nextLong())));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), psi);
    }

    /** Anomaly scores in (0, 1]; higher means more anomalous. */
    public double[] anomalyScores(double[][] data) {
        checkFinite(data);
        double norm = averagePathLength(sampleSize);
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double sum = 0;
            for (IsolationTree tree : trees) {
                sum += tree.pathLength(data[i]);
            }
            double mean = sum / trees.size();
            scores[i] = norm > 0 ? Math.pow(2.0, -mean / norm) : 0.5;
        }
        return scores;
    }

    /**
     * Labels each point {@code -1} (anomalous) or {@code +1} (normal).
     * <p>
     * The decision offset is the {@code 100 * contamination} percentile (linear interpolation)
     * of the negated scores; points strictly below it are anomalous. The resulting count is
     * close to, not exactly, {@code contamination * n}.
     */
    public int[] predict(double[][] data, double contamination) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        double[] scores = anomalyScores(data);
        double[] normality = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            normality[i] = -scores[i];
        }
        double offset = percentile(normality, 100.0 * contamination);

        int[] labels = new int[scores.length];
        for (int i = 0; i < scores.length; i++) {
            labels[i] = normality[i] < offset ? -1 : 1;
        }
        return labels;
    }

    public int size() {
        return trees.size();
    }

    public int sampleSize() {
        return sampleSize;
    }

    /** Average path length of an unsuccessful BST search among {@code n} points. */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    // Same convention as numpy's default "linear" percentile.
    static double percentile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = (q / 100.0) * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = pos - lo;
        return sorted[lo] + frac * (sorted[hi] - sorted[lo]);
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }

    private static void checkFinite(double[][] data) {
        for (double[] row : data) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Input contains non-finite values");
                }
            }
        }
    }
}
