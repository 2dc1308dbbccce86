package com.project.hyperspectral.anomaly.algorithms;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class IsolationForestTest {

    private static double[][] clusterWithOutliers(int inliers, int outliers, long seed) {
        Random rnd = new Random(seed);
        double[][] data = new double[inliers + outliers][];
        for (int i = 0; i < inliers; i++) {
            data[i] = new double[]{rnd.nextGaussian(), rnd.nextGaussian()};
        }
        for (int i = 0; i < outliers; i++) {
            data[inliers + i] = new double[]{40 + 3 * i, -40 - 2 * i};
        }
        return data;
    }

    @Test
    void outliers_scoreHigherThanInliers() {
        double[][] data = clusterWithOutliers(1000, 10, 1);
        IsolationForest forest = IsolationForest.fit(data, 100, 256, 42);

        double[] scores = forest.anomalyScores(data);

        double maxInlier = 0;
        for (int i = 0; i < 1000; i++) maxInlier = Math.max(maxInlier, scores[i]);
        for (int i = 1000; i < 1010; i++) {
            assertThat(scores[i]).isGreaterThan(0.6).isGreaterThan(maxInlier);
        }
        assertThat(forest.size()).isEqualTo(100);
        assertThat(forest.sampleSize()).isEqualTo(256);
    }

    @Test
    void predict_labelsPlantedOutliersAnomalous() {
        double[][] data = clusterWithOutliers(1000, 10, 2);
        IsolationForest forest = IsolationForest.fit(data, 100, 256, 42);

        int[] labels = forest.predict(data, 0.01);

        for (int i = 1000; i < 1010; i++) {
            assertThat(labels[i]).isEqualTo(-1);
        }
        int anomalous = 0;
        for (int label : labels) {
            assertThat(label).isIn(-1, 1);
            if (label == -1) anomalous++;
        }
        assertThat(anomalous).isBetween(10, 12);
    }

    @Test
    void fit_sameSeed_sameScores() {
        double[][] data = clusterWithOutliers(300, 3, 3);

        double[] a = IsolationForest.fit(data, 50, 128, 42).anomalyScores(data);
        double[] b = IsolationForest.fit(data, 50, 128, 42).anomalyScores(data);

        assertThat(a).containsExactly(b);
    }

    @Test
    void fit_smallPopulation_capsSampleSize() {
        double[][] data = clusterWithOutliers(20, 1, 4);

        IsolationForest forest = IsolationForest.fit(data, 10, 256, 0);

        assertThat(forest.sampleSize()).isEqualTo(21);
    }

    @Test
    void identicalPoints_areAllNormal() {
        double[][] data = new double[50][];
        for (int i = 0; i < data.length; i++) data[i] = new double[]{1.0, 1.0};

        int[] labels = IsolationForest.fit(data, 20, 256, 0).predict(data, 0.1);

        assertThat(labels).containsOnly(1);
    }

    @Test
    void rejectsNonFiniteInputAndBadContamination() {
        double[][] data = {{1.0, Double.NaN}, {2.0, 3.0}};
        assertThatThrownBy(() -> IsolationForest.fit(data, 10, 256, 0))
                .isInstanceOf(IllegalArgumentException.class);

        double[][] ok = clusterWithOutliers(20, 0, 5);
        IsolationForest forest = IsolationForest.fit(ok, 10, 256, 0);
        assertThatThrownBy(() -> forest.predict(ok, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> forest.predict(ok, 0.7)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void averagePathLength_matchesKnownValues() {
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1.0);
        // c(256) ~ 10.24
        assertThat(IsolationForest.averagePathLength(256)).isCloseTo(10.24, within(0.01));
    }

    @Test
    void percentile_interpolatesLinearly() {
        double[] values = {4, 1, 3, 2};
        assertThat(IsolationForest.percentile(values, 0)).isEqualTo(1.0);
        assertThat(IsolationForest.percentile(values, 50)).isEqualTo(2.5);
        assertThat(IsolationForest.percentile(values, 100)).isEqualTo(4.0);
    }
}
