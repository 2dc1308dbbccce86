package com.project.hyperspectral.anomaly.service;

import com.project.hyperspectral.anomaly.exceptions.ConfigurationException;
import com.project.hyperspectral.anomaly.exceptions.DetectionException;
import com.project.hyperspectral.anomaly.exceptions.ErrorCategory;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Principal-component projection of pixel spectra. The basis is fit and applied in the same
 * call; nothing is retained between invocations.
 */
@Service
public class SpectralReducer {
    private static final Logger log = LoggerFactory.getLogger(SpectralReducer.class);

    /**
     * Projects {@code vectors} onto their top {@code k} principal components.
     *
     * @param vectors N spectra of dimension B
     * @param k target dimension, {@code 1 <= k <= min(N, B)}
     * @return N embeddings of dimension k
     * @throws ConfigurationException if k is out of bounds for the input shape
     */
    public double[][] reduce(double[][] vectors, int k) {
        int n = vectors.length;
        int b = n == 0 ? 0 : vectors[0].length;
        if (k < 1 || k > Math.min(n, b)) {
            throw new ConfigurationException(
                    "Cannot reduce " + n + " vectors of dimension " + b + " to " + k + " components");
        }

        double[] mean = new double[b];
        for (double[] v : vectors) {
            if (v.length != b) {
                throw new IllegalArgumentException("Ragged input: expected dimension " + b + ", got " + v.length);
            }
            for (int j = 0; j < b; j++) mean[j] += v[j];
        }
        for (int j = 0; j < b; j++) mean[j] /= n;

        double[][] components;
        try {
            RealMatrix cov = n > 1
                    ? new Covariance(vectors, false).getCovarianceMatrix()
                    : MatrixUtils.createRealMatrix(b, b);
            EigenDecomposition eigen = new EigenDecomposition(cov);
            double[] eigenValues = eigen.getRealEigenvalues();
            Integer[] order = IntStream.range(0, eigenValues.length).boxed().toArray(Integer[]::new);
            Arrays.sort(order, Comparator.comparingDouble((Integer i) -> eigenValues[i]).reversed());

            components = new double[k][];
            for (int c = 0; c < k; c++) {
                components[c] = orientSign(eigen.getEigenvector(order[c]).toArray());
            }
            logExplainedVariance(eigenValues, order, k);
        } catch (MathIllegalStateException e) {
            throw new DetectionException(ErrorCategory.INTERNAL_ERROR, "Eigen decomposition did not converge", e);
        }

        double[][] out = new double[n][k];
        for (int i = 0; i < n; i++) {
            double[] v = vectors[i];
            for (int c = 0; c < k; c++) {
                double[] axis = components[c];
                double s = 0;
                for (int j = 0; j < b; j++) {
                    s += (v[j] - mean[j]) * axis[j];
                }
                out[i][c] = s;
            }
        }
        log.debug("Reduced {} vectors from {} to {} dimensions", n, b, k);
        return out;
    }

    // Eigenvectors are only defined up to sign; make the largest-magnitude coefficient positive.
    private static double[] orientSign(double[] axis) {
        int maxIdx = 0;
        for (int j = 1; j < axis.length; j++) {
            if (Math.abs(axis[j]) > Math.abs(axis[maxIdx])) maxIdx = j;
        }
        if (axis[maxIdx] < 0) {
            for (int j = 0; j < axis.length; j++) axis[j] = -axis[j];
        }
        return axis;
    }

    private static void logExplainedVariance(double[] eigenValues, Integer[] order, int k) {
        if (!log.isDebugEnabled()) return;
        double total = 0;
        for (double v : eigenValues) total += Math.max(v, 0);
        if (total <= 0) return;
        double[] ratios = new double[k];
        for (int c = 0; c < k; c++) {
            ratios[c] = Math.max(eigenValues[order[c]], 0) / total;
        }
        log.debug("Explained variance ratios: {}", Arrays.toString(ratios));
    }
}
