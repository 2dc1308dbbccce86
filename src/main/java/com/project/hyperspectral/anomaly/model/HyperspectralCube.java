package com.project.hyperspectral.anomaly.model;

import java.util.Arrays;

/**
 * Immutable rows x cols x bands cube of unsigned 8-bit intensities.
 * <p>
 * Samples are stored flat in row-major order with the band axis innermost, so pixel index
 * {@code i} corresponds to {@code (row = i / cols, col = i % cols)}.
 */
public final class HyperspectralCube {

    private final int rows;
    private final int cols;
    private final int bands;
    private final byte[] samples;

    public HyperspectralCube(int rows, int cols, int bands, byte[] samples) {
        if (rows <= 0 || cols <= 0 || bands <= 0) {
            throw new IllegalArgumentException(
                    "Cube dimensions must be positive: " + rows + "x" + cols + "x" + bands);
        }
        long expected = (long) rows * cols * bands;
        if (samples == null || samples.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " samples, got "
                    + (samples == null ? "null" : samples.length));
        }
        this.rows = rows;
        this.cols = cols;
        this.bands = bands;
        this.samples = Arrays.copyOf(samples, samples.length);
    }

    /**
     * Builds a cube from a {@code [row][col][band]} array. Every pixel must carry the same
     * number of bands and every value must lie in [0, 255].
     */
    public static HyperspectralCube of(int[][][] values) {
        int rows = values.length;
        int cols = rows == 0 ? 0 : values[0].length;
        int bands = cols == 0 ? 0 : values[0][0].length;
        if (rows == 0 || cols == 0 || bands == 0) {
            throw new IllegalArgumentException("Cube must not be empty");
        }
        byte[] samples = new byte[rows * cols * bands];
        int p = 0;
        for (int r = 0; r < rows; r++) {
            if (values[r].length != cols) {
                throw new IllegalArgumentException("Row " + r + " has " + values[r].length + " columns, expected " + cols);
            }
            for (int c = 0; c < cols; c++) {
                int[] spectrum = values[r][c];
                if (spectrum.length != bands) {
                    throw new IllegalArgumentException("Pixel (" + r + "," + c + ") has "
                            + spectrum.length + " bands, expected " + bands);
                }
                for (int v : spectrum) {
                    if (v < 0 || v > 255) {
                        throw new IllegalArgumentException("Intensity out of range [0, 255]: " + v);
                    }
                    samples[p++] = (byte) v;
                }
            }
        }
        return new HyperspectralCube(rows, cols, bands, samples);
    }

    public int rows() { return rows; }
    public int cols() { return cols; }
    public int bands() { return bands; }

    public int pixelCount() {
        return rows * cols;
    }

    public int intensity(int row, int col, int band) {
        if (row < 0 || row >= rows || col < 0 || col >= cols || band < 0 || band >= bands) {
            throw new IndexOutOfBoundsException("(" + row + "," + col + "," + band + ") outside "
                    + rows + "x" + cols + "x" + bands);
        }
        return samples[(row * cols + col) * bands + band] & 0xFF;
    }

    /**
     * Flattens the spatial axes into one pixel axis, preserving row-major order.
     *
     * @return {@code pixelCount() x bands} matrix of intensities
     */
    public double[][] pixelVectors() {
        int n = pixelCount();
        double[][] out = new double[n][bands];
        for (int i = 0; i < n; i++) {
            int base = i * bands;
            for (int b = 0; b < bands; b++) {
                out[i][b] = samples[base + b] & 0xFF;
            }
        }
        return out;
    }
}
