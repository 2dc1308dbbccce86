package com.project.hyperspectral.anomaly.model;

import com.project.hyperspectral.anomaly.exceptions.ShapeMismatchException;

/**
 * Spatial rows x cols grid of labels. Instances are created by the map assembler and are not
 * modified afterwards.
 */
public final class AnomalyMap {

    private final int rows;
    private final int cols;
    private final AnomalyLabel[] labels;

    private AnomalyMap(int rows, int cols, AnomalyLabel[] labels) {
        this.rows = rows;
        this.cols = cols;
        this.labels = labels;
    }

    /**
     * Wraps a row-major label sequence: label {@code i} lands at {@code (i / cols, i % cols)}.
     *
     * @throws ShapeMismatchException unless there is exactly one non-null label per location
     */
    public static AnomalyMap wrap(int rows, int cols, AnomalyLabel[] labels) {
        if (labels == null || rows <= 0 || cols <= 0 || labels.length != (long) rows * cols) {
            throw new ShapeMismatchException("Cannot reshape "
                    + (labels == null ? "null" : String.valueOf(labels.length))
                    + " labels into " + rows + "x" + cols);
        }
        AnomalyLabel[] copy = labels.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] == null) {
                throw new ShapeMismatchException("Missing label at index " + i);
            }
        }
        return new AnomalyMap(rows, cols, copy);
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    public AnomalyLabel get(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("(" + row + "," + col + ") outside " + rows + "x" + cols);
        }
        return labels[row * cols + col];
    }

    /** Row-major copy of the labels, inverse of the assembler's reshape. */
    public AnomalyLabel[] flatten() {
        return labels.clone();
    }
}
