package com.project.hyperspectral.anomaly.model;

/**
 * Per-pixel classification. The signed values (-1 anomalous, +1 normal) are part of the
 * scorer's observable output and drive the visualization's color scale.
 */
public enum AnomalyLabel {
    ANOMALOUS(-1),
    NORMAL(1);

    private final int value;

    AnomalyLabel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static AnomalyLabel fromValue(int value) {
        if (value == -1) return ANOMALOUS;
        if (value == 1) return NORMAL;
        throw new IllegalArgumentException("Unknown label value: " + value);
    }
}
