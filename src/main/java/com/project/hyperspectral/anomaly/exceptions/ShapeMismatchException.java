package com.project.hyperspectral.anomaly.exceptions;

/** Flat label count disagrees with the declared rows x cols. */
public class ShapeMismatchException extends DetectionException {
    public ShapeMismatchException(String message) { super(ErrorCategory.SHAPE_MISMATCH, message); }
}
