package com.project.hyperspectral.anomaly.exceptions;

/** Domain-specific exception for pipeline failures. */
public class DetectionException extends RuntimeException {
    private final ErrorCategory category;

    public DetectionException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public DetectionException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
