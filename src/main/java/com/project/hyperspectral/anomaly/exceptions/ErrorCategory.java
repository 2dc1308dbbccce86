package com.project.hyperspectral.anomaly.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Caller-visible failure categories. Every pipeline failure maps to exactly one category, and
 * every category except {@link #BAD_REQUEST} carries a fixed summarized message.
 */
public enum ErrorCategory {
    BAD_REQUEST(HttpStatus.BAD_REQUEST, null),
    CONFIGURATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Detector configuration is incompatible with the input cube"),
    SHAPE_MISMATCH(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error while assembling the anomaly map"),
    RENDER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to render the anomaly visualization"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Anomaly detection failed");

    private final HttpStatus status;
    private final String callerMessage;

    ErrorCategory(HttpStatus status, String callerMessage) {
        this.status = status;
        this.callerMessage = callerMessage;
    }

    public HttpStatus status() {
        return status;
    }

    /** Message shown to the caller; {@code detail} is only used for caller errors. */
    public String callerMessage(String detail) {
        return callerMessage != null ? callerMessage : detail;
    }
}
