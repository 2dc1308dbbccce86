package com.project.hyperspectral.anomaly.DTOs;

import com.project.hyperspectral.anomaly.exceptions.ErrorCategory;

/**
 * Result-or-error returned by the pipeline entry point. Exactly one of {@code result} and
 * {@code error} is non-null; a failed run never carries a partial result.
 */
public record DetectionOutcome(DetectionResult result, DetectionError error) {

    public DetectionOutcome {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result and error must be set");
        }
    }

    public static DetectionOutcome success(DetectionResult result) {
        return new DetectionOutcome(result, null);
    }

    public static DetectionOutcome failure(ErrorCategory category, String message) {
        return new DetectionOutcome(null, new DetectionError(category, message));
    }

    public boolean isSuccess() {
        return result != null;
    }
}
