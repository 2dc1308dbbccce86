package com.project.hyperspectral.anomaly.exceptions;

public class RenderException extends DetectionException {
    public RenderException(String message, Throwable cause) { super(ErrorCategory.RENDER_ERROR, message, cause); }
}
