package com.project.hyperspectral.anomaly.exceptions;

/** Configured dimensions are incompatible with the input cube or cannot be allocated. */
public class ConfigurationException extends DetectionException {
    public ConfigurationException(String message) { super(ErrorCategory.CONFIGURATION_ERROR, message); }
}
