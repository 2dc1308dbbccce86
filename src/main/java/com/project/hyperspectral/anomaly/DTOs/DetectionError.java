package com.project.hyperspectral.anomaly.DTOs;

import com.project.hyperspectral.anomaly.exceptions.ErrorCategory;

public record DetectionError(ErrorCategory category, String message) {}
