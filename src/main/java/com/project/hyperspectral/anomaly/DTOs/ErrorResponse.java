package com.project.hyperspectral.anomaly.DTOs;

/** JSON body of every failed API call: {@code {"error": "..."}}. */
public record ErrorResponse(String error) {}
