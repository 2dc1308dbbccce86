package com.project.hyperspectral.anomaly.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DetectionResult(
        @JsonProperty("anomaly_count") int anomalyCount,
        @JsonProperty("total_pixels") int totalPixels,
        @JsonProperty("visualization") String visualization,   // base64 PNG
        @JsonProperty("input_source") String inputSource       // "synthetic" until a real cube decoder exists
) {
    public double anomalyPercent() {
        return totalPixels == 0 ? 0.0 : 100.0 * anomalyCount / totalPixels;
    }
}
