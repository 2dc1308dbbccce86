package com.project.hyperspectral.anomaly.controller;

import com.project.hyperspectral.anomaly.DTOs.DetectionError;
import com.project.hyperspectral.anomaly.DTOs.DetectionOutcome;
import com.project.hyperspectral.anomaly.DTOs.ErrorResponse;
import com.project.hyperspectral.anomaly.service.AnomalyDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * JSON endpoint. Validates that an upload is present, runs the pipeline and maps the outcome
 * onto an HTTP status.
 */
@RestController
public class AnomalyApiController {
    private static final Logger log = LoggerFactory.getLogger(AnomalyApiController.class);

    private final AnomalyDetectionService detectionService;

    public AnomalyApiController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @PostMapping(value = "/api/detect-anomalies", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> detectAnomalies(@RequestParam(name = "image", required = false) MultipartFile image)
            throws IOException {
        if (image == null) {
            log.warn("API request without 'image' part");
            return ResponseEntity.badRequest().body(new ErrorResponse("No image provided"));
        }
        if (image.getOriginalFilename() == null || image.getOriginalFilename().isEmpty()) {
            log.warn("API request with unnamed 'image' part");
            return ResponseEntity.badRequest().body(new ErrorResponse("No image selected"));
        }

        log.info("API detection request: {} ({} bytes)", image.getOriginalFilename(), image.getSize());
        DetectionOutcome outcome = detectionService.detect(image.getBytes());
        if (outcome.isSuccess()) {
            return ResponseEntity.ok(outcome.result());
        }
        DetectionError error = outcome.error();
        return ResponseEntity.status(error.category().status()).body(new ErrorResponse(error.message()));
    }
}
