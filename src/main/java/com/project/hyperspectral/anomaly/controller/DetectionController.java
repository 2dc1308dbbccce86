package com.project.hyperspectral.anomaly.controller;

import com.project.hyperspectral.anomaly.DTOs.DetectionOutcome;
import com.project.hyperspectral.anomaly.DTOs.DetectionResult;
import com.project.hyperspectral.anomaly.service.AnomalyDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/** Browser flow: upload form on {@code /}, results page after {@code POST /detect}. */
@Controller
public class DetectionController {
    private static final Logger log = LoggerFactory.getLogger(DetectionController.class);

    private final AnomalyDetectionService detectionService;

    public DetectionController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(@RequestParam(name = "image", required = false) MultipartFile image, Model model)
            throws IOException {
        if (image == null || image.isEmpty()) {
            model.addAttribute("error", "Please upload an image first.");
            return "index";
        }

        DetectionOutcome outcome = detectionService.detect(image.getBytes());
        if (!outcome.isSuccess()) {
            log.warn("Detection failed for {}: {}", image.getOriginalFilename(), outcome.error().message());
            model.addAttribute("error", outcome.error().message());
            return "index";
        }

        populateResultModel(model, image.getOriginalFilename(), outcome.result());
        return "result";
    }

    private void populateResultModel(Model model, String filename, DetectionResult result) {
        model.addAttribute("filename", filename);
        model.addAttribute("anomalyCount", result.anomalyCount());
        model.addAttribute("totalPixels", result.totalPixels());
        model.addAttribute("anomalyPercent", String.format("%.2f", result.anomalyPercent()));
        model.addAttribute("visualization", result.visualization());
        model.addAttribute("synthetic", AnomalyDetectionService.SYNTHETIC_SOURCE.equals(result.inputSource()));
    }
}
