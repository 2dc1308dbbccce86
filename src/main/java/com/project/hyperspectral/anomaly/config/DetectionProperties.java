package com.project.hyperspectral.anomaly.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pipeline settings bound from {@code app.detection.*}. Read once at startup; nothing mutates
 * them afterwards.
 */
@Validated
@ConfigurationProperties(prefix = "app.detection")
public class DetectionProperties {

    // Synthetic cube
    @Min(1) private int rows = 100;
    @Min(1) private int cols = 100;
    @Min(1) private int bands = 50;
    @Min(0) private int plantedAnomalies = 20;
    @Min(0) @Max(255) private int anomalyMinIntensity = 200;
    @Min(1) @Max(256) private int anomalyMaxIntensity = 255;   // exclusive
    private Long cubeSeed;                                     // null = fresh randomness per cube

    // Reducer
    @Min(1) private int components = 5;

    // Scorer
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("0.5")
    private double contamination = 0.01;
    private long randomSeed = 42L;
    @Min(1) private int estimators = 100;
    @Min(2) private int maxSamples = 256;

    public int getRows() { return rows; }
    public void setRows(int rows) { this.rows = rows; }

    public int getCols() { return cols; }
    public void setCols(int cols) { this.cols = cols; }

    public int getBands() { return bands; }
    public void setBands(int bands) { this.bands = bands; }

    public int getPlantedAnomalies() { return plantedAnomalies; }
    public void setPlantedAnomalies(int plantedAnomalies) { this.plantedAnomalies = plantedAnomalies; }

    public int getAnomalyMinIntensity() { return anomalyMinIntensity; }
    public void setAnomalyMinIntensity(int anomalyMinIntensity) { this.anomalyMinIntensity = anomalyMinIntensity; }

    public int getAnomalyMaxIntensity() { return anomalyMaxIntensity; }
    public void setAnomalyMaxIntensity(int anomalyMaxIntensity) { this.anomalyMaxIntensity = anomalyMaxIntensity; }

    public Long getCubeSeed() { return cubeSeed; }
    public void setCubeSeed(Long cubeSeed) { this.cubeSeed = cubeSeed; }

    public int getComponents() { return components; }
    public void setComponents(int components) { this.components = components; }

    public double getContamination() { return contamination; }
    public void setContamination(double contamination) { this.contamination = contamination; }

    public long getRandomSeed() { return randomSeed; }
    public void setRandomSeed(long randomSeed) { this.randomSeed = randomSeed; }

    public int getEstimators() { return estimators; }
    public void setEstimators(int estimators) { this.estimators = estimators; }

    public int getMaxSamples() { return maxSamples; }
    public void setMaxSamples(int maxSamples) { this.maxSamples = maxSamples; }
}
