package com.project.hyperspectral.anomaly.service;

import com.project.hyperspectral.anomaly.config.DetectionProperties;
import com.project.hyperspectral.anomaly.exceptions.ConfigurationException;
import com.project.hyperspectral.anomaly.model.HyperspectralCube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Random;

/**
 * Stand-in for a real sensor decoder: uniform noise in [0, 255] with a number of pixels
 * overwritten, across all bands, by high-intensity values.
 * <p>
 * Planted locations are drawn independently and may repeat.
 */
@Service
public class SyntheticCubeSource implements CubeSource {
    private static final Logger log = LoggerFactory.getLogger(SyntheticCubeSource.class);

    // largest array length the JVM reliably allocates
    static final long MAX_SAMPLES = Integer.MAX_VALUE - 8;

    private final int plantedAnomalies;
    private final int anomalyMin;
    private final int anomalyMaxExclusive;
    private final Long seed;

    @Autowired
    public SyntheticCubeSource(DetectionProperties properties) {
        this(properties.getPlantedAnomalies(), properties.getAnomalyMinIntensity(),
                properties.getAnomalyMaxIntensity(), properties.getCubeSeed());
    }

    public SyntheticCubeSource(int plantedAnomalies, int anomalyMin, int anomalyMaxExclusive, Long seed) {
        if (plantedAnomalies < 0) {
            throw new IllegalArgumentException("plantedAnomalies must be >= 0");
        }
        if (anomalyMin < 0 || anomalyMaxExclusive > 256 || anomalyMin >= anomalyMaxExclusive) {
            throw new IllegalArgumentException(
                    "Invalid anomaly intensity range [" + anomalyMin + ", " + anomalyMaxExclusive + ")");
        }
        this.plantedAnomalies = plantedAnomalies;
        this.anomalyMin = anomalyMin;
        this.anomalyMaxExclusive = anomalyMaxExclusive;
        this.seed = seed;
    }

    /**
     * @throws ConfigurationException if rows x cols x bands does not fit in a single cube
     */
    @Override
    public HyperspectralCube generate(int rows, int cols, int bands) {
        if (rows <= 0 || cols <= 0 || bands <= 0) {
            throw new IllegalArgumentException(
                    "Cube dimensions must be positive: " + rows + "x" + cols + "x" + bands);
        }
        long total = (long) rows * cols * bands;
        if (total > MAX_SAMPLES) {
            throw new ConfigurationException("Cube " + rows + "x" + cols + "x" + bands + " is too large: "
                    + total + " samples exceeds the limit of " + MAX_SAMPLES);
        }
        Random rnd = seed == null ? new Random() : new Random(seed);
        byte[] samples = new byte[(int) total];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (byte) rnd.nextInt(256);
        }

        int span = anomalyMaxExclusive - anomalyMin;
        for (int a = 0; a < plantedAnomalies; a++) {
            int r = rnd.nextInt(rows);
            int c = rnd.nextInt(cols);
            int base = (int) (((long) r * cols + c) * bands);
            for (int b = 0; b < bands; b++) {
                samples[base + b] = (byte) (anomalyMin + rnd.nextInt(span));
            }
        }

        log.debug("Generated synthetic cube {}x{}x{} with {} planted anomalies",
                rows, cols, bands, plantedAnomalies);
        return new HyperspectralCube(rows, cols, bands, samples);
    }
}
