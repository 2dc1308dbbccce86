package com.project.hyperspectral.anomaly.service;

import com.project.hyperspectral.anomaly.DTOs.DetectionOutcome;
import com.project.hyperspectral.anomaly.DTOs.DetectionResult;
import com.project.hyperspectral.anomaly.config.DetectionProperties;
import com.project.hyperspectral.anomaly.exceptions.DetectionException;
import com.project.hyperspectral.anomaly.exceptions.ErrorCategory;
import com.project.hyperspectral.anomaly.model.AnomalyLabel;
import com.project.hyperspectral.anomaly.model.AnomalyMap;
import com.project.hyperspectral.anomaly.model.HyperspectralCube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Runs cube source, reducer, scorer, map assembler and renderer in sequence for one request.
 * <p>
 * The uploaded bytes are not decoded yet: a synthetic cube is analysed instead and results are
 * tagged {@link #SYNTHETIC_SOURCE} so callers can tell. Failures come back as a
 * {@link DetectionOutcome} error, never as a partial result.
 */
@Service
public class AnomalyDetectionService {
    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    public static final String SYNTHETIC_SOURCE = "synthetic";
    public static final String PROVIDED_SOURCE = "provided";

    private final CubeSource cubeSource;
    private final SpectralReducer reducer;
    private final AnomalyScorer scorer;
    private final AnomalyMapAssembler assembler;
    private final AnomalyMapRenderer renderer;
    private final DetectionProperties properties;

    public AnomalyDetectionService(CubeSource cubeSource, SpectralReducer reducer, AnomalyScorer scorer,
                                   AnomalyMapAssembler assembler, AnomalyMapRenderer renderer,
                                   DetectionProperties properties) {
        this.cubeSource = cubeSource;
        this.reducer = reducer;
        this.scorer = scorer;
        this.assembler = assembler;
        this.renderer = renderer;
        this.properties = properties;
    }

    /**
     * Entry point for uploaded image data.
     *
     * @param imageBytes uploaded payload; must be non-empty but its content is currently ignored
     */
    public DetectionOutcome detect(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            log.warn("Rejected detection request without image data");
            return DetectionOutcome.failure(ErrorCategory.BAD_REQUEST, "No image provided");
        }
        log.info("Received {} bytes of image data; analysing a synthetic {}x{}x{} cube instead",
                imageBytes.length, properties.getRows(), properties.getCols(), properties.getBands());

        return run(SYNTHETIC_SOURCE, () ->
                cubeSource.generate(properties.getRows(), properties.getCols(), properties.getBands()));
    }

    /** Analyses a cube that is already in memory. */
    public DetectionOutcome detect(HyperspectralCube cube) {
        if (cube == null) {
            return DetectionOutcome.failure(ErrorCategory.BAD_REQUEST, "No cube provided");
        }
        return run(PROVIDED_SOURCE, () -> cube);
    }

    private DetectionOutcome run(String inputSource, Supplier<HyperspectralCube> supplier) {
        long start = System.currentTimeMillis();
        try {
            HyperspectralCube cube = supplier.get();
            double[][] embeddings = reducer.reduce(cube.pixelVectors(), properties.getComponents());
            AnomalyLabel[] labels = scorer.score(embeddings);
            AnomalyMap map = assembler.assemble(labels, cube.rows(), cube.cols());
            int anomalies = assembler.count(map);
            String visualization = renderer.render(map);

            DetectionResult result = new DetectionResult(anomalies, cube.pixelCount(), visualization, inputSource);
            log.info("Detection completed in {} ms: {} anomalies in {} pixels ({}%)",
                    System.currentTimeMillis() - start, anomalies, cube.pixelCount(),
                    String.format("%.2f", result.anomalyPercent()));
            return DetectionOutcome.success(result);
        } catch (DetectionException e) {
            log.error("Detection failed ({}): {}", e.category(), e.getMessage(), e);
            return DetectionOutcome.failure(e.category(), e.category().callerMessage(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected detection failure", e);
            return DetectionOutcome.failure(ErrorCategory.INTERNAL_ERROR,
                    ErrorCategory.INTERNAL_ERROR.callerMessage(null));
        }
    }
}
