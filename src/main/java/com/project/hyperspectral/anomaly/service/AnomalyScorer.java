package com.project.hyperspectral.anomaly.service;

import com.project.hyperspectral.anomaly.algorithms.IsolationForest;
import com.project.hyperspectral.anomaly.config.DetectionProperties;
import com.project.hyperspectral.anomaly.model.AnomalyLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Fits an isolation forest over the embedded pixel population and labels every pixel.
 * A new forest is fit per call; the seed makes the labels reproducible.
 */
@Service
public class AnomalyScorer {
    private static final Logger log = LoggerFactory.getLogger(AnomalyScorer.class);

    private final double contamination;
    private final long randomSeed;
    private final int estimators;
    private final int maxSamples;

    @Autowired
    public AnomalyScorer(DetectionProperties properties) {
        this(properties.getContamination(), properties.getRandomSeed(),
                properties.getEstimators(), properties.getMaxSamples());
    }

    public AnomalyScorer(double contamination, long randomSeed, int estimators, int maxSamples) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        this.contamination = contamination;
        this.randomSeed = randomSeed;
        this.estimators = estimators;
        this.maxSamples = maxSamples;
    }

    public AnomalyLabel[] score(double[][] embeddings) {
        return score(embeddings, randomSeed);
    }

    public AnomalyLabel[] score(double[][] embeddings, long seed) {
        log.debug("Fitting isolation forest: points={}, estimators={}, maxSamples={}, contamination={}, seed={}",
                embeddings.length, estimators, maxSamples, contamination, seed);

        IsolationForest forest = IsolationForest.fit(embeddings, estimators, maxSamples, seed);
        int[] values = forest.predict(embeddings, contamination);

        AnomalyLabel[] labels = new AnomalyLabel[values.length];
        int anomalous = 0;
        for (int i = 0; i < values.length; i++) {
            labels[i] = AnomalyLabel.fromValue(values[i]);
            if (labels[i] == AnomalyLabel.ANOMALOUS) anomalous++;
        }
        log.debug("Isolation forest flagged {} of {} points", anomalous, values.length);
        return labels;
    }
}
