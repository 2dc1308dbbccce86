package com.project.hyperspectral.anomaly.service;

import com.project.hyperspectral.anomaly.model.HyperspectralCube;

/** Supplies the in-memory cube the pipeline analyses. */
public interface CubeSource {

    HyperspectralCube generate(int rows, int cols, int bands);
}
