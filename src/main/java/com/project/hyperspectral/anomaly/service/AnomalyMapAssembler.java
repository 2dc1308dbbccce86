package com.project.hyperspectral.anomaly.service;

import com.project.hyperspectral.anomaly.exceptions.ShapeMismatchException;
import com.project.hyperspectral.anomaly.model.AnomalyLabel;
import com.project.hyperspectral.anomaly.model.AnomalyMap;
import org.springframework.stereotype.Service;

@Service
public class AnomalyMapAssembler {

    /**
     * Reshapes a row-major label sequence into a rows x cols map: label {@code i} lands at
     * {@code (i / cols, i % cols)}.
     *
     * @throws ShapeMismatchException if {@code labels.length != rows * cols}
     */
    public AnomalyMap assemble(AnomalyLabel[] labels, int rows, int cols) {
        return AnomalyMap.wrap(rows, cols, labels);
    }

    public int count(AnomalyMap map) {
        int n = 0;
        for (int r = 0; r < map.rows(); r++) {
            for (int c = 0; c < map.cols(); c++) {
                if (map.get(r, c) == AnomalyLabel.ANOMALOUS) n++;
            }
        }
        return n;
    }
}
