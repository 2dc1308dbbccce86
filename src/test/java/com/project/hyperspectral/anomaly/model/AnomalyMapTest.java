package com.project.hyperspectral.anomaly.model;

import com.project.hyperspectral.anomaly.exceptions.ShapeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class AnomalyMapTest {

    private static AnomalyLabel[] normals(int n) {
        AnomalyLabel[] labels = new AnomalyLabel[n];
        Arrays.fill(labels, AnomalyLabel.NORMAL);
        return labels;
    }

    @Test
    void wrap_rejectsLabelCountThatDoesNotFillGrid() {
        assertThatThrownBy(() -> AnomalyMap.wrap(2, 2, normals(3)))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("3 labels into 2x2");
        assertThatThrownBy(() -> AnomalyMap.wrap(2, 2, normals(5)))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void wrap_rejectsNonPositiveDimensions() {
        assertThatThrownBy(() -> AnomalyMap.wrap(0, 0, new AnomalyLabel[0]))
                .isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> AnomalyMap.wrap(-2, -2, normals(4)))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void wrap_rejectsMissingLabels() {
        AnomalyLabel[] labels = normals(4);
        labels[2] = null;

        assertThatThrownBy(() -> AnomalyMap.wrap(2, 2, labels))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("index 2");
        assertThatThrownBy(() -> AnomalyMap.wrap(2, 2, null))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void get_outsideGrid_throws() {
        AnomalyMap map = AnomalyMap.wrap(2, 3, normals(6));

        assertThat(map.get(1, 2)).isEqualTo(AnomalyLabel.NORMAL);
        assertThatThrownBy(() -> map.get(2, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> map.get(0, 3)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
