package com.project.hyperspectral.anomaly.service;

import com.project.hyperspectral.anomaly.model.AnomalyLabel;
import com.project.hyperspectral.anomaly.model.AnomalyMap;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicInteger;
import javax.imageio.ImageIO;

import static org.assertj.core.api.Assertions.*;

class AnomalyMapRendererTest {
    private final AnomalyMapRenderer renderer = new AnomalyMapRenderer();

    private static AnomalyMap mapWithAnomalyAtOrigin(int rows, int cols) {
        AnomalyLabel[] labels = new AnomalyLabel[rows * cols];
        Arrays.fill(labels, AnomalyLabel.NORMAL);
        labels[0] = AnomalyLabel.ANOMALOUS;
        return AnomalyMap.wrap(rows, cols, labels);
    }

    private static BufferedImage decode(String base64) throws Exception {
        byte[] png = Base64.getDecoder().decode(base64);
        return ImageIO.read(new ByteArrayInputStream(png));
    }

    private static void assertColorNear(int rgb, Color expected) {
        Color actual = new Color(rgb);
        assertThat(actual.getRed()).isCloseTo(expected.getRed(), within(3));
        assertThat(actual.getGreen()).isCloseTo(expected.getGreen(), within(3));
        assertThat(actual.getBlue()).isCloseTo(expected.getBlue(), within(3));
    }

    @Test
    void render_producesBase64Png() throws Exception {
        BufferedImage img = decode(renderer.render(mapWithAnomalyAtOrigin(100, 100)));

        assertThat(img).isNotNull();
        assertThat(img.getWidth()).isEqualTo(AnomalyMapRenderer.FIGURE_WIDTH);
        assertThat(img.getHeight()).isEqualTo(AnomalyMapRenderer.FIGURE_HEIGHT);
    }

    @Test
    void render_colorsLabelsWithDivergingScale() throws Exception {
        BufferedImage img = decode(renderer.render(mapWithAnomalyAtOrigin(100, 100)));

        // 100x100 map is drawn as a 670x670 panel whose top-left corner is (80, 70)
        assertColorNear(img.getRGB(83, 73), AnomalyMapRenderer.colorFor(-1));
        assertColorNear(img.getRGB(80 + 335, 70 + 335), AnomalyMapRenderer.colorFor(1));
    }

    @Test
    void colorFor_coolForAnomalousWarmForNormal() {
        Color cool = AnomalyMapRenderer.colorFor(AnomalyLabel.ANOMALOUS.value());
        Color warm = AnomalyMapRenderer.colorFor(AnomalyLabel.NORMAL.value());

        assertThat(cool.getBlue()).isGreaterThan(cool.getRed());
        assertThat(warm.getRed()).isGreaterThan(warm.getBlue());
    }

    @Test
    void render_handlesNonSquareAndTinyMaps() throws Exception {
        assertThat(decode(renderer.render(mapWithAnomalyAtOrigin(1, 1)))).isNotNull();
        assertThat(decode(renderer.render(mapWithAnomalyAtOrigin(10, 2000)))).isNotNull();
    }

    @Test
    void render_checksFontSupportOnEveryCall() throws Exception {
        AtomicInteger checks = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        AnomalyMapRenderer flaky = new AnomalyMapRenderer() {
            @Override
            boolean canDrawText(Graphics2D g) {
                checks.incrementAndGet();
                // fonts missing on the first figure only
                return calls.getAndIncrement() > 0;
            }
        };

        BufferedImage first = decode(flaky.render(mapWithAnomalyAtOrigin(10, 10)));
        BufferedImage second = decode(flaky.render(mapWithAnomalyAtOrigin(10, 10)));

        assertThat(checks.get()).isEqualTo(2);
        assertThat(countDarkPixelsInTitleBand(first)).isZero();
        assertThat(countDarkPixelsInTitleBand(second)).isPositive();
    }

    @Test
    void render_withoutFonts_stillProducesFigure() throws Exception {
        AnomalyMapRenderer noFonts = new AnomalyMapRenderer() {
            @Override
            boolean canDrawText(Graphics2D g) {
                return false;
            }
        };

        BufferedImage img = decode(noFonts.render(mapWithAnomalyAtOrigin(100, 100)));

        assertThat(img.getWidth()).isEqualTo(AnomalyMapRenderer.FIGURE_WIDTH);
        assertThat(countDarkPixelsInTitleBand(img)).isZero();
        assertColorNear(img.getRGB(83, 73), AnomalyMapRenderer.colorFor(-1));
    }

    // The title is the only thing drawn above the panel.
    private static int countDarkPixelsInTitleBand(BufferedImage img) {
        int dark = 0;
        for (int y = 0; y < 60; y++) {
            for (int x = 0; x < img.getWidth(); x++) {
                Color c = new Color(img.getRGB(x, y));
                if (c.getRed() < 128 && c.getGreen() < 128 && c.getBlue() < 128) dark++;
            }
        }
        return dark;
    }
}
