package com.project.hyperspectral.anomaly.service;

import com.project.hyperspectral.anomaly.exceptions.RenderException;
import com.project.hyperspectral.anomaly.model.AnomalyMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import javax.imageio.ImageIO;

/**
 * Draws an anomaly map as a titled PNG figure with a diverging color scale and a colorbar,
 * then base64-encodes it.
 * <p>
 * Rendering runs headless; the mode is switched on once when this class is loaded. Calls to
 * {@link #render} are serialized.
 */
@Service
public class AnomalyMapRenderer {
    private static final Logger log = LoggerFactory.getLogger(AnomalyMapRenderer.class);

    static final int FIGURE_WIDTH = 1000;
    static final int FIGURE_HEIGHT = 800;
    static final String TITLE = "Anomaly Detection Map";

    private static final int MARGIN_LEFT = 80;
    private static final int MARGIN_TOP = 70;
    private static final int MARGIN_BOTTOM = 60;
    private static final int COLORBAR_GAP = 40;
    private static final int COLORBAR_WIDTH = 25;
    private static final int COLORBAR_RESERVE = 160;

    // matplotlib "coolwarm" stops at 0, 0.5 and 1
    private static final Color COOL = new Color(59, 76, 192);
    private static final Color NEUTRAL = new Color(221, 221, 221);
    private static final Color WARM = new Color(180, 4, 38);

    private static final double SCALE_MIN = -1.0;
    private static final double SCALE_MAX = 1.0;

    private static final Font TITLE_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 20);
    private static final Font TICK_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 12);

    static {
        if (System.getProperty("java.awt.headless") == null) {
            System.setProperty("java.awt.headless", "true");
        }
        log.info("Renderer initialised (headless={})", System.getProperty("java.awt.headless"));
    }

    /**
     * @return base64 text of the PNG figure
     * @throws RenderException if the PNG cannot be encoded
     */
    public synchronized String render(AnomalyMap map) {
        byte[] png = toPng(drawFigure(map));
        log.debug("Rendered {}x{} map into {} byte PNG", map.rows(), map.cols(), png.length);
        return Base64.getEncoder().encodeToString(png);
    }

    private BufferedImage drawFigure(AnomalyMap map) {
        BufferedImage figure = new BufferedImage(FIGURE_WIDTH, FIGURE_HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = figure.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, FIGURE_WIDTH, FIGURE_HEIGHT);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);

            int availW = FIGURE_WIDTH - MARGIN_LEFT - COLORBAR_RESERVE;
            int availH = FIGURE_HEIGHT - MARGIN_TOP - MARGIN_BOTTOM;
            double scale = Math.min((double) availW / map.cols(), (double) availH / map.rows());
            int panelW = Math.max(1, (int) Math.round(map.cols() * scale));
            int panelH = Math.max(1, (int) Math.round(map.rows() * scale));
            int panelX = MARGIN_LEFT;
            int panelY = MARGIN_TOP + (availH - panelH) / 2;

            g.drawImage(rasterize(map), panelX, panelY, panelW, panelH, null);
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(1f));
            g.drawRect(panelX, panelY, panelW, panelH);

            boolean labels = canDrawText(g);
            if (labels) {
                g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            }
            int barX = panelX + panelW + COLORBAR_GAP;
            drawColorbar(g, barX, panelY, panelH, labels);

            if (labels) {
                g.setFont(TITLE_FONT);
                drawText(g, TITLE, FIGURE_WIDTH / 2, MARGIN_TOP / 2 + 8, true);
            }
            drawAxisTicks(g, map, panelX, panelY, panelW, panelH, labels);
        } finally {
            g.dispose();
        }
        return figure;
    }

    private static BufferedImage rasterize(AnomalyMap map) {
        BufferedImage img = new BufferedImage(map.cols(), map.rows(), BufferedImage.TYPE_INT_RGB);
        for (int r = 0; r < map.rows(); r++) {
            for (int c = 0; c < map.cols(); c++) {
                img.setRGB(c, r, colorFor(map.get(r, c).value()).getRGB());
            }
        }
        return img;
    }

    private void drawColorbar(Graphics2D g, int x, int y, int h, boolean labels) {
        for (int i = 0; i < h; i++) {
            double v = SCALE_MAX - (SCALE_MAX - SCALE_MIN) * i / Math.max(1, h - 1);
            g.setColor(colorFor(v));
            g.fillRect(x, y + i, COLORBAR_WIDTH, 1);
        }
        g.setColor(Color.BLACK);
        g.drawRect(x, y, COLORBAR_WIDTH, h);

        g.setFont(TICK_FONT);
        for (double tick = SCALE_MIN; tick <= SCALE_MAX + 1e-9; tick += 0.25) {
            int ty = y + (int) Math.round((SCALE_MAX - tick) / (SCALE_MAX - SCALE_MIN) * h);
            g.setColor(Color.BLACK);
            g.drawLine(x + COLORBAR_WIDTH, ty, x + COLORBAR_WIDTH + 4, ty);
            if (labels) {
                drawText(g, String.format("%.2f", tick), x + COLORBAR_WIDTH + 8, ty + 4, false);
            }
        }
    }

    private void drawAxisTicks(Graphics2D g, AnomalyMap map, int px, int py, int pw, int ph, boolean labels) {
        g.setFont(TICK_FONT);
        g.setColor(Color.BLACK);
        int colStep = niceStep(map.cols());
        for (int c = 0; c < map.cols(); c += colStep) {
            int tx = px + (int) Math.round((c + 0.5) * pw / map.cols());
            g.drawLine(tx, py + ph, tx, py + ph + 4);
            if (labels) drawText(g, Integer.toString(c), tx, py + ph + 18, true);
        }
        int rowStep = niceStep(map.rows());
        for (int r = 0; r < map.rows(); r += rowStep) {
            int ty = py + (int) Math.round((r + 0.5) * ph / map.rows());
            g.drawLine(px - 4, ty, px, ty);
            if (labels) drawText(g, Integer.toString(r), px - 30, ty + 4, false);
        }
    }

    // Roughly five ticks per axis, on 1/2/5 x 10^n steps.
    private static int niceStep(int extent) {
        double raw = Math.max(1.0, extent / 5.0);
        double magnitude = Math.pow(10, Math.floor(Math.log10(raw)));
        double norm = raw / magnitude;
        double nice = norm <= 1 ? 1 : norm <= 2 ? 2 : norm <= 5 ? 5 : 10;
        return Math.max(1, (int) (nice * magnitude));
    }

    /**
     * Checked once per figure. A runtime without a usable font subsystem (no fontconfig in a
     * slim image) fails on the first metrics lookup; the figure is then drawn without labels.
     */
    boolean canDrawText(Graphics2D g) {
        try {
            g.getFontMetrics(TITLE_FONT).stringWidth(TITLE);
            return true;
        } catch (UnsatisfiedLinkError | NoClassDefFoundError | InternalError e) {
            log.warn("Font subsystem unavailable, rendering figure without labels: {}", e.toString());
            return false;
        }
    }

    private static void drawText(Graphics2D g, String text, int x, int y, boolean centered) {
        int drawX = x;
        if (centered) {
            FontMetrics fm = g.getFontMetrics();
            drawX = x - fm.stringWidth(text) / 2;
        }
        g.drawString(text, drawX, y);
    }

    static Color colorFor(double value) {
        double t = (value - SCALE_MIN) / (SCALE_MAX - SCALE_MIN);
        t = Math.max(0.0, Math.min(1.0, t));
        return t < 0.5 ? lerp(COOL, NEUTRAL, t * 2) : lerp(NEUTRAL, WARM, (t - 0.5) * 2);
    }

    private static Color lerp(Color a, Color b, double t) {
        return new Color(
                (int) Math.round(a.getRed() + (b.getRed() - a.getRed()) * t),
                (int) Math.round(a.getGreen() + (b.getGreen() - a.getGreen()) * t),
                (int) Math.round(a.getBlue() + (b.getBlue() - a.getBlue()) * t));
    }

    private static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(img, "png", baos)) {
                throw new RenderException("No PNG writer available", null);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new RenderException("Failed to encode image", e);
        }
    }
}
