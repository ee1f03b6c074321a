package com.iimsoft.gantt.chart;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a Gantt chart as a PNG image.
 */
public class GanttChartRenderer implements ChartRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GanttChartRenderer.class);

    static final int WIDTH = 1200;
    static final int HEIGHT = 800;
    static final int MARGIN_LEFT = 220;
    static final int MARGIN_RIGHT = 40;
    static final int MARGIN_TOP = 70;
    static final int MARGIN_BOTTOM = 70;

    private static final Color[] PALETTE = {
            new Color(0xFF7F0E), // orange
            new Color(0x2CA02C), // green
            new Color(0xD62728), // red
            new Color(0x9467BD), // purple
            new Color(0x1F77B4), // blue
            new Color(0xE377C2), // pink
            new Color(0x7F7F7F)  // grey
    };

    private final String timeUnit;

    public GanttChartRenderer(String timeUnit) {
        this.timeUnit = timeUnit;
    }

    @Override
    public void render(List<ChartBar> barList, Path outputFile) {
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, WIDTH, HEIGHT);
            draw(g, barList);
        } finally {
            g.dispose();
        }
        try {
            ImageIO.write(image, "png", outputFile.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write chart (" + outputFile + ").", e);
        }
        LOGGER.debug("Wrote chart ({}) with {} bars.", outputFile, barList.size());
    }

    private void draw(Graphics2D g, List<ChartBar> barList) {
        ChartScale scale = new ChartScale(barList, MARGIN_LEFT, WIDTH - MARGIN_RIGHT, MARGIN_TOP, HEIGHT - MARGIN_BOTTOM);
        int plotLeft = MARGIN_LEFT;
        int plotRight = WIDTH - MARGIN_RIGHT;
        int plotTop = MARGIN_TOP;
        int plotBottom = HEIGHT - MARGIN_BOTTOM;

        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 22));
        g.setColor(Color.BLACK);
        drawCentered(g, "Gantt Chart", WIDTH / 2, MARGIN_TOP / 2);

        // grid and x ticks
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 12));
        g.setStroke(new BasicStroke(1f));
        for (int tick = 0; tick <= scale.getMaxTime(); tick += scale.getTickStep()) {
            int x = scale.toX(tick);
            g.setColor(Color.LIGHT_GRAY);
            g.drawLine(x, plotTop, x, plotBottom);
            g.setColor(Color.BLACK);
            drawCentered(g, Integer.toString(tick), x, plotBottom + 18);
        }
        for (int i = 0; i < barList.size(); i++) {
            int y = scale.toRowCenterY(i);
            g.setColor(Color.LIGHT_GRAY);
            g.drawLine(plotLeft, y, plotRight, y);
        }
        g.setColor(Color.BLACK);
        g.drawRect(plotLeft, plotTop, plotRight - plotLeft, plotBottom - plotTop);
        drawCentered(g, "Start/Duration in " + timeUnit, (plotLeft + plotRight) / 2, plotBottom + 45);

        // bars
        int barHeight = scale.getBarHeight();
        for (int i = 0; i < barList.size(); i++) {
            ChartBar bar = barList.get(i);
            int y = scale.toRowCenterY(i);
            int x1 = scale.toX(bar.getStart());
            int x2 = scale.toX(bar.getEnd());
            g.setColor(PALETTE[i % PALETTE.length]);
            g.fillRect(x1, y - barHeight / 2, Math.max(1, x2 - x1), barHeight);
            g.setColor(Color.WHITE);
            drawCentered(g, Integer.toString(bar.getMagnitude()), (x1 + x2) / 2, y);

            g.setColor(Color.BLACK);
            FontMetrics metrics = g.getFontMetrics();
            g.drawString(bar.getLabel(), plotLeft - metrics.stringWidth(bar.getLabel()) - 8,
                    y + metrics.getAscent() / 2 - 1);
        }
    }

    private static void drawCentered(Graphics2D g, String text, int centerX, int centerY) {
        FontMetrics metrics = g.getFontMetrics();
        g.drawString(text, centerX - metrics.stringWidth(text) / 2, centerY + metrics.getAscent() / 2 - 1);
    }

}
