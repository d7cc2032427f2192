package com.propertyBot.ratingsBot.report.service;

import com.propertyBot.ratingsBot.property.model.PropertyRecord;
import com.propertyBot.ratingsBot.property.model.RankedEntry;
import com.propertyBot.ratingsBot.property.model.RatingPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Draws ranked properties as grouped horizontal bars (Airbnb above, Booking below) and
 * encodes the result as PNG.
 *
 * Each call owns its image and graphics context, so concurrent renders share nothing.
 */
@Slf4j
@Service
public class RatingsChartRenderer {

    static final int CHART_WIDTH = 1500;
    static final int CHART_MIN_HEIGHT = 900;
    static final int CHART_ROW_HEIGHT = 75;
    static final double X_AXIS_MAX = 5.5;
    static final int NAME_MAX_LENGTH = 20;
    static final int NAME_KEEP_LENGTH = 17;

    private static final double SUB_BAR_HEIGHT = 0.35;
    private static final int X_TICK_MAX = 5;

    private static final int MARGIN_TOP = 90;
    private static final int MARGIN_BOTTOM = 100;
    private static final int MARGIN_RIGHT = 50;
    private static final int LABEL_GAP = 14;

    private static final Color AIRBNB_COLOR = new Color(0xFF5A5F);
    private static final Color BOOKING_COLOR = new Color(0x003580);
    private static final Color GRID_COLOR = new Color(0, 0, 0, 77);
    private static final Color TEXT_COLOR = new Color(0x212121);

    private static final Font TITLE_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 28);
    private static final Font AXIS_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 22);
    private static final Font TICK_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 20);
    private static final Font VALUE_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 18);

    /**
     * Renders the chart.
     *
     * @param entries ranked entries, rank 1 first
     * @param title   chart title
     * @return PNG bytes, or an empty array when encoding failed
     */
    public byte[] render(List<RankedEntry> entries, String title) {
        List<ChartRow> rows = buildRows(entries);
        int height = chartHeight(rows.size());

        BufferedImage image = new BufferedImage(CHART_WIDTH, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, CHART_WIDTH, height);

            PlotArea plot = plotArea(graphics, rows, height);
            drawGrid(graphics, plot);
            drawBars(graphics, plot, rows);
            drawFrame(graphics, plot);
            drawXAxis(graphics, plot);
            drawYAxis(graphics, plot, rows);
            drawTitle(graphics, title);
            drawLegend(graphics, plot);
        } finally {
            graphics.dispose();
        }
        return writePng(image);
    }

    static int chartHeight(int rowCount) {
        return Math.max(CHART_MIN_HEIGHT, rowCount * CHART_ROW_HEIGHT);
    }

    /**
     * Names longer than 20 code points keep their first 17 plus an ellipsis.
     */
    static String truncateName(String name) {
        if (name.codePointCount(0, name.length()) > NAME_MAX_LENGTH) {
            return name.substring(0, name.offsetByCodePoints(0, NAME_KEEP_LENGTH)) + "...";
        }
        return name;
    }

    private List<ChartRow> buildRows(List<RankedEntry> entries) {
        List<ChartRow> rows = new ArrayList<>(entries.size());
        for (RankedEntry entry : entries) {
            PropertyRecord property = entry.property();
            RatingPair ratings = property.ratings();
            rows.add(new ChartRow(
                    truncateName(property.name("Unknown")),
                    ratings.airbnb().orElse(0.0),
                    ratings.booking().orElse(0.0)));
        }
        return rows;
    }

    private PlotArea plotArea(Graphics2D graphics, List<ChartRow> rows, int height) {
        FontMetrics metrics = graphics.getFontMetrics(TICK_FONT);
        int labelWidth = 0;
        for (ChartRow row : rows) {
            labelWidth = Math.max(labelWidth, metrics.stringWidth(row.name()));
        }
        int left = Math.max(120, labelWidth + LABEL_GAP * 3);
        return new PlotArea(left, MARGIN_TOP, CHART_WIDTH - MARGIN_RIGHT - left,
                height - MARGIN_TOP - MARGIN_BOTTOM, rows.size());
    }

    private void drawGrid(Graphics2D graphics, PlotArea plot) {
        graphics.setColor(GRID_COLOR);
        graphics.setStroke(new BasicStroke(1f));
        for (int tick = 0; tick <= X_TICK_MAX; tick++) {
            int x = plot.xFor(tick);
            graphics.drawLine(x, plot.top(), x, plot.bottom());
        }
    }

    private void drawBars(Graphics2D graphics, PlotArea plot, List<ChartRow> rows) {
        double barHeight = plot.rowHeight() * SUB_BAR_HEIGHT;
        graphics.setFont(VALUE_FONT);
        FontMetrics metrics = graphics.getFontMetrics();
        for (int i = 0; i < rows.size(); i++) {
            ChartRow row = rows.get(i);
            double center = plot.rowCenter(i);
            drawBar(graphics, plot, metrics, row.airbnb(), center - barHeight, barHeight, AIRBNB_COLOR);
            drawBar(graphics, plot, metrics, row.booking(), center, barHeight, BOOKING_COLOR);
        }
    }

    private void drawBar(Graphics2D graphics, PlotArea plot, FontMetrics metrics,
                         double value, double top, double barHeight, Color color) {
        int y = (int) Math.round(top);
        int h = Math.max(1, (int) Math.round(barHeight));
        int width = plot.xFor(value) - plot.left();
        if (width > 0) {
            graphics.setColor(color);
            graphics.fillRect(plot.left(), y, width, h);
        }
        if (value > 0) {
            String label = String.format(Locale.ROOT, "%.1f", value);
            int labelX = plot.xFor(value + 0.05);
            int labelY = y + h / 2 + (metrics.getAscent() - metrics.getDescent()) / 2;
            graphics.setColor(TEXT_COLOR);
            graphics.drawString(label, labelX, labelY);
        }
    }

    private void drawFrame(Graphics2D graphics, PlotArea plot) {
        graphics.setColor(Color.BLACK);
        graphics.setStroke(new BasicStroke(1.5f));
        graphics.drawRect(plot.left(), plot.top(), plot.width(), plot.height());
    }

    private void drawXAxis(Graphics2D graphics, PlotArea plot) {
        graphics.setFont(TICK_FONT);
        FontMetrics metrics = graphics.getFontMetrics();
        graphics.setColor(TEXT_COLOR);
        for (int tick = 0; tick <= X_TICK_MAX; tick++) {
            String label = String.valueOf(tick);
            int x = plot.xFor(tick);
            graphics.drawLine(x, plot.bottom(), x, plot.bottom() + 6);
            graphics.drawString(label, x - metrics.stringWidth(label) / 2, plot.bottom() + 8 + metrics.getAscent());
        }
        graphics.setFont(AXIS_FONT);
        FontMetrics axisMetrics = graphics.getFontMetrics();
        String axisLabel = "Rating";
        int x = plot.left() + (plot.width() - axisMetrics.stringWidth(axisLabel)) / 2;
        graphics.drawString(axisLabel, x, plot.bottom() + 16 + metrics.getHeight() + axisMetrics.getAscent());
    }

    private void drawYAxis(Graphics2D graphics, PlotArea plot, List<ChartRow> rows) {
        graphics.setFont(TICK_FONT);
        FontMetrics metrics = graphics.getFontMetrics();
        graphics.setColor(TEXT_COLOR);
        for (int i = 0; i < rows.size(); i++) {
            String name = rows.get(i).name();
            int y = (int) Math.round(plot.rowCenter(i));
            graphics.drawLine(plot.left() - 6, y, plot.left(), y);
            graphics.drawString(name, plot.left() - LABEL_GAP - metrics.stringWidth(name),
                    y + (metrics.getAscent() - metrics.getDescent()) / 2);
        }
    }

    private void drawTitle(Graphics2D graphics, String title) {
        if (title == null || title.isEmpty()) {
            return;
        }
        graphics.setFont(TITLE_FONT);
        FontMetrics metrics = graphics.getFontMetrics();
        graphics.setColor(TEXT_COLOR);
        graphics.drawString(title, (CHART_WIDTH - metrics.stringWidth(title)) / 2, MARGIN_TOP / 2 + metrics.getAscent() / 2);
    }

    private void drawLegend(Graphics2D graphics, PlotArea plot) {
        graphics.setFont(TICK_FONT);
        FontMetrics metrics = graphics.getFontMetrics();
        String[] labels = {"Airbnb", "Booking"};
        Color[] colors = {AIRBNB_COLOR, BOOKING_COLOR};
        int swatch = 28;
        int padding = 12;
        int lineHeight = Math.max(swatch, metrics.getHeight()) + 6;
        int boxWidth = padding * 3 + swatch + Math.max(metrics.stringWidth(labels[0]), metrics.stringWidth(labels[1]));
        int boxHeight = padding * 2 + lineHeight * labels.length - 6;
        int boxX = plot.right() - boxWidth - padding;
        int boxY = plot.bottom() - boxHeight - padding;

        graphics.setColor(new Color(255, 255, 255, 220));
        graphics.fillRect(boxX, boxY, boxWidth, boxHeight);
        graphics.setColor(new Color(0xCCCCCC));
        graphics.drawRect(boxX, boxY, boxWidth, boxHeight);
        for (int i = 0; i < labels.length; i++) {
            int rowY = boxY + padding + i * lineHeight;
            graphics.setColor(colors[i]);
            graphics.fillRect(boxX + padding, rowY, swatch, swatch / 2 + 4);
            graphics.setColor(TEXT_COLOR);
            graphics.drawString(labels[i], boxX + padding * 2 + swatch, rowY + metrics.getAscent() - 4);
        }
    }

    private byte[] writePng(BufferedImage image) {
        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", outputStream);
            return outputStream.toByteArray();
        } catch (IOException ex) {
            log.warn("Failed to render chart image", ex);
            return new byte[0];
        }
    }

    private record ChartRow(String name, double airbnb, double booking) {
    }

    private record PlotArea(int left, int top, int width, int height, int rowCount) {

        int right() {
            return left + width;
        }

        int bottom() {
            return top + height;
        }

        double rowHeight() {
            return rowCount == 0 ? height : (double) height / rowCount;
        }

        /** Rank 1 is drawn in the top row. */
        double rowCenter(int index) {
            return top + (index + 0.5) * rowHeight();
        }

        int xFor(double value) {
            double clamped = Math.max(0.0, Math.min(X_AXIS_MAX, value));
            return (int) Math.round(left + clamped / X_AXIS_MAX * width);
        }
    }
}
