package com.babytrack.backend.report.chart;

import com.babytrack.backend.report.aggregate.DailyBucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.AWTError;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 用 Java2D 畫 PNG。
 *
 * <p>兩種模式：
 * <ol>
 *   <li>{@link #compose}：日桶圖，數量畫成堆疊長條（主軸），熱量畫成折線（次軸）</li>
 *   <li>{@link #composeLongitudinal}：成長曲線，每個 panel 一條單線，無堆疊、無雙軸</li>
 * </ol>
 * 不寫檔、不讀時鐘；輸出完全由傳入的 spec 決定。
 */
@Slf4j
@Component
public class ChartComposer {

    static final int WIDTH = 1200;
    static final int HEIGHT = 800;

    static final int PANEL_HEIGHT = 340;
    private static final int LONG_HEADER = 90;
    private static final int LONG_FOOTER = 30;

    private static final int MARGIN_LEFT = 100;
    private static final int MARGIN_RIGHT = 100;
    private static final int MARGIN_TOP = 130;
    private static final int MARGIN_BOTTOM = 100;
    private static final int Y_TICKS = 5;

    private static final DateTimeFormatter X_LABEL = DateTimeFormatter.ofPattern("MM/dd");

    private static final int[] PALETTE = {0xFF9999, 0x66B2FF, 0xD32F2F, 0x1A237E, 0x2E86AB, 0xA23B72};

    private static final Color GRID = new Color(0xE6E6E6);
    private static final Color AXIS = new Color(0x616161);
    private static final Color SECONDARY_AXIS = new Color(0xC62828);

    public byte[] compose(List<DailyBucket> buckets, ChartSpec spec) {
        validate(buckets, spec);
        try {
            return writePng(renderBuckets(buckets, spec));
        } catch (ChartRenderingException e) {
            throw e;
        } catch (RuntimeException | AWTError e) {
            throw new ChartRenderingException("CHART_RENDER_FAILED", e);
        }
    }

    public byte[] composeLongitudinal(LongitudinalSpec spec) {
        validate(spec);
        try {
            return writePng(renderLongitudinal(spec));
        } catch (ChartRenderingException e) {
            throw e;
        } catch (RuntimeException | AWTError e) {
            throw new ChartRenderingException("CHART_RENDER_FAILED", e);
        }
    }

    // ===== validation =====

    private static void validate(List<DailyBucket> buckets, ChartSpec spec) {
        if (spec == null) throw new IllegalArgumentException("CHART_SPEC_REQUIRED");
        if (buckets == null || buckets.isEmpty()) throw new IllegalArgumentException("BUCKETS_REQUIRED");
        if (spec.series().isEmpty()) throw new IllegalArgumentException("SERIES_REQUIRED");

        List<LocalDate> expected = spec.window().dates();
        List<LocalDate> actual = buckets.stream().map(DailyBucket::date).toList();
        if (!expected.equals(actual)) throw new IllegalArgumentException("BUCKETS_WINDOW_MISMATCH");

        for (SeriesDef s : spec.series()) {
            if (s.values().size() != buckets.size()) {
                throw new IllegalArgumentException("SERIES_LENGTH_MISMATCH");
            }
            if (s.renderStyle() == SeriesDef.RenderStyle.STACKED_BAR && s.axis() != SeriesDef.Axis.PRIMARY) {
                throw new IllegalArgumentException("STACKED_BAR_REQUIRES_PRIMARY_AXIS");
            }
            for (BigDecimal v : s.values()) {
                if (v == null || v.signum() < 0) throw new IllegalArgumentException("SERIES_VALUE_INVALID");
            }
        }
    }

    private static void validate(LongitudinalSpec spec) {
        if (spec == null) throw new IllegalArgumentException("CHART_SPEC_REQUIRED");
        if (spec.dates().isEmpty()) throw new IllegalArgumentException("DATES_REQUIRED");
        if (spec.panels().isEmpty()) throw new IllegalArgumentException("SERIES_REQUIRED");

        for (int i = 1; i < spec.dates().size(); i++) {
            if (!spec.dates().get(i).isAfter(spec.dates().get(i - 1))) {
                throw new IllegalArgumentException("DATES_NOT_INCREASING");
            }
        }
        for (SeriesDef s : spec.panels()) {
            if (s.renderStyle() != SeriesDef.RenderStyle.LINE || s.axis() != SeriesDef.Axis.PRIMARY) {
                throw new IllegalArgumentException("LONGITUDINAL_REQUIRES_SINGLE_LINE");
            }
            if (s.values().size() != spec.dates().size()) {
                throw new IllegalArgumentException("SERIES_LENGTH_MISMATCH");
            }
        }
    }

    // ===== bucket chart =====

    private BufferedImage renderBuckets(List<DailyBucket> buckets, ChartSpec spec) {
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            prepare(g, WIDTH, HEIGHT);

            int n = buckets.size();
            int plotX = MARGIN_LEFT;
            int plotY = MARGIN_TOP;
            int plotW = WIDTH - MARGIN_LEFT - MARGIN_RIGHT;
            int plotH = HEIGHT - MARGIN_TOP - MARGIN_BOTTOM;

            double primaryMax = niceMax(primaryPeak(spec, n));
            double secondaryMax = niceMax(secondaryPeak(spec));

            drawTitle(g, spec.title(), spec.subtitle(), WIDTH);
            drawLegend(g, spec.series(), plotX, 92);

            g.setColor(new Color(0xFAFAFA));
            g.fillRect(plotX, plotY, plotW, plotH);

            drawYAxis(g, plotX, plotY, plotW, plotH, primaryMax, false, AXIS);
            if (spec.hasSecondaryAxis()) {
                drawYAxis(g, plotX, plotY, plotW, plotH, secondaryMax, true, SECONDARY_AXIS);
            }
            drawAxisTitle(g, spec.primaryAxisLabel(), 24, plotY + plotH / 2, -Math.PI / 2, AXIS);
            if (spec.hasSecondaryAxis()) {
                drawAxisTitle(g, spec.secondaryAxisLabel(), WIDTH - 24, plotY + plotH / 2, Math.PI / 2, SECONDARY_AXIS);
            }

            double slot = (double) plotW / n;
            drawStackedBars(g, spec, n, plotX, plotY, plotH, slot, primaryMax);
            drawLines(g, spec, n, plotX, plotY, plotH, slot, primaryMax, secondaryMax);

            g.setColor(new Color(0xBDBDBD));
            g.drawRect(plotX, plotY, plotW, plotH);

            List<LocalDate> dates = buckets.stream().map(DailyBucket::date).toList();
            drawXLabels(g, dates, plotX, plotY + plotH, slot);
        } finally {
            g.dispose();
        }
        return image;
    }

    private static double primaryPeak(ChartSpec spec, int n) {
        double peak = 0;
        for (int i = 0; i < n; i++) {
            double stack = 0;
            for (SeriesDef s : spec.series()) {
                if (s.axis() != SeriesDef.Axis.PRIMARY) continue;
                double v = s.values().get(i).doubleValue();
                if (s.renderStyle() == SeriesDef.RenderStyle.STACKED_BAR) stack += v;
                else peak = Math.max(peak, v);
            }
            peak = Math.max(peak, stack);
        }
        return peak;
    }

    private static double secondaryPeak(ChartSpec spec) {
        double peak = 0;
        for (SeriesDef s : spec.series()) {
            if (s.axis() != SeriesDef.Axis.SECONDARY) continue;
            for (BigDecimal v : s.values()) peak = Math.max(peak, v.doubleValue());
        }
        return peak;
    }

    private void drawStackedBars(Graphics2D g, ChartSpec spec, int n,
                                 int plotX, int plotY, int plotH, double slot, double max) {
        int barW = Math.max(2, (int) Math.round(slot * 0.6));
        g.setFont(new Font("SansSerif", Font.BOLD, 12));
        FontMetrics fm = g.getFontMetrics();
        int baseline = plotY + plotH;

        for (int i = 0; i < n; i++) {
            int cx = (int) Math.round(plotX + slot * (i + 0.5));
            double stacked = 0;
            int idx = 0;
            for (SeriesDef s : spec.series()) {
                int color = colorOf(s, idx++);
                if (s.renderStyle() != SeriesDef.RenderStyle.STACKED_BAR) continue;

                double v = s.values().get(i).doubleValue();
                if (v <= 0) continue;

                int yBottom = baseline - (int) Math.round(stacked / max * plotH);
                stacked += v;
                int yTop = baseline - (int) Math.round(stacked / max * plotH);
                int h = Math.max(1, yBottom - yTop);

                g.setColor(new Color(color));
                g.fillRect(cx - barW / 2, yTop, barW, h);
                g.setColor(Color.WHITE);
                g.drawRect(cx - barW / 2, yTop, barW, h);

                String label = format(s.values().get(i));
                if (h >= fm.getHeight() && fm.stringWidth(label) <= barW) {
                    g.setColor(Color.BLACK);
                    g.drawString(label, cx - fm.stringWidth(label) / 2, yTop + h / 2 + fm.getAscent() / 2 - 1);
                }
            }
        }
    }

    private void drawLines(Graphics2D g, ChartSpec spec, int n, int plotX, int plotY, int plotH,
                           double slot, double primaryMax, double secondaryMax) {
        int idx = 0;
        int lineNo = 0;
        for (SeriesDef s : spec.series()) {
            int color = colorOf(s, idx++);
            if (s.renderStyle() != SeriesDef.RenderStyle.LINE) continue;

            double max = (s.axis() == SeriesDef.Axis.SECONDARY) ? secondaryMax : primaryMax;
            int[] xs = new int[n];
            int[] ys = new int[n];
            for (int i = 0; i < n; i++) {
                xs[i] = (int) Math.round(plotX + slot * (i + 0.5));
                ys[i] = plotY + plotH - (int) Math.round(s.values().get(i).doubleValue() / max * plotH);
            }

            g.setColor(new Color(color));
            g.setStroke(new BasicStroke(2.5f));
            if (n > 1) g.drawPolyline(xs, ys, n);
            g.setStroke(new BasicStroke(1f));
            for (int i = 0; i < n; i++) {
                drawMarker(g, xs[i], ys[i], lineNo);
            }
            lineNo++;
        }
    }

    // ===== longitudinal chart =====

    private BufferedImage renderLongitudinal(LongitudinalSpec spec) {
        int height = LONG_HEADER + spec.panels().size() * PANEL_HEIGHT + LONG_FOOTER;
        BufferedImage image = new BufferedImage(WIDTH, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            prepare(g, WIDTH, height);
            drawTitle(g, spec.title(), spec.subtitle(), WIDTH);

            int top = LONG_HEADER;
            int idx = 0;
            for (SeriesDef panel : spec.panels()) {
                drawPanel(g, spec.dates(), panel, top, colorOf(panel, idx + 4));
                top += PANEL_HEIGHT;
                idx++;
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private void drawPanel(Graphics2D g, List<LocalDate> dates, SeriesDef panel, int top, int color) {
        int plotX = MARGIN_LEFT;
        int plotY = top + 36;
        int plotW = WIDTH - MARGIN_LEFT - MARGIN_RIGHT;
        int plotH = PANEL_HEIGHT - 36 - 80;

        g.setFont(new Font("SansSerif", Font.BOLD, 16));
        g.setColor(Color.BLACK);
        String heading = (panel.unit() == null || panel.unit().isBlank())
                ? panel.label()
                : panel.label() + " (" + panel.unit() + ")";
        g.drawString(heading, plotX, top + 24);

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (BigDecimal v : panel.values()) {
            if (v == null) continue;
            min = Math.min(min, v.doubleValue());
            max = Math.max(max, v.doubleValue());
        }

        g.setColor(new Color(0xFAFAFA));
        g.fillRect(plotX, plotY, plotW, plotH);
        g.setColor(new Color(0xBDBDBD));
        g.drawRect(plotX, plotY, plotW, plotH);

        int n = dates.size();
        double slot = (double) plotW / n;
        drawXLabels(g, dates, plotX, plotY + plotH, slot);

        if (min == Double.MAX_VALUE) {
            g.setFont(new Font("SansSerif", Font.ITALIC, 14));
            g.setColor(AXIS);
            g.drawString("No measurements", plotX + plotW / 2 - 50, plotY + plotH / 2);
            return;
        }

        // 上下留 10% 空間；只有單一值時給 ±1
        double pad = (max - min) * 0.1;
        if (pad == 0) pad = 1;
        double lo = Math.max(0, min - pad);
        double hi = max + pad;

        g.setFont(new Font("SansSerif", Font.PLAIN, 12));
        FontMetrics fm = g.getFontMetrics();
        for (int t = 0; t <= Y_TICKS; t++) {
            double value = lo + (hi - lo) * t / Y_TICKS;
            int y = plotY + plotH - (int) Math.round((value - lo) / (hi - lo) * plotH);
            g.setColor(GRID);
            g.drawLine(plotX, y, plotX + plotW, y);
            String label = format(BigDecimal.valueOf(value));
            g.setColor(AXIS);
            g.drawString(label, plotX - 8 - fm.stringWidth(label), y + fm.getAscent() / 2);
        }

        // null = 該日沒量 → 斷線
        g.setColor(new Color(color));
        Integer prevX = null;
        Integer prevY = null;
        for (int i = 0; i < n; i++) {
            BigDecimal v = panel.values().get(i);
            if (v == null) {
                prevX = null;
                prevY = null;
                continue;
            }
            int x = (int) Math.round(plotX + slot * (i + 0.5));
            int y = plotY + plotH - (int) Math.round((v.doubleValue() - lo) / (hi - lo) * plotH);
            if (prevX != null) {
                g.setStroke(new BasicStroke(2.5f));
                g.drawLine(prevX, prevY, x, y);
                g.setStroke(new BasicStroke(1f));
            }
            drawMarker(g, x, y, 0);
            prevX = x;
            prevY = y;
        }
    }

    // ===== shared pieces =====

    private static void prepare(Graphics2D g, int width, int height) {
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, width, height);
    }

    private static void drawTitle(Graphics2D g, String title, String subtitle, int width) {
        g.setColor(Color.BLACK);
        g.setFont(new Font("SansSerif", Font.BOLD, 22));
        FontMetrics fm = g.getFontMetrics();
        String t = (title == null) ? "" : title;
        g.drawString(t, (width - fm.stringWidth(t)) / 2, 36);

        if (subtitle != null && !subtitle.isBlank()) {
            g.setFont(new Font("SansSerif", Font.PLAIN, 15));
            fm = g.getFontMetrics();
            g.setColor(AXIS);
            g.drawString(subtitle, (width - fm.stringWidth(subtitle)) / 2, 62);
        }
    }

    private static void drawLegend(Graphics2D g, List<SeriesDef> series, int x, int y) {
        g.setFont(new Font("SansSerif", Font.PLAIN, 13));
        FontMetrics fm = g.getFontMetrics();
        int cursor = x;
        int idx = 0;
        int lineNo = 0;
        for (SeriesDef s : series) {
            g.setColor(new Color(colorOf(s, idx++)));
            if (s.renderStyle() == SeriesDef.RenderStyle.STACKED_BAR) {
                g.fillRect(cursor, y - 10, 14, 14);
            } else {
                g.setStroke(new BasicStroke(2.5f));
                g.drawLine(cursor - 2, y - 3, cursor + 16, y - 3);
                g.setStroke(new BasicStroke(1f));
                drawMarker(g, cursor + 7, y - 3, lineNo++);
            }
            g.setColor(Color.BLACK);
            g.drawString(s.label(), cursor + 22, y + 2);
            cursor += 22 + fm.stringWidth(s.label()) + 28;
        }
    }

    private static void drawYAxis(Graphics2D g, int plotX, int plotY, int plotW, int plotH,
                                  double max, boolean right, Color color) {
        g.setFont(new Font("SansSerif", Font.PLAIN, 12));
        FontMetrics fm = g.getFontMetrics();
        for (int t = 0; t <= Y_TICKS; t++) {
            double value = max * t / Y_TICKS;
            int y = plotY + plotH - (int) Math.round((double) plotH * t / Y_TICKS);
            if (!right) {
                g.setColor(GRID);
                g.drawLine(plotX, y, plotX + plotW, y);
            }
            String label = format(BigDecimal.valueOf(value));
            g.setColor(color);
            if (right) {
                g.drawString(label, plotX + plotW + 8, y + fm.getAscent() / 2);
            } else {
                g.drawString(label, plotX - 8 - fm.stringWidth(label), y + fm.getAscent() / 2);
            }
        }
    }

    private static void drawAxisTitle(Graphics2D g, String text, int x, int y, double theta, Color color) {
        if (text == null || text.isBlank()) return;
        g.setFont(new Font("SansSerif", Font.PLAIN, 14));
        FontMetrics fm = g.getFontMetrics();
        AffineTransform saved = g.getTransform();
        g.translate(x, y);
        g.rotate(theta);
        g.setColor(color);
        g.drawString(text, -fm.stringWidth(text) / 2, 0);
        g.setTransform(saved);
    }

    /** 每一天都標日期；放不下就斜 45 度 */
    private static void drawXLabels(Graphics2D g, List<LocalDate> dates, int plotX, int axisY, double slot) {
        g.setFont(new Font("SansSerif", Font.PLAIN, 12));
        FontMetrics fm = g.getFontMetrics();
        g.setColor(AXIS);

        List<String> labels = new ArrayList<>(dates.size());
        int widest = 0;
        for (LocalDate d : dates) {
            String s = d.format(X_LABEL);
            labels.add(s);
            widest = Math.max(widest, fm.stringWidth(s));
        }
        boolean rotate = widest + 6 > slot;

        for (int i = 0; i < labels.size(); i++) {
            int cx = (int) Math.round(plotX + slot * (i + 0.5));
            g.drawLine(cx, axisY, cx, axisY + 4);
            String s = labels.get(i);
            if (!rotate) {
                g.drawString(s, cx - fm.stringWidth(s) / 2, axisY + 20);
            } else {
                AffineTransform saved = g.getTransform();
                g.translate(cx, axisY + 10);
                g.rotate(-Math.PI / 4);
                g.drawString(s, -fm.stringWidth(s), fm.getAscent() / 2);
                g.setTransform(saved);
            }
        }
    }

    private static void drawMarker(Graphics2D g, int x, int y, int lineNo) {
        if (lineNo % 2 == 0) {
            g.fillOval(x - 5, y - 5, 10, 10);
        } else {
            g.fillRect(x - 5, y - 5, 10, 10);
        }
    }

    private static int colorOf(SeriesDef s, int index) {
        return (s.rgb() != null) ? s.rgb() : PALETTE[Math.floorMod(index, PALETTE.length)];
    }

    /** 取一個好看的上限（1/2/5 × 10^k），全 0 時回 1 避免除以 0 */
    static double niceMax(double peak) {
        if (peak <= 0) return 1;
        double exp = Math.pow(10, Math.floor(Math.log10(peak)));
        double f = peak / exp;
        double nice;
        if (f <= 1) nice = 1;
        else if (f <= 2) nice = 2;
        else if (f <= 5) nice = 5;
        else nice = 10;
        return nice * exp;
    }

    private static String format(BigDecimal v) {
        BigDecimal r = v.setScale(1, RoundingMode.HALF_UP).stripTrailingZeros();
        if (r.scale() < 0) r = r.setScale(0);
        return r.toPlainString();
    }

    private static byte[] writePng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", out)) {
                throw new ChartRenderingException("PNG_WRITER_UNAVAILABLE");
            }
            return out.toByteArray();
        } catch (IOException e) {
            log.warn("write png failed", e);
            throw new ChartRenderingException("PNG_WRITE_FAILED", e);
        }
    }
}
