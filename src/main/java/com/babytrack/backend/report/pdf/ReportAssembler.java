package com.babytrack.backend.report.pdf;

import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.report.aggregate.DailyBucket;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 圖 + 明細表 → A4 直式 PDF。
 *
 * <p>版面規則：
 * <ul>
 *   <li>第 1 頁：抬頭、圖、表格開頭</li>
 *   <li>表格跨頁時每頁重畫欄位列，單列不切開</li>
 *   <li>TOTAL / AVERAGE 兩列一定在同一頁</li>
 *   <li>最後一頁附註解</li>
 * </ul>
 */
@Slf4j
@Component
public class ReportAssembler {

    public static final List<IntakeCategory> DEFAULT_CATEGORIES = List.of(IntakeCategory.MPASI, IntakeCategory.MILK);

    static final List<String> NOTES = List.of(
            "MPASI = Makanan Pendamping ASI (complementary food alongside breast milk).",
            "Milk calories use the configured kcal/ml for breast milk and formula.",
            "Averages are computed over every day of the period, including days without records.",
            "Consult your pediatrician for personalised nutrition advice."
    );

    private static final float MARGIN = 40f;
    private static final float ROW_H = 18f;
    private static final float MAX_CHART_H = 330f;
    private static final float FONT_TITLE = 18f;
    private static final float FONT_BODY = 11f;
    private static final float FONT_TABLE = 9f;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter GENERATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm xxx");


    public IntakeReport assemble(byte[] chartPng, List<DailyBucket> buckets, ReportHeader header) {
        return assemble(chartPng, buckets, header, DEFAULT_CATEGORIES);
    }

    public IntakeReport assemble(byte[] chartPng, List<DailyBucket> buckets, ReportHeader header,
                                 List<IntakeCategory> categories) {
        if (chartPng == null || chartPng.length == 0) throw new IllegalArgumentException("CHART_REQUIRED");
        if (buckets == null || buckets.isEmpty()) throw new IllegalArgumentException("BUCKETS_REQUIRED");
        if (header == null) throw new IllegalArgumentException("REPORT_HEADER_REQUIRED");
        if (categories == null || categories.isEmpty()) throw new IllegalArgumentException("REPORT_CATEGORIES_REQUIRED");

        ReportSpec spec = buildSpec(chartPng, buckets, header, categories);
        try {
            return render(spec);
        } catch (ReportRenderingException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("report render failed: subject={} window={}~{}",
                    header.subjectName(), header.window().start(), header.window().end(), e);
            throw new ReportRenderingException("REPORT_RENDER_FAILED", e);
        }
    }

    // ===== table content =====

    static ReportSpec buildSpec(byte[] chartPng, List<DailyBucket> buckets, ReportHeader header,
                                List<IntakeCategory> categories) {
        List<ReportRow> rows = new ArrayList<>(buckets.size());
        Map<IntakeCategory, BigDecimal> qtySum = new EnumMap<>(IntakeCategory.class);
        Map<IntakeCategory, BigDecimal> calSum = new EnumMap<>(IntakeCategory.class);
        BigDecimal totalCal = BigDecimal.ZERO;

        for (DailyBucket b : buckets) {
            Map<IntakeCategory, BigDecimal> qty = new EnumMap<>(IntakeCategory.class);
            Map<IntakeCategory, BigDecimal> cal = new EnumMap<>(IntakeCategory.class);
            BigDecimal dayCal = BigDecimal.ZERO;
            for (IntakeCategory c : categories) {
                qty.put(c, b.quantity(c));
                cal.put(c, b.calories(c));
                dayCal = dayCal.add(b.calories(c));
                qtySum.merge(c, b.quantity(c), BigDecimal::add);
                calSum.merge(c, b.calories(c), BigDecimal::add);
            }
            totalCal = totalCal.add(dayCal);
            rows.add(new ReportRow(b.date().format(DATE), qty, cal, dayCal));
        }

        // 平均 = 總和 / 區間天數（沒紀錄的日子也算進分母）
        BigDecimal days = BigDecimal.valueOf(buckets.size());
        Map<IntakeCategory, BigDecimal> qtyAvg = new EnumMap<>(IntakeCategory.class);
        Map<IntakeCategory, BigDecimal> calAvg = new EnumMap<>(IntakeCategory.class);
        for (IntakeCategory c : categories) {
            qtyAvg.put(c, qtySum.get(c).divide(days, 2, RoundingMode.HALF_UP));
            calAvg.put(c, calSum.get(c).divide(days, 2, RoundingMode.HALF_UP));
        }

        ReportRow total = new ReportRow("TOTAL", qtySum, calSum, totalCal);
        ReportRow average = new ReportRow("AVERAGE", qtyAvg, calAvg, totalCal.divide(days, 2, RoundingMode.HALF_UP));
        return new ReportSpec(chartPng, header, categories, rows, total, average);
    }

    // ===== layout =====

    private IntakeReport render(ReportSpec spec) throws IOException {
        BufferedImage chart = ImageIO.read(new ByteArrayInputStream(spec.chartPng()));
        if (chart == null) throw new ReportRenderingException("CHART_IMAGE_UNREADABLE");

        try (PDDocument doc = new PDDocument()) {
            Pages pages = new Pages(doc);
            try {
                float y = drawHeader(pages, spec.header());

                PDImageXObject image = LosslessFactory.createFromImage(doc, chart);
                float w = pages.contentWidth();
                float h = w * chart.getHeight() / chart.getWidth();
                if (h > MAX_CHART_H) {
                    w = w * MAX_CHART_H / h;
                    h = MAX_CHART_H;
                }
                y -= h;
                pages.cs().drawImage(image, MARGIN + (pages.contentWidth() - w) / 2, y, w, h);
                y -= 20;

                List<String> columns = columns(spec.categories());
                float colW = pages.contentWidth() / columns.size();

                // 欄位列 + 至少一列要塞得下，否則直接換頁
                if (y - 2 * ROW_H < MARGIN) y = pages.next();
                y = drawColumnHeader(pages, columns, colW, y);

                for (ReportRow row : spec.tableRows()) {
                    if (y - ROW_H < MARGIN) {
                        y = pages.next();
                        y = drawColumnHeader(pages, columns, colW, y);
                    }
                    y = drawRow(pages, cells(row, spec.categories()), colW, y, false);
                }

                if (y - 2 * ROW_H < MARGIN) {
                    y = pages.next();
                    y = drawColumnHeader(pages, columns, colW, y);
                }
                y = drawRow(pages, cells(spec.totalRow(), spec.categories()), colW, y, true);
                y = drawRow(pages, cells(spec.averageRow(), spec.categories()), colW, y, true);

                drawNotes(pages, y - 24);
            } finally {
                pages.close();
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return new IntakeReport(spec, out.toByteArray(), doc.getNumberOfPages());
        }
    }

    private float drawHeader(Pages pages, ReportHeader header) throws IOException {
        float y = pages.top() - FONT_TITLE;
        String title = sanitize(header.title());
        float titleW = pages.bold().getStringWidth(title) / 1000f * FONT_TITLE;
        text(pages.cs(), pages.bold(), FONT_TITLE, MARGIN + (pages.contentWidth() - titleW) / 2, y, title);

        y -= 28;
        text(pages.cs(), pages.regular(), FONT_BODY, MARGIN, y, "User: " + sanitize(header.subjectName()));
        y -= 15;
        text(pages.cs(), pages.regular(), FONT_BODY, MARGIN, y,
                "Period: " + header.window().start().format(DATE) + " to " + header.window().end().format(DATE)
                        + " (" + header.window().days() + " days)");
        y -= 15;
        text(pages.cs(), pages.regular(), FONT_BODY, MARGIN, y, "Generated: " + header.generatedAt().format(GENERATED));
        return y - 14;
    }

    private float drawColumnHeader(Pages pages, List<String> columns, float colW, float y) throws IOException {
        PDPageContentStream cs = pages.cs();
        cs.setNonStrokingColor(0.24f, 0.35f, 0.55f);
        cs.addRect(MARGIN, y - ROW_H, colW * columns.size(), ROW_H);
        cs.fill();
        cs.setNonStrokingColor(1f, 1f, 1f);
        for (int i = 0; i < columns.size(); i++) {
            centered(cs, pages.bold(), columns.get(i), MARGIN + colW * i, colW, y - ROW_H + 5.5f);
        }
        cs.setNonStrokingColor(0f, 0f, 0f);
        return y - ROW_H;
    }

    private float drawRow(Pages pages, List<String> cells, float colW, float y, boolean emphasis) throws IOException {
        PDPageContentStream cs = pages.cs();
        float width = colW * cells.size();
        if (emphasis) {
            cs.setNonStrokingColor(0.92f, 0.92f, 0.92f);
            cs.addRect(MARGIN, y - ROW_H, width, ROW_H);
            cs.fill();
            cs.setNonStrokingColor(0f, 0f, 0f);
        }
        cs.setStrokingColor(0.75f, 0.75f, 0.75f);
        cs.setLineWidth(0.5f);
        cs.moveTo(MARGIN, y - ROW_H);
        cs.lineTo(MARGIN + width, y - ROW_H);
        cs.stroke();

        PDType1Font font = emphasis ? pages.bold() : pages.regular();
        for (int i = 0; i < cells.size(); i++) {
            centered(cs, font, cells.get(i), MARGIN + colW * i, colW, y - ROW_H + 5.5f);
        }
        return y - ROW_H;
    }

    private void drawNotes(Pages pages, float y) throws IOException {
        float needed = 18 + NOTES.size() * 14f;
        if (y - needed < MARGIN) y = pages.next() - 10;

        text(pages.cs(), pages.bold(), FONT_BODY, MARGIN, y, "Notes");
        y -= 16;
        for (String note : NOTES) {
            text(pages.cs(), pages.regular(), FONT_TABLE + 0.5f, MARGIN, y, "- " + note);
            y -= 14;
        }
    }

    private static List<String> columns(List<IntakeCategory> categories) {
        List<String> out = new ArrayList<>();
        out.add("Date");
        for (IntakeCategory c : categories) {
            out.add(displayName(c) + " (" + c.unit() + ")");
            out.add(displayName(c) + " Cal");
        }
        out.add("Total Cal");
        return out;
    }

    private static List<String> cells(ReportRow row, List<IntakeCategory> categories) {
        List<String> out = new ArrayList<>();
        out.add(row.label());
        for (IntakeCategory c : categories) {
            out.add(oneDecimal(row.quantity(c)));
            out.add(oneDecimal(row.calorie(c)));
        }
        out.add(oneDecimal(row.totalCalories()));
        return out;
    }

    static String displayName(IntakeCategory c) {
        if (c == IntakeCategory.MPASI) return "MPASI";
        String code = c.code().replace('_', ' ');
        return Character.toUpperCase(code.charAt(0)) + code.substring(1);
    }

    static String oneDecimal(BigDecimal v) {
        return v.setScale(1, RoundingMode.HALF_UP).toPlainString();
    }

    /** Helvetica 走 WinAnsi，編碼不到的字元換成 '?'，不然 showText 會直接丟例外 */
    static String sanitize(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch >= 0x20 && ch <= 0x7E) sb.append(ch);
            else if (ch == 0xA0 || ch == '\t') sb.append(' ');
            else if (ch >= 0xA1 && ch <= 0xFF && ch != 0xAD) sb.append(ch);
            else sb.append('?');
        }
        return sb.toString();
    }

    private static void text(PDPageContentStream cs, PDType1Font font, float size, float x, float y, String s)
            throws IOException {
        cs.beginText();
        cs.setFont(font, size);
        cs.newLineAtOffset(x, y);
        cs.showText(sanitize(s));
        cs.endText();
    }

    private static void centered(PDPageContentStream cs, PDType1Font font, String s, float x, float w, float y)
            throws IOException {
        String safe = sanitize(s);
        float tw = font.getStringWidth(safe) / 1000f * FONT_TABLE;
        text(cs, font, FONT_TABLE, x + Math.max(0, (w - tw) / 2), y, safe);
    }

    /**
     * 目前頁面的 content stream；換頁時先關掉舊的。
     * 字型每份文件各自建立（PDType1Font 內部有不同步的 width cache，不能跨 thread 共用）。
     */
    private static final class Pages {
        private final PDDocument doc;
        private final PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        private final PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        private PDPage page;
        private PDPageContentStream cs;

        Pages(PDDocument doc) throws IOException {
            this.doc = doc;
            next();
        }

        PDType1Font regular() {
            return regular;
        }

        PDType1Font bold() {
            return bold;
        }

        float next() throws IOException {
            close();
            page = new PDPage(PDRectangle.A4);
            doc.addPage(page);
            cs = new PDPageContentStream(doc, page);
            return top();
        }

        PDPageContentStream cs() {
            return cs;
        }

        float top() {
            return page.getMediaBox().getHeight() - MARGIN;
        }

        float contentWidth() {
            return page.getMediaBox().getWidth() - 2 * MARGIN;
        }

        void close() throws IOException {
            if (cs != null) {
                cs.close();
                cs = null;
            }
        }
    }
}
