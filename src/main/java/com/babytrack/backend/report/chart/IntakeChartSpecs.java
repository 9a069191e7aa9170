package com.babytrack.backend.report.chart;

import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.report.aggregate.DailyBucket;
import com.babytrack.backend.report.aggregate.DateWindow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 固定的圖表樣式：MPASI / 奶量堆疊長條 + 兩條熱量折線（次軸）。
 */
public final class IntakeChartSpecs {

    public static final int MPASI_RGB = 0xFF9999;
    public static final int MILK_RGB = 0x66B2FF;
    public static final int MPASI_KCAL_RGB = 0xD32F2F;
    public static final int MILK_KCAL_RGB = 0x1A237E;

    public static final int WEIGHT_RGB = 0x2E86AB;
    public static final int HEIGHT_RGB = 0xA23B72;
    public static final int HEAD_RGB = 0xF18F01;

    private static final DateTimeFormatter RANGE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private IntakeChartSpecs() {}

    public static ChartSpec intake(String subjectName, DateWindow window, List<DailyBucket> buckets) {
        List<SeriesDef> series = List.of(
                SeriesDef.bar("MPASI (g)", "g", quantities(buckets, IntakeCategory.MPASI), MPASI_RGB),
                SeriesDef.bar("Milk (ml)", "ml", quantities(buckets, IntakeCategory.MILK), MILK_RGB),
                SeriesDef.line("MPASI kcal", "kcal", calories(buckets, IntakeCategory.MPASI),
                        SeriesDef.Axis.SECONDARY, MPASI_KCAL_RGB),
                SeriesDef.line("Milk kcal", "kcal", calories(buckets, IntakeCategory.MILK),
                        SeriesDef.Axis.SECONDARY, MILK_KCAL_RGB)
        );
        return new ChartSpec(
                "Daily MPASI & Milk Intake",
                subtitle(subjectName, window.start(), window.end()),
                series,
                window,
                "Amount (g / ml)",
                "Calories (kcal)"
        );
    }

    public static String subtitle(String subjectName, LocalDate from, LocalDate to) {
        String range = from.format(RANGE) + " ~ " + to.format(RANGE);
        return (subjectName == null || subjectName.isBlank()) ? range : subjectName + " | " + range;
    }

    public static int measurementColor(IntakeCategory category) {
        return switch (category) {
            case WEIGHT -> WEIGHT_RGB;
            case HEIGHT -> HEIGHT_RGB;
            default -> HEAD_RGB;
        };
    }

    public static String measurementLabel(IntakeCategory category) {
        return switch (category) {
            case WEIGHT -> "Weight";
            case HEIGHT -> "Height";
            case HEAD_CIRCUMFERENCE -> "Head circumference";
            default -> category.code();
        };
    }

    private static List<BigDecimal> quantities(List<DailyBucket> buckets, IntakeCategory c) {
        return buckets.stream().map(b -> b.quantity(c)).toList();
    }

    private static List<BigDecimal> calories(List<DailyBucket> buckets, IntakeCategory c) {
        return buckets.stream().map(b -> b.calories(c)).toList();
    }
}
