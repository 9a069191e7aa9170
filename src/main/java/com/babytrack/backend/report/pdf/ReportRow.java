package com.babytrack.backend.report.pdf;

import com.babytrack.backend.intake.model.IntakeCategory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 表格的一列。label 是日期（yyyy-MM-dd）或 TOTAL / AVERAGE。
 */
public record ReportRow(
        String label,
        Map<IntakeCategory, BigDecimal> quantities,
        Map<IntakeCategory, BigDecimal> calories,
        BigDecimal totalCalories
) {

    public ReportRow {
        quantities = freeze(quantities);
        calories = freeze(calories);
        if (totalCalories == null) totalCalories = BigDecimal.ZERO;
    }

    public BigDecimal quantity(IntakeCategory c) {
        return quantities.getOrDefault(c, BigDecimal.ZERO);
    }

    public BigDecimal calorie(IntakeCategory c) {
        return calories.getOrDefault(c, BigDecimal.ZERO);
    }

    private static Map<IntakeCategory, BigDecimal> freeze(Map<IntakeCategory, BigDecimal> in) {
        if (in == null || in.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new EnumMap<>(in));
    }
}
