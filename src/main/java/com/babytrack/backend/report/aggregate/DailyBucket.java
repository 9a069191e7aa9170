package com.babytrack.backend.report.aggregate;

import com.babytrack.backend.intake.model.IntakeCategory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 單日彙總。所有 category 都有值（沒資料就是 0），下游圖表/表格靠位置對齊。
 */
public record DailyBucket(
        LocalDate date,
        Map<IntakeCategory, BigDecimal> totals,
        Map<IntakeCategory, BigDecimal> calorieTotals
) {

    public DailyBucket {
        totals = freeze(totals);
        calorieTotals = freeze(calorieTotals);
    }

    public static DailyBucket empty(LocalDate date) {
        return new DailyBucket(date, Map.of(), Map.of());
    }

    public BigDecimal quantity(IntakeCategory category) {
        return totals.get(category);
    }

    public BigDecimal calories(IntakeCategory category) {
        return calorieTotals.get(category);
    }

    public boolean isZero() {
        return totals.values().stream().allMatch(v -> v.signum() == 0)
                && calorieTotals.values().stream().allMatch(v -> v.signum() == 0);
    }

    private static Map<IntakeCategory, BigDecimal> freeze(Map<IntakeCategory, BigDecimal> in) {
        EnumMap<IntakeCategory, BigDecimal> m = new EnumMap<>(IntakeCategory.class);
        for (IntakeCategory c : IntakeCategory.values()) {
            BigDecimal v = (in == null) ? null : in.get(c);
            m.put(c, v == null ? BigDecimal.ZERO : v);
        }
        return Collections.unmodifiableMap(m);
    }
}
