package com.babytrack.backend.report.service;

import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.intake.model.IntakeRecord;
import com.babytrack.backend.report.chart.IntakeChartSpecs;
import com.babytrack.backend.report.chart.SeriesDef;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 量測紀錄 → 成長曲線的 X 軸日期 + 每種量測一條線。
 * 同一天量多次只取最後一次；某天沒量那種就是 null（畫成斷線）。
 */
record GrowthSeries(List<LocalDate> dates, List<SeriesDef> panels) {

    static final List<IntakeCategory> MEASUREMENTS =
            List.of(IntakeCategory.WEIGHT, IntakeCategory.HEIGHT, IntakeCategory.HEAD_CIRCUMFERENCE);

    boolean isEmpty() {
        return panels.isEmpty();
    }

    static GrowthSeries from(Map<IntakeCategory, List<IntakeRecord>> history, ZoneId zone) {
        Map<IntakeCategory, Map<LocalDate, IntakeRecord>> latestPerDay = new EnumMap<>(IntakeCategory.class);
        TreeSet<LocalDate> dates = new TreeSet<>();

        for (IntakeCategory c : MEASUREMENTS) {
            List<IntakeRecord> records = history.getOrDefault(c, List.of());
            if (records.isEmpty()) continue;

            Map<LocalDate, IntakeRecord> perDay = new HashMap<>();
            for (IntakeRecord r : records) {
                LocalDate d = r.timestamp().atZone(zone).toLocalDate();
                perDay.merge(d, r, (a, b) -> b.timestamp().isAfter(a.timestamp()) ? b : a);
            }
            latestPerDay.put(c, perDay);
            dates.addAll(perDay.keySet());
        }

        List<LocalDate> axis = List.copyOf(dates);
        List<SeriesDef> panels = new ArrayList<>();
        latestPerDay.forEach((c, perDay) -> {
            List<BigDecimal> values = new ArrayList<>(axis.size());
            for (LocalDate d : axis) {
                IntakeRecord r = perDay.get(d);
                values.add(r == null ? null : r.quantity());
            }
            panels.add(SeriesDef.line(IntakeChartSpecs.measurementLabel(c), c.unit(), values,
                    SeriesDef.Axis.PRIMARY, IntakeChartSpecs.measurementColor(c)));
        });
        return new GrowthSeries(axis, panels);
    }
}
