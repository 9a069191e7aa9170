package com.babytrack.backend.report.chart;

import java.time.LocalDate;
import java.util.List;

/**
 * 成長曲線：每個 panel 一條單線（體重 / 身長 / 頭圍），X 軸為實際量測日期。
 */
public record LongitudinalSpec(
        String title,
        String subtitle,
        List<LocalDate> dates,
        List<SeriesDef> panels
) {

    public LongitudinalSpec {
        dates = (dates == null) ? List.of() : List.copyOf(dates);
        panels = (panels == null) ? List.of() : List.copyOf(panels);
    }
}
