package com.babytrack.backend.report.chart;

import com.babytrack.backend.report.aggregate.DateWindow;

import java.util.List;
import java.util.Objects;

/**
 * 日桶圖（堆疊長條 + 次軸折線）的完整描述；composer 只看這個，不讀時鐘也不讀全域狀態。
 */
public record ChartSpec(
        String title,
        String subtitle,
        List<SeriesDef> series,
        DateWindow window,
        String primaryAxisLabel,
        String secondaryAxisLabel
) {

    public ChartSpec {
        Objects.requireNonNull(window, "window");
        series = (series == null) ? List.of() : List.copyOf(series);
    }

    public boolean hasSecondaryAxis() {
        return series.stream().anyMatch(s -> s.axis() == SeriesDef.Axis.SECONDARY);
    }
}
