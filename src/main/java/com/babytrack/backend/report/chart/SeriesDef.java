package com.babytrack.backend.report.chart;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一條資料序列。values 與 X 軸日期逐一對齊。
 *
 * @param rgb 0xRRGGBB；null 則用預設色盤
 */
public record SeriesDef(
        String label,
        String unit,
        List<BigDecimal> values,
        RenderStyle renderStyle,
        Axis axis,
        Integer rgb
) {

    public enum RenderStyle { STACKED_BAR, LINE }

    public enum Axis { PRIMARY, SECONDARY }

    public SeriesDef {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(renderStyle, "renderStyle");
        Objects.requireNonNull(axis, "axis");
        // 長期量測允許 null（該日沒量），所以不用 List.copyOf
        values = (values == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static SeriesDef bar(String label, String unit, List<BigDecimal> values, int rgb) {
        return new SeriesDef(label, unit, values, RenderStyle.STACKED_BAR, Axis.PRIMARY, rgb);
    }

    public static SeriesDef line(String label, String unit, List<BigDecimal> values, Axis axis, int rgb) {
        return new SeriesDef(label, unit, values, RenderStyle.LINE, axis, rgb);
    }
}
