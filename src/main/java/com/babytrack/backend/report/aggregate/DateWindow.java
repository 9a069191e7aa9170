package com.babytrack.backend.report.aggregate;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 報表區間（含頭含尾）。
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) throw new IllegalArgumentException("DATE_RANGE_INVALID");
    }

    /** 以 today 為最後一天、往前共 days 天 */
    public static DateWindow endingOn(LocalDate today, int days) {
        if (days < 1) throw new IllegalArgumentException("WINDOW_DAYS_INVALID");
        return new DateWindow(today.minusDays(days - 1L), today);
    }

    public int days() {
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public List<LocalDate> dates() {
        List<LocalDate> out = new ArrayList<>(days());
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            out.add(d);
        }
        return out;
    }
}
