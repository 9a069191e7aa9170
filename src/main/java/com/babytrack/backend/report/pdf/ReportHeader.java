package com.babytrack.backend.report.pdf;

import com.babytrack.backend.report.aggregate.DateWindow;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * 報表抬頭。generatedAt 由呼叫端帶入，assembler 不讀時鐘。
 */
public record ReportHeader(
        String title,
        String subjectName,
        DateWindow window,
        ZonedDateTime generatedAt
) {

    public ReportHeader {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(generatedAt, "generatedAt");
        if (title == null || title.isBlank()) title = "MPASI & Milk Intake Report";
        if (subjectName == null || subjectName.isBlank()) subjectName = "-";
    }
}
