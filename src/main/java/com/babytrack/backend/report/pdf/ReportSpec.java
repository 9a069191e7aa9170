package com.babytrack.backend.report.pdf;

import com.babytrack.backend.intake.model.IntakeCategory;

import java.util.List;

/**
 * PDF 的內容描述（不含版面）。averageRow 保留 2 位小數 HALF_UP，PDF 上只印 1 位。
 */
public record ReportSpec(
        byte[] chartPng,
        ReportHeader header,
        List<IntakeCategory> categories,
        List<ReportRow> tableRows,
        ReportRow totalRow,
        ReportRow averageRow
) {

    public ReportSpec {
        categories = List.copyOf(categories);
        tableRows = List.copyOf(tableRows);
    }
}
