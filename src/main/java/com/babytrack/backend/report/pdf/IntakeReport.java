package com.babytrack.backend.report.pdf;

public record IntakeReport(ReportSpec spec, byte[] pdf, int pageCount) {}
