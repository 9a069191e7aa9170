package com.babytrack.backend.report.export;

/**
 * 匯出檔種類。檔名固定為 {@code {code}_{identity}.{extension}}，同一個 identity 新檔覆蓋舊檔。
 */
public enum ArtifactKind {
    INTAKE_CHART("intake_chart", "png", "image/png"),
    INTAKE_REPORT("intake_report", "pdf", "application/pdf"),
    GROWTH_CHART("growth_chart", "png", "image/png");

    private final String code;
    private final String extension;
    private final String contentType;

    ArtifactKind(String code, String extension, String contentType) {
        this.code = code;
        this.extension = extension;
        this.contentType = contentType;
    }

    public String code() { return code; }

    public String extension() { return extension; }

    public String contentType() { return contentType; }

    public String fileName(String identity) {
        return code + "_" + identity + "." + extension;
    }
}
