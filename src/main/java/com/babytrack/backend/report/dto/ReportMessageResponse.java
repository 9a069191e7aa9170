package com.babytrack.backend.report.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 沒有檔案可回時的 JSON（資料不足 / 需要升級）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportMessageResponse(
        String code,          // INSUFFICIENT_DATA / UPGRADE_REQUIRED
        String message,
        String artifactUrl,
        String clientAction   // SHOW_PAYWALL
) {}
