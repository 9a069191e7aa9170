package com.babytrack.backend.report.service;

import com.babytrack.backend.report.export.ArtifactReference;

/**
 * pipeline 的結果。DENIED / FAILED 不是例外，是給使用者看的訊息。
 *
 * <ul>
 *   <li>RENDERED：bytes + contentType + 已匯出的 reference</li>
 *   <li>NO_DATA：全部為 0（或沒有量測），message + reference（成長曲線沒資料時 reference 為 null）</li>
 *   <li>DENIED：升級提示</li>
 *   <li>FAILED：道歉訊息</li>
 * </ul>
 */
public record ReportOutcome(
        Kind kind,
        byte[] bytes,
        String contentType,
        ArtifactReference reference,
        String message
) {

    public enum Kind { RENDERED, NO_DATA, DENIED, FAILED }

    public static ReportOutcome rendered(byte[] bytes, String contentType, ArtifactReference ref) {
        return new ReportOutcome(Kind.RENDERED, bytes, contentType, ref, null);
    }

    public static ReportOutcome noData(String message, ArtifactReference ref) {
        return new ReportOutcome(Kind.NO_DATA, null, null, ref, message);
    }

    public static ReportOutcome denied(String message) {
        return new ReportOutcome(Kind.DENIED, null, null, null, message);
    }

    public static ReportOutcome failed(String message) {
        return new ReportOutcome(Kind.FAILED, null, null, null, message);
    }
}
