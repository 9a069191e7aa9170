package com.babytrack.backend.report.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportErrorResponse(
        String errorCode,
        String message,
        String requestId
) {
    /** 同一個值也用 code 輸出，跟 ReportMessageResponse 對齊 */
    @JsonProperty("code")
    public String code() {
        return errorCode;
    }
}
