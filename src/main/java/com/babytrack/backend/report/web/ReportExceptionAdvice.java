package com.babytrack.backend.report.web;

import com.babytrack.backend.common.web.RequestIdFilter;
import com.babytrack.backend.intake.controller.IntakeLogController;
import com.babytrack.backend.intake.controller.SubjectSettingsController;
import com.babytrack.backend.intake.web.IntakeValidationException;
import com.babytrack.backend.report.controller.ReportController;
import com.babytrack.backend.report.dto.ReportErrorResponse;
import com.babytrack.backend.report.export.ArtifactExportException;
import com.babytrack.backend.report.service.ReportMessages;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.DateTimeException;

/**
 * 報表 / 紀錄 API 的錯誤格式：{errorCode, code, message, requestId}。
 * IllegalArgumentException 的 message 就是錯誤碼。
 */
@Slf4j
@RestControllerAdvice(assignableTypes = {
        ReportController.class,
        IntakeLogController.class,
        SubjectSettingsController.class
})
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ReportExceptionAdvice {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ReportErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        return ResponseEntity.badRequest().body(err(code, e, req));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ReportErrorResponse> handleIllegalState(IllegalStateException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "ILLEGAL_STATE");
        log.error("illegal state: code={} rid={}", code, rid(req), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(err(code, e, req));
    }

    @ExceptionHandler(ArtifactExportException.class)
    public ResponseEntity<ReportErrorResponse> handleExport(ArtifactExportException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ReportErrorResponse("EXPORT_FAILED",
                        "The file could not be saved. Please try again later.", rid(req)));
    }

    /** 渲染 queue 滿了：跟渲染失敗一樣回 503 道歉訊息 */
    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ReportErrorResponse> handleRejected(TaskRejectedException e, HttpServletRequest req) {
        log.warn("render queue full, rejected: rid={} err={}", rid(req), e.toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ReportErrorResponse("RENDERING_FAILED", ReportMessages.RENDER_FAILED, rid(req)));
    }

    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ReportErrorResponse> handleSecurity(SecurityException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("INVALID_ARTIFACT_NAME", e, req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ReportErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        var fe = e.getBindingResult().getFieldErrors();
        String msg = fe.isEmpty() ? "VALIDATION_FAILED" : fe.get(0).getField() + " " + fe.get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(new ReportErrorResponse("VALIDATION_FAILED", msg, rid(req)));
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            DateTimeException.class
    })
    public ResponseEntity<ReportErrorResponse> handleBadRequest(Exception e, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(new ReportErrorResponse("BAD_REQUEST", "Malformed request", rid(req)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ReportErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("unhandled error: rid={}", rid(req), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ReportErrorResponse("INTERNAL_ERROR", "Unexpected error", rid(req)));
    }

    private static ReportErrorResponse err(String code, Exception e, HttpServletRequest req) {
        return new ReportErrorResponse(code, safeMsgOrCode(e, code), rid(req));
    }

    private static String norm(String msg, String fallback) {
        return (msg == null || msg.isBlank()) ? fallback : msg.trim();
    }

    /** IntakeValidationException 帶 detail 時回 detail，其餘回錯誤碼本身 */
    private static String safeMsgOrCode(Exception e, String code) {
        if (e instanceof IntakeValidationException ive && ive.detail() != null) {
            return ive.detail();
        }
        return code;
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }
}
