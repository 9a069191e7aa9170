package com.babytrack.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.DateTimeException;
import java.util.HashMap;
import java.util.Map;

/**
 * 最後兜底（報表 / 紀錄 API 有自己的 ReportExceptionAdvice）：
 * - 400：參數格式錯 / IllegalArgument
 * - 500：其他未預期錯誤
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({DateTimeException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest req) {
        String code = (ex instanceof IllegalArgumentException && ex.getMessage() != null && !ex.getMessage().isBlank())
                ? ex.getMessage().trim()
                : "BAD_REQUEST";
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err(code, null, req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        var fe = ex.getBindingResult().getFieldErrors();
        String msg = fe.isEmpty() ? "VALIDATION_FAILED" : fe.get(0).getField() + " " + fe.get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("VALIDATION_FAILED", msg, req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unhandled error: rid={}", RequestIdFilter.getOrCreate(req), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(err("INTERNAL_ERROR", null, req));
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new HashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        m.put("requestId", RequestIdFilter.getOrCreate(req));
        return m;
    }
}
