package com.babytrack.backend.report.pdf;

public class ReportRenderingException extends RuntimeException {

    public ReportRenderingException(String message) {
        super(message);
    }

    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
