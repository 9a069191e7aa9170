package com.babytrack.backend.report.chart;

public class ChartRenderingException extends RuntimeException {

    public ChartRenderingException(String message) {
        super(message);
    }

    public ChartRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
