package com.babytrack.backend.intake.web;

/**
 * 資料驗證失敗（identity 格式、category 不支援、數值為負...）。
 * message 一律放 errorCode，讓 advice 直接回 400。
 */
public class IntakeValidationException extends IllegalArgumentException {

    private final String detail;

    public IntakeValidationException(String errorCode) {
        this(errorCode, null);
    }

    public IntakeValidationException(String errorCode, String detail) {
        super(errorCode);
        this.detail = detail;
    }

    public String errorCode() { return getMessage(); }

    public String detail() { return detail; }
}
