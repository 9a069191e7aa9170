package com.babytrack.backend.intake.model;

import com.babytrack.backend.intake.web.IntakeValidationException;

import java.util.Locale;

public enum IntakeCategory {
    MPASI("mpasi", "g"),
    MILK("milk", "ml"),
    WEIGHT("weight", "kg"),
    HEIGHT("height", "cm"),
    HEAD_CIRCUMFERENCE("head_circumference", "cm"),
    PUMP("pump", "ml"),
    BOWEL("bowel", "x");

    private final String code;
    private final String unit;

    IntakeCategory(String code, String unit) {
        this.code = code;
        this.unit = unit;
    }

    public String code() { return code; }

    public String unit() { return unit; }

    /** 身長/體重/頭圍：逐次量測值，不能加總 */
    public boolean isMeasurement() {
        return this == WEIGHT || this == HEIGHT || this == HEAD_CIRCUMFERENCE;
    }

    /**
     * 解析 DB / API 傳進來的 code（大小寫不敏感）。
     * 不認得的一律丟 INTAKE_CATEGORY_UNSUPPORTED，不要默默略過。
     */
    public static IntakeCategory parseOrThrow(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IntakeValidationException("INTAKE_CATEGORY_REQUIRED");
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (IntakeCategory c : values()) {
            if (c.code.equals(v)) return c;
        }
        throw new IntakeValidationException("INTAKE_CATEGORY_UNSUPPORTED", "unsupported category: " + raw.trim());
    }
}
