package com.babytrack.backend.intake.model;

import com.babytrack.backend.intake.web.IntakeValidationException;

import java.util.Locale;

public enum MilkType {
    ASI("asi"),
    FORMULA("formula");

    private final String code;

    MilkType(String code) {
        this.code = code;
    }

    public String code() { return code; }

    /** null / 空白 → null（讀取端當 ASI）；"sufor" 是印尼文的配方奶 */
    public static MilkType parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "asi", "breast", "breastmilk" -> ASI;
            case "formula", "sufor" -> FORMULA;
            default -> throw new IntakeValidationException("MILK_TYPE_UNSUPPORTED", "unsupported milk type: " + raw.trim());
        };
    }
}
