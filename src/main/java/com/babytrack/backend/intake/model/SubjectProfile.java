package com.babytrack.backend.intake.model;

import java.time.LocalDate;

/**
 * @param dateOfBirth 可為 null
 */
public record SubjectProfile(String name, String gender, LocalDate dateOfBirth) {

    public static final String DEFAULT_NAME = "Baby";
    public static final String UNKNOWN_GENDER = "unknown";

    /** 還沒建 profile 時用；報表照樣產 */
    public static SubjectProfile defaults() {
        return new SubjectProfile(DEFAULT_NAME, UNKNOWN_GENDER, null);
    }
}
