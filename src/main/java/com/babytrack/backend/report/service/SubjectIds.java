package com.babytrack.backend.report.service;

import java.util.regex.Pattern;

/**
 * identity = 正整數 user id（字串形式）。
 * 匯出檔名直接用它，所以只收純數字：不會撞名，也帶不進路徑字元。
 */
public final class SubjectIds {

    private static final Pattern VALID = Pattern.compile("^[1-9][0-9]{0,18}$");

    private SubjectIds() {}

    public static Long parse(String identity) {
        if (identity == null || !VALID.matcher(identity).matches()) {
            throw new IllegalArgumentException("IDENTITY_INVALID");
        }
        try {
            return Long.parseLong(identity);
        } catch (NumberFormatException e) {
            // 19 位數但超過 Long.MAX_VALUE
            throw new IllegalArgumentException("IDENTITY_INVALID", e);
        }
    }

    public static String normalize(String identity) {
        return String.valueOf(parse(identity));
    }
}
