package com.babytrack.backend.report.service;

import com.babytrack.backend.report.access.AccessDecision;

/** 給使用者看的文字（英文） */
public final class ReportMessages {

    public static final String RENDER_FAILED =
            "Sorry, we couldn't generate this right now. Please try again in a few minutes.";

    static final String FEATURE_DISABLED = "This feature is currently unavailable.";

    private ReportMessages() {}

    static String denied(AccessDecision decision, String featureName) {
        if (decision.reason() == AccessDecision.Reason.FEATURE_DISABLED) return FEATURE_DISABLED;
        return featureName + " is a premium feature. Upgrade to premium to unlock it.";
    }

    static String noIntakeData(int days) {
        return "No MPASI or milk records in the last " + days + " day(s) yet. "
                + "Log a feeding to see your chart fill up.";
    }

    static String noGrowthData() {
        return "No weight, height or head circumference measurements yet. "
                + "Log a measurement to start the growth chart.";
    }
}
