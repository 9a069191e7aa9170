package com.babytrack.backend.report.access;

import java.util.Set;

/**
 * 功能 key。免費清單可由 app.access.free-features 覆寫，付費清單固定。
 */
public final class FeatureKeys {

    public static final String BASIC_TRACKING = "basic_tracking";
    public static final String SIMPLE_SUMMARY = "simple_summary";
    public static final String BASIC_ANALYTICS = "basic_analytics";
    public static final String INTAKE_CHART = "intake_chart";

    public static final String PDF_REPORTS = "pdf_reports";
    public static final String ADVANCED_CHARTS = "advanced_charts";
    public static final String MONTHLY_REPORTS = "monthly_reports";
    public static final String WEEKLY_TRENDS = "weekly_trends";
    public static final String DATA_EXPORT = "data_export";
    public static final String DETAILED_ANALYTICS = "detailed_analytics";
    public static final String UNLIMITED_HISTORY = "unlimited_history";

    public static final Set<String> DEFAULT_FREE = Set.of(
            BASIC_TRACKING, SIMPLE_SUMMARY, BASIC_ANALYTICS, INTAKE_CHART
    );

    public static final Set<String> PREMIUM = Set.of(
            PDF_REPORTS, ADVANCED_CHARTS, MONTHLY_REPORTS, WEEKLY_TRENDS,
            DATA_EXPORT, DETAILED_ANALYTICS, UNLIMITED_HISTORY
    );

    private FeatureKeys() {}
}
