package com.babytrack.backend.report.service;

import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.intake.model.IntakeRecord;
import com.babytrack.backend.intake.model.SubjectProfile;
import com.babytrack.backend.intake.store.IntakeRecordStore;
import com.babytrack.backend.report.access.AccessDecision;
import com.babytrack.backend.report.access.AccessGate;
import com.babytrack.backend.report.access.FeatureKeys;
import com.babytrack.backend.report.aggregate.DailyBucket;
import com.babytrack.backend.report.aggregate.DateBucketAggregator;
import com.babytrack.backend.report.aggregate.DateWindow;
import com.babytrack.backend.report.chart.ChartComposer;
import com.babytrack.backend.report.chart.ChartRenderingException;
import com.babytrack.backend.report.chart.IntakeChartSpecs;
import com.babytrack.backend.report.config.RenderingCapability;
import com.babytrack.backend.report.config.ReportProperties;
import com.babytrack.backend.report.export.ArtifactExporter;
import com.babytrack.backend.report.export.ArtifactKind;
import com.babytrack.backend.report.export.ArtifactReference;
import com.babytrack.backend.report.pdf.IntakeReport;
import com.babytrack.backend.report.pdf.ReportAssembler;
import com.babytrack.backend.report.pdf.ReportHeader;
import com.babytrack.backend.report.pdf.ReportRenderingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * 餵食圖 / 餵食報表：gate → load → aggregate → compose → (assemble) → export。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntakeReportService {

    static final EnumSet<IntakeCategory> INTAKE_CATEGORIES = EnumSet.of(IntakeCategory.MPASI, IntakeCategory.MILK);

    private final AccessGate accessGate;
    private final IntakeRecordStore store;
    private final DateBucketAggregator aggregator;
    private final ChartComposer composer;
    private final ReportAssembler assembler;
    private final ArtifactExporter exporter;
    private final RenderingCapability capability;
    private final ReportProperties props;
    private final Clock clock;

    public ReportOutcome intakeChart(String identity, int windowDays, ZoneId zone) {
        String id = SubjectIds.normalize(identity);
        validateWindow(windowDays);

        AccessDecision decision = accessGate.decide(id, FeatureKeys.INTAKE_CHART);
        if (!decision.allowed()) {
            log.info("intake chart denied: identity={} reason={}", id, decision.reason());
            return ReportOutcome.denied(ReportMessages.denied(decision, "The intake chart"));
        }
        // gate 先於渲染能力：沒權限一律回 DENIED
        if (!capability.isAvailable()) return ReportOutcome.failed(ReportMessages.RENDER_FAILED);

        Loaded data = load(id, windowDays, zone);

        byte[] png;
        try {
            png = composer.compose(data.buckets(), IntakeChartSpecs.intake(data.profile().name(), data.window(), data.buckets()));
        } catch (ChartRenderingException e) {
            log.error("intake chart render failed: identity={} window={}", id, data.window(), e);
            return ReportOutcome.failed(ReportMessages.RENDER_FAILED);
        }

        ArtifactReference ref = exporter.export(png, id, ArtifactKind.INTAKE_CHART);
        if (DateBucketAggregator.allZero(data.buckets())) {
            return ReportOutcome.noData(ReportMessages.noIntakeData(windowDays), ref);
        }
        return ReportOutcome.rendered(png, ArtifactKind.INTAKE_CHART.contentType(), ref);
    }

    public ReportOutcome intakeReport(String identity, int windowDays, ZoneId zone) {
        String id = SubjectIds.normalize(identity);
        validateWindow(windowDays);

        AccessDecision decision = accessGate.decide(id, FeatureKeys.PDF_REPORTS);
        if (!decision.allowed()) {
            log.info("intake report denied: identity={} reason={}", id, decision.reason());
            return ReportOutcome.denied(ReportMessages.denied(decision, "The PDF intake report"));
        }
        // gate 先於渲染能力：沒權限一律回 DENIED
        if (!capability.isAvailable()) return ReportOutcome.failed(ReportMessages.RENDER_FAILED);

        Loaded data = load(id, windowDays, zone);
        ZonedDateTime generatedAt = ZonedDateTime.ofInstant(clock.instant(), zone);

        IntakeReport report;
        try {
            byte[] png = composer.compose(data.buckets(),
                    IntakeChartSpecs.intake(data.profile().name(), data.window(), data.buckets()));
            report = assembler.assemble(png, data.buckets(),
                    new ReportHeader(null, data.profile().name(), data.window(), generatedAt));
        } catch (ChartRenderingException | ReportRenderingException e) {
            log.error("intake report render failed: identity={} window={}", id, data.window(), e);
            return ReportOutcome.failed(ReportMessages.RENDER_FAILED);
        }

        ArtifactReference ref = exporter.export(report.pdf(), id, ArtifactKind.INTAKE_REPORT);
        log.info("intake report ready: identity={} days={} pages={}", id, windowDays, report.pageCount());

        if (DateBucketAggregator.allZero(data.buckets())) {
            return ReportOutcome.noData(ReportMessages.noIntakeData(windowDays), ref);
        }
        return ReportOutcome.rendered(report.pdf(), ArtifactKind.INTAKE_REPORT.contentType(), ref);
    }

    private Loaded load(String id, int windowDays, ZoneId zone) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
        DateWindow window = DateWindow.endingOn(today, windowDays);

        Instant from = window.start().atStartOfDay(zone).toInstant();
        Instant to = window.end().plusDays(1).atStartOfDay(zone).toInstant();
        List<IntakeRecord> records = store.getHistoryBetween(id, INTAKE_CATEGORIES, from, to);

        List<DailyBucket> buckets = aggregator.aggregate(records, window, zone);
        SubjectProfile profile = store.getSubjectProfile(id);
        return new Loaded(window, buckets, profile);
    }

    private void validateWindow(int windowDays) {
        if (windowDays < 1 || windowDays > props.getMaxWindowDays()) {
            throw new IllegalArgumentException("WINDOW_DAYS_INVALID");
        }
    }

    private record Loaded(DateWindow window, List<DailyBucket> buckets, SubjectProfile profile) {}
}
