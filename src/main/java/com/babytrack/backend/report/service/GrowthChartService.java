package com.babytrack.backend.report.service;

import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.intake.model.IntakeRecord;
import com.babytrack.backend.intake.model.SubjectProfile;
import com.babytrack.backend.intake.store.IntakeRecordStore;
import com.babytrack.backend.report.access.AccessDecision;
import com.babytrack.backend.report.access.AccessGate;
import com.babytrack.backend.report.access.FeatureKeys;
import com.babytrack.backend.report.chart.ChartComposer;
import com.babytrack.backend.report.chart.ChartRenderingException;
import com.babytrack.backend.report.chart.LongitudinalSpec;
import com.babytrack.backend.report.config.RenderingCapability;
import com.babytrack.backend.report.config.ReportProperties;
import com.babytrack.backend.report.export.ArtifactExporter;
import com.babytrack.backend.report.export.ArtifactKind;
import com.babytrack.backend.report.export.ArtifactReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class GrowthChartService {

    private static final DateTimeFormatter DOB = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final AccessGate accessGate;
    private final IntakeRecordStore store;
    private final ChartComposer composer;
    private final ArtifactExporter exporter;
    private final RenderingCapability capability;
    private final ReportProperties props;

    public ReportOutcome growthChart(String identity, ZoneId zone) {
        String id = SubjectIds.normalize(identity);

        AccessDecision decision = accessGate.decide(id, FeatureKeys.ADVANCED_CHARTS);
        if (!decision.allowed()) {
            log.info("growth chart denied: identity={} reason={}", id, decision.reason());
            return ReportOutcome.denied(ReportMessages.denied(decision, "The growth chart"));
        }
        // gate 先於渲染能力：沒權限一律回 DENIED
        if (!capability.isAvailable()) return ReportOutcome.failed(ReportMessages.RENDER_FAILED);

        Map<IntakeCategory, List<IntakeRecord>> history = new EnumMap<>(IntakeCategory.class);
        for (IntakeCategory c : GrowthSeries.MEASUREMENTS) {
            history.put(c, store.getHistory(id, c, props.getGrowthHistoryLimit()));
        }
        GrowthSeries series = GrowthSeries.from(history, zone);
        if (series.isEmpty()) {
            return ReportOutcome.noData(ReportMessages.noGrowthData(), null);
        }

        SubjectProfile profile = store.getSubjectProfile(id);
        LongitudinalSpec spec = new LongitudinalSpec(
                "Growth Chart - " + profile.name(),
                subtitle(profile),
                series.dates(),
                series.panels()
        );

        byte[] png;
        try {
            png = composer.composeLongitudinal(spec);
        } catch (ChartRenderingException e) {
            log.error("growth chart render failed: identity={} points={}", id, series.dates().size(), e);
            return ReportOutcome.failed(ReportMessages.RENDER_FAILED);
        }

        ArtifactReference ref = exporter.export(png, id, ArtifactKind.GROWTH_CHART);
        return ReportOutcome.rendered(png, ArtifactKind.GROWTH_CHART.contentType(), ref);
    }

    static String subtitle(SubjectProfile p) {
        StringBuilder sb = new StringBuilder();
        sb.append("Gender: ").append(p.gender() == null ? SubjectProfile.UNKNOWN_GENDER : p.gender());
        if (p.dateOfBirth() != null) sb.append(" | Born: ").append(p.dateOfBirth().format(DOB));
        return sb.toString();
    }
}
