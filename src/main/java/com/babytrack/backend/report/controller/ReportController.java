package com.babytrack.backend.report.controller;

import com.babytrack.backend.report.config.ReportProperties;
import com.babytrack.backend.report.dto.ReportMessageResponse;
import com.babytrack.backend.report.service.GrowthChartService;
import com.babytrack.backend.report.service.IntakeReportService;
import com.babytrack.backend.report.service.ReportOutcome;
import com.babytrack.backend.report.service.ReportZoneResolver;
import com.babytrack.backend.report.service.SubjectIds;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.ZoneId;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 三個產圖 / 產報表入口。渲染丟到 reportRenderExecutor，servlet thread 不被卡住。
 */
@RestController
@RequestMapping("/api/v1/subjects/{identity}")
public class ReportController {

    public static final String ARTIFACT_URL_HEADER = "X-Artifact-Url";

    private final IntakeReportService intakeReports;
    private final GrowthChartService growthCharts;
    private final ReportZoneResolver zoneResolver;
    private final ReportProperties props;
    private final TaskExecutor renderExecutor;

    public ReportController(IntakeReportService intakeReports,
                            GrowthChartService growthCharts,
                            ReportZoneResolver zoneResolver,
                            ReportProperties props,
                            @Qualifier("reportRenderExecutor") TaskExecutor renderExecutor) {
        this.intakeReports = intakeReports;
        this.growthCharts = growthCharts;
        this.zoneResolver = zoneResolver;
        this.props = props;
        this.renderExecutor = renderExecutor;
    }

    @GetMapping("/charts/intake")
    public CompletableFuture<ResponseEntity<?>> intakeChart(
            @PathVariable String identity,
            @RequestParam(value = "windowDays", required = false) Integer windowDays,
            HttpServletRequest req
    ) {
        String id = SubjectIds.normalize(identity);
        int days = (windowDays == null) ? props.getDefaultWindowDays() : windowDays;
        ZoneId zone = zoneResolver.resolve(req);
        return render(() -> intakeReports.intakeChart(id, days, zone), null);
    }

    @GetMapping("/reports/intake")
    public CompletableFuture<ResponseEntity<?>> intakeReport(
            @PathVariable String identity,
            @RequestParam(value = "windowDays", required = false) Integer windowDays,
            HttpServletRequest req
    ) {
        String id = SubjectIds.normalize(identity);
        int days = (windowDays == null) ? props.getDefaultWindowDays() : windowDays;
        ZoneId zone = zoneResolver.resolve(req);
        return render(() -> intakeReports.intakeReport(id, days, zone), "intake_report_" + id + ".pdf");
    }

    @GetMapping("/charts/growth")
    public CompletableFuture<ResponseEntity<?>> growthChart(
            @PathVariable String identity,
            HttpServletRequest req
    ) {
        String id = SubjectIds.normalize(identity);
        ZoneId zone = zoneResolver.resolve(req);
        return render(() -> growthCharts.growthChart(id, zone), null);
    }

    private CompletableFuture<ResponseEntity<?>> render(Supplier<ReportOutcome> work, String attachmentName) {
        return CompletableFuture.supplyAsync(work, renderExecutor)
                .thenApply(outcome -> toResponse(outcome, attachmentName));
    }

    static ResponseEntity<?> toResponse(ReportOutcome o, String attachmentName) {
        return switch (o.kind()) {
            case RENDERED -> {
                HttpHeaders h = new HttpHeaders();
                h.setContentType(MediaType.parseMediaType(o.contentType()));
                h.set(ARTIFACT_URL_HEADER, o.reference().url());
                if (attachmentName != null) {
                    h.setContentDisposition(ContentDisposition.attachment().filename(attachmentName).build());
                }
                yield ResponseEntity.ok().headers(h).body(o.bytes());
            }
            case NO_DATA -> {
                String url = (o.reference() == null) ? null : o.reference().url();
                ResponseEntity.BodyBuilder b = ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON);
                if (url != null) b.header(ARTIFACT_URL_HEADER, url);
                yield b.body(new ReportMessageResponse("INSUFFICIENT_DATA", o.message(), url, null));
            }
            case DENIED -> ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ReportMessageResponse("UPGRADE_REQUIRED", o.message(), null, "SHOW_PAYWALL"));
            case FAILED -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ReportMessageResponse("RENDERING_FAILED", o.message(), null, null));
        };
    }
}
