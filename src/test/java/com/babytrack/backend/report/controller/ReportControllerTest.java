package com.babytrack.backend.report.controller;

import com.babytrack.backend.common.web.RequestIdFilter;
import com.babytrack.backend.report.config.ReportProperties;
import com.babytrack.backend.report.export.ArtifactKind;
import com.babytrack.backend.report.export.ArtifactReference;
import com.babytrack.backend.report.service.GrowthChartService;
import com.babytrack.backend.report.service.IntakeReportService;
import com.babytrack.backend.report.service.ReportOutcome;
import com.babytrack.backend.report.service.ReportZoneResolver;
import com.babytrack.backend.report.web.ReportExceptionAdvice;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(controllers = ReportController.class)
@Import({ReportExceptionAdvice.class, RequestIdFilter.class})
class ReportControllerTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};

    /** true = 模擬 render queue 已滿 */
    static final AtomicBoolean QUEUE_FULL = new AtomicBoolean(false);

    @Autowired MockMvc mvc;

    @MockitoBean IntakeReportService intakeReports;
    @MockitoBean GrowthChartService growthCharts;

    @TestConfiguration
    static class Beans {
        @Bean
        ReportProperties reportProperties() {
            return new ReportProperties();
        }

        @Bean
        ReportZoneResolver reportZoneResolver(ReportProperties props) {
            return new ReportZoneResolver(props);
        }

        @Bean("reportRenderExecutor")
        TaskExecutor reportRenderExecutor() {
            return task -> {
                if (QUEUE_FULL.get()) throw new TaskRejectedException("render queue full");
                task.run();
            };
        }
    }

    @AfterEach
    void resetQueue() {
        QUEUE_FULL.set(false);
    }

    private static ArtifactReference ref(ArtifactKind kind) {
        String name = kind.fileName("42");
        return new ArtifactReference(kind, name, Path.of("/tmp", name), "http://localhost:8000/static/" + name);
    }

    private MvcResult started(String url, String... headers) throws Exception {
        var req = get(url);
        for (int i = 0; i + 1 < headers.length; i += 2) req.header(headers[i], headers[i + 1]);
        return mvc.perform(req).andExpect(request().asyncStarted()).andReturn();
    }

    @Test
    void intake_chart_returns_png_with_artifact_url() throws Exception {
        Mockito.when(intakeReports.intakeChart("42", 7, ZoneId.of("Asia/Taipei")))
                .thenReturn(ReportOutcome.rendered(PNG, "image/png", ref(ArtifactKind.INTAKE_CHART)));

        MvcResult r = started("/api/v1/subjects/42/charts/intake", "X-Client-Timezone", "Asia/Taipei");

        mvc.perform(asyncDispatch(r))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"))
                .andExpect(content().bytes(PNG))
                .andExpect(header().string(ReportController.ARTIFACT_URL_HEADER,
                        "http://localhost:8000/static/intake_chart_42.png"));
    }

    @Test
    void intake_report_is_sent_as_attachment() throws Exception {
        byte[] pdf = "%PDF-1.7".getBytes();
        Mockito.when(intakeReports.intakeReport(eq("42"), eq(30), any()))
                .thenReturn(ReportOutcome.rendered(pdf, "application/pdf", ref(ArtifactKind.INTAKE_REPORT)));

        MvcResult r = started("/api/v1/subjects/42/reports/intake?windowDays=30");

        mvc.perform(asyncDispatch(r))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/pdf"))
                .andExpect(header().string("Content-Disposition",
                        org.hamcrest.Matchers.containsString("intake_report_42.pdf")));
    }

    @Test
    void no_data_is_200_with_code_and_url() throws Exception {
        Mockito.when(intakeReports.intakeChart(eq("42"), eq(7), eq(ZoneId.of("Asia/Jakarta"))))
                .thenReturn(ReportOutcome.noData("No MPASI or milk records", ref(ArtifactKind.INTAKE_CHART)));

        MvcResult r = started("/api/v1/subjects/42/charts/intake");

        mvc.perform(asyncDispatch(r))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_DATA"))
                .andExpect(jsonPath("$.artifactUrl").value("http://localhost:8000/static/intake_chart_42.png"))
                .andExpect(header().exists(ReportController.ARTIFACT_URL_HEADER));
    }

    @Test
    void denied_asks_client_to_show_paywall() throws Exception {
        Mockito.when(growthCharts.growthChart(eq("42"), any()))
                .thenReturn(ReportOutcome.denied("The growth chart is a premium feature."));

        MvcResult r = started("/api/v1/subjects/42/charts/growth");

        mvc.perform(asyncDispatch(r))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("UPGRADE_REQUIRED"))
                .andExpect(jsonPath("$.clientAction").value("SHOW_PAYWALL"))
                .andExpect(jsonPath("$.artifactUrl").doesNotExist());
    }

    @Test
    void failed_render_is_503() throws Exception {
        Mockito.when(growthCharts.growthChart(eq("42"), any()))
                .thenReturn(ReportOutcome.failed("Sorry"));

        MvcResult r = started("/api/v1/subjects/42/charts/growth");

        mvc.perform(asyncDispatch(r))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("RENDERING_FAILED"));
    }

    @Test
    void full_render_queue_is_503_apology() throws Exception {
        QUEUE_FULL.set(true);

        mvc.perform(get("/api/v1/subjects/42/charts/intake").header("X-Request-Id", "RID-Q"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("RENDERING_FAILED"))
                .andExpect(jsonPath("$.requestId").value("RID-Q"));

        Mockito.verifyNoInteractions(intakeReports);
    }

    @Test
    void invalid_window_from_service_is_400_with_request_id() throws Exception {
        Mockito.when(intakeReports.intakeChart(eq("42"), eq(500), any()))
                .thenThrow(new IllegalArgumentException("WINDOW_DAYS_INVALID"));

        MvcResult r = started("/api/v1/subjects/42/charts/intake?windowDays=500", "X-Request-Id", "RID-9");

        mvc.perform(asyncDispatch(r))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("WINDOW_DAYS_INVALID"))
                .andExpect(jsonPath("$.requestId").value("RID-9"));
    }

    @Test
    void bad_identity_is_rejected_before_rendering() throws Exception {
        mvc.perform(get("/api/v1/subjects/abc/charts/intake").header("X-Request-Id", "RID-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("IDENTITY_INVALID"))
                .andExpect(header().string("X-Request-Id", "RID-1"));

        Mockito.verifyNoInteractions(intakeReports);
    }

    @Test
    void non_numeric_window_is_bad_request() throws Exception {
        mvc.perform(get("/api/v1/subjects/42/charts/intake?windowDays=seven"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }
}
