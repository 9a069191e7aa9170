package com.babytrack.backend;

import com.babytrack.backend.entitlement.service.EntitlementFeatureFlagStore;
import com.babytrack.backend.entitlement.service.EntitlementService;
import com.babytrack.backend.report.access.FeatureFlagStore;
import com.babytrack.backend.report.config.RenderingCapability;
import com.babytrack.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 寫紀錄 → 產圖 / 產報表，整條走一次（H2 + 真的渲染 + 匯出到 target/test-exports）。
 */
@SpringBootTest
@AutoConfigureMockMvc
class IntakeReportFlowTest extends BaseSpringTest {

    @Autowired MockMvc mvc;
    @Autowired EntitlementService entitlements;
    @Autowired FeatureFlagStore featureFlagStore;
    @Autowired RenderingCapability renderingCapability;

    @Test
    void wiring_uses_entitlements_and_rendering_is_available() {
        assertThat(featureFlagStore).isInstanceOf(EntitlementFeatureFlagStore.class);
        assertThat(renderingCapability.isAvailable()).isTrue();
    }

    @Test
    void logged_intake_shows_up_in_chart_and_premium_report() throws Exception {
        String base = "/api/v1/subjects/1001";

        mvc.perform(put(base + "/profile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Alya\",\"gender\":\"female\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Alya"));

        mvc.perform(post(base + "/intake-logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"milk\",\"quantity\":120,\"milkType\":\"asi\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.unit").value("ml"));

        mvc.perform(post(base + "/intake-logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"mpasi\",\"quantity\":60,\"calorieEstimate\":45}"))
                .andExpect(status().isCreated());

        mvc.perform(get(base + "/intake-logs").param("category", "milk"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        MvcResult chart = mvc.perform(get(base + "/charts/intake").header("X-Client-Timezone", "Asia/Jakarta"))
                .andExpect(request().asyncStarted())
                .andReturn();
        mvc.perform(asyncDispatch(chart))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"))
                .andExpect(header().string("X-Artifact-Url", "http://localhost:8000/static/intake_chart_1001.png"));

        MvcResult denied = mvc.perform(get(base + "/reports/intake"))
                .andExpect(request().asyncStarted())
                .andReturn();
        mvc.perform(asyncDispatch(denied))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("UPGRADE_REQUIRED"));

        entitlements.grant(1001L, EntitlementService.Tier.MONTHLY, "TEST", Instant.now());

        MvcResult report = mvc.perform(get(base + "/reports/intake"))
                .andExpect(request().asyncStarted())
                .andReturn();
        mvc.perform(asyncDispatch(report))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/pdf"));
    }

    @Test
    void empty_history_is_insufficient_data() throws Exception {
        MvcResult r = mvc.perform(get("/api/v1/subjects/1002/charts/intake"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(r))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_DATA"))
                .andExpect(jsonPath("$.artifactUrl").value("http://localhost:8000/static/intake_chart_1002.png"));
    }

    @Test
    void exported_chart_is_served_from_the_artifact_path() throws Exception {
        MvcResult r = mvc.perform(get("/api/v1/subjects/2003/charts/intake"))
                .andExpect(request().asyncStarted())
                .andReturn();
        mvc.perform(asyncDispatch(r))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.artifactUrl").value("http://localhost:8000/static/intake_chart_2003.png"));

        byte[] served = mvc.perform(get("/static/intake_chart_2003.png"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"))
                .andReturn().getResponse().getContentAsByteArray();
        assertThat(served).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
    }

    @Test
    void oversized_quantity_is_400_not_500() throws Exception {
        mvc.perform(post("/api/v1/subjects/2001/intake-logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"mpasi\",\"quantity\":1000000000000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        mvc.perform(post("/api/v1/subjects/2001/intake-logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"mpasi\",\"quantity\":10,\"calorieEstimate\":1000000000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void extra_decimals_are_rejected_and_logged_value_matches_history() throws Exception {
        String base = "/api/v1/subjects/2002/intake-logs";

        mvc.perform(post(base)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"milk\",\"quantity\":10.005}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        mvc.perform(post(base)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"milk\",\"quantity\":10.5}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.quantity").value(10.5));

        mvc.perform(get(base).param("category", "milk"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].quantity").value(10.5));
    }

    @Test
    void invalid_intake_is_400_with_code() throws Exception {
        mvc.perform(post("/api/v1/subjects/1003/intake-logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"mpasi\",\"quantity\":10,\"milkType\":\"asi\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MILK_TYPE_NOT_APPLICABLE"));
    }
}
