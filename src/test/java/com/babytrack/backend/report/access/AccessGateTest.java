package com.babytrack.backend.report.access;

import com.babytrack.backend.report.config.AccessProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccessGateTest {

    @Mock FeatureFlagStore store;

    private AccessGate gate;

    @BeforeEach
    void setUp() {
        AccessProperties props = new AccessProperties();
        props.setDisabledFeatures(Set.of("Data_Export"));
        gate = new AccessGate(store, props);
    }

    @Test
    void premium_feature_allowed_when_store_says_yes() {
        when(store.hasFeature("42", FeatureKeys.PDF_REPORTS)).thenReturn(true);

        AccessDecision d = gate.decide("42", FeatureKeys.PDF_REPORTS);

        assertThat(d.allowed()).isTrue();
        assertThat(d.reason()).isEqualTo(AccessDecision.Reason.PREMIUM_ACTIVE);
    }

    @Test
    void premium_feature_denied_for_free_tier() {
        when(store.hasFeature("42", FeatureKeys.ADVANCED_CHARTS)).thenReturn(false);

        AccessDecision d = gate.decide("42", FeatureKeys.ADVANCED_CHARTS);

        assertThat(d.allowed()).isFalse();
        assertThat(d.reason()).isEqualTo(AccessDecision.Reason.FREE_TIER);
    }

    @Test
    void free_feature_skips_lookup() {
        AccessDecision d = gate.decide("42", FeatureKeys.INTAKE_CHART);

        assertThat(d).isEqualTo(AccessDecision.free());
        verifyNoInteractions(store);
    }

    @Test
    void disabled_feature_is_denied_even_for_premium() {
        AccessDecision d = gate.decide("42", "data_export");

        assertThat(d.allowed()).isFalse();
        assertThat(d.reason()).isEqualTo(AccessDecision.Reason.FEATURE_DISABLED);
        verifyNoInteractions(store);
    }

    @Test
    void lookup_failure_fails_closed_even_right_after_an_allowed_decision() {
        when(store.hasFeature("42", FeatureKeys.PDF_REPORTS))
                .thenReturn(true)
                .thenThrow(new IllegalStateException("db down"));

        assertThat(gate.decide("42", FeatureKeys.PDF_REPORTS).allowed()).isTrue();

        AccessDecision second = gate.decide("42", FeatureKeys.PDF_REPORTS);
        assertThat(second.allowed()).isFalse();
        assertThat(second.reason()).isEqualTo(AccessDecision.Reason.FREE_TIER);
    }

    @Test
    void blank_feature_key_is_rejected() {
        assertThatThrownBy(() -> gate.decide("42", " ")).hasMessage("FEATURE_KEY_REQUIRED");
    }
}
