package com.babytrack.backend.entitlement;

import com.babytrack.backend.entitlement.service.EntitlementFeatureFlagStore;
import com.babytrack.backend.entitlement.service.EntitlementService;
import com.babytrack.backend.report.access.FeatureKeys;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class EntitlementFeatureFlagStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final EntitlementService entitlements = mock(EntitlementService.class);
    private final EntitlementFeatureFlagStore store =
            new EntitlementFeatureFlagStore(entitlements, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void premium_key_requires_active_tier() {
        when(entitlements.resolveTier(42L, NOW)).thenReturn(EntitlementService.Tier.NONE);
        assertThat(store.hasFeature("42", FeatureKeys.PDF_REPORTS)).isFalse();

        when(entitlements.resolveTier(42L, NOW)).thenReturn(EntitlementService.Tier.TRIAL);
        assertThat(store.hasFeature("42", FeatureKeys.PDF_REPORTS)).isTrue();
    }

    @Test
    void uncategorized_key_is_allowed_without_lookup() {
        assertThat(store.hasFeature("42", "sleep_tracking")).isTrue();
        verifyNoInteractions(entitlements);
    }
}
