package com.babytrack.backend.entitlement.service;

import com.babytrack.backend.report.access.FeatureFlagStore;
import com.babytrack.backend.report.access.FeatureKeys;
import com.babytrack.backend.report.service.SubjectIds;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 用 user_entitlements 回答 hasFeature。
 * TRIAL / MONTHLY / YEARLY 都解鎖全部付費功能；不在付費清單裡的 key 視為沒分類、直接放行。
 */
@Component
@RequiredArgsConstructor
public class EntitlementFeatureFlagStore implements FeatureFlagStore {

    private final EntitlementService entitlementService;
    private final Clock clock;

    @Override
    public boolean hasFeature(String identity, String featureKey) {
        if (!FeatureKeys.PREMIUM.contains(featureKey)) return true;

        Long userId = SubjectIds.parse(identity);
        return entitlementService.resolveTier(userId, clock.instant()) != EntitlementService.Tier.NONE;
    }
}
