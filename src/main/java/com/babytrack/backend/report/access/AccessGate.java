package com.babytrack.backend.report.access;

import com.babytrack.backend.report.config.AccessProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 決定能不能拿到 artifact。
 *
 * <p>順序：disabled → 免費 → 查訂閱。查詢失敗一律拒絕（fail closed），也不快取前一次的結果。
 */
@Slf4j
@Component
public class AccessGate {

    private final FeatureFlagStore store;
    private final Set<String> disabled;
    private final Set<String> free;

    public AccessGate(FeatureFlagStore store, AccessProperties props) {
        this.store = store;
        this.disabled = normalize(props.getDisabledFeatures());
        this.free = normalize(props.getFreeFeatures());
    }

    public AccessDecision decide(String identity, String featureKey) {
        if (featureKey == null || featureKey.isBlank()) throw new IllegalArgumentException("FEATURE_KEY_REQUIRED");
        String key = featureKey.trim().toLowerCase(Locale.ROOT);

        if (disabled.contains(key)) return AccessDecision.disabled();
        if (free.contains(key)) return AccessDecision.free();

        try {
            return store.hasFeature(identity, key)
                    ? AccessDecision.premium()
                    : AccessDecision.upgradeRequired();
        } catch (RuntimeException e) {
            log.warn("feature lookup failed, deny. identity={} feature={} err={}",
                    identity, key, e.toString());
            return AccessDecision.upgradeRequired();
        }
    }

    private static Set<String> normalize(Set<String> in) {
        if (in == null) return Set.of();
        return in.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
