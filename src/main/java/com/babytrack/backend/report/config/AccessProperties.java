package com.babytrack.backend.report.config;

import com.babytrack.backend.report.access.FeatureKeys;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * application.yml:
 * app.access.*
 */
@ConfigurationProperties(prefix = "app.access")
public class AccessProperties {

    /** 整個關掉的功能（任何人都拿不到） */
    private Set<String> disabledFeatures = new LinkedHashSet<>();

    /** 不查訂閱直接放行 */
    private Set<String> freeFeatures = new LinkedHashSet<>(FeatureKeys.DEFAULT_FREE);

    public Set<String> getDisabledFeatures() { return disabledFeatures; }
    public void setDisabledFeatures(Set<String> disabledFeatures) { this.disabledFeatures = disabledFeatures; }

    public Set<String> getFreeFeatures() { return freeFeatures; }
    public void setFreeFeatures(Set<String> freeFeatures) { this.freeFeatures = freeFeatures; }
}
