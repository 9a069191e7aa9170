package com.babytrack.backend.report.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("rendering")
public class RenderingHealthIndicator implements HealthIndicator {

    private final RenderingCapability capability;
    private final ExportProperties exportProps;

    public RenderingHealthIndicator(RenderingCapability capability, ExportProperties exportProps) {
        this.capability = capability;
        this.exportProps = exportProps;
    }

    @Override
    public Health health() {
        Health.Builder b = capability.isAvailable()
                ? Health.up()
                : Health.down().withDetail("reason", capability.getReason());
        return b.withDetail("png", capability.isAvailable())
                .withDetail("pdf", capability.isAvailable())
                .withDetail("exportBaseUrl", exportProps.getBaseUrl())
                .build();
    }
}
