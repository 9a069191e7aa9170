package com.babytrack.backend.report.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RenderingConfig {

    @Bean
    public RenderingCapability renderingCapability() {
        RenderingCapability cap = RenderingCapability.probe();
        if (cap.isAvailable()) {
            log.info("rendering capability: available (headless={})", java.awt.GraphicsEnvironment.isHeadless());
        } else {
            log.warn("rendering capability: UNAVAILABLE reason={}", cap.getReason());
        }
        return cap;
    }
}
