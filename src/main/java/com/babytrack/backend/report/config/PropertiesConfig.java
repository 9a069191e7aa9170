package com.babytrack.backend.report.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        ReportProperties.class,
        ExportProperties.class,
        AccessProperties.class
})
public class PropertiesConfig {
}
