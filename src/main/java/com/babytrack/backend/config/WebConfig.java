package com.babytrack.backend.config;

import com.babytrack.backend.report.config.ExportProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/**
 * 匯出的 png / pdf 直接由 /static/** 提供下載（目錄同 LocalDiskArtifactExporter 的 public dir）。
 * WebMvcTest slice 不掃 PropertiesConfig，所以這裡自己 enable ExportProperties。
 */
@Configuration
@EnableConfigurationProperties(ExportProperties.class)
public class WebConfig implements WebMvcConfigurer {

    private final Path publicDir;
    private final String publicPath;

    public WebConfig(ExportProperties props) {
        this.publicDir = props.resolvePublicDir();
        this.publicPath = props.getPublicPath();
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // 必須是 file: URI，尾巴要有 /
        String location = publicDir.toUri().toString();
        if (!location.endsWith("/")) location = location + "/";

        registry.addResourceHandler(pattern(publicPath))
                .addResourceLocations(location)
                .setCachePeriod(0); // 同名檔會被覆蓋，不快取
    }

    static String pattern(String publicPath) {
        String p = (publicPath == null || publicPath.isBlank()) ? "/static/" : publicPath.trim();
        if (!p.startsWith("/")) p = "/" + p;
        if (!p.endsWith("/")) p = p + "/";
        return p + "**";
    }
}
