package com.babytrack.backend.report.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * application.yml:
 * app.export.*
 */
@ConfigurationProperties(prefix = "app.export")
public class ExportProperties {

    /** 匯出根目錄；public/ 與 tmp/ 都在底下（同一個 filesystem 才能 atomic move） */
    private String baseDir = "./data/exports";

    private String publicSubdir = "public";

    private String tmpSubdir = "tmp";

    /** 靜態檔 server 的 base url */
    private String baseUrl = "http://localhost:8000";

    /** base url 後面接的路徑，WebConfig 也用它註冊 resource handler */
    private String publicPath = "/static/";

    private final TmpCleaner tmpCleaner = new TmpCleaner();

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getPublicSubdir() { return publicSubdir; }
    public void setPublicSubdir(String publicSubdir) { this.publicSubdir = publicSubdir; }

    public String getTmpSubdir() { return tmpSubdir; }
    public void setTmpSubdir(String tmpSubdir) { this.tmpSubdir = tmpSubdir; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getPublicPath() { return publicPath; }
    public void setPublicPath(String publicPath) { this.publicPath = publicPath; }

    public TmpCleaner getTmpCleaner() { return tmpCleaner; }

    /** 絕對、normalize 過的匯出根目錄 */
    public Path resolveBaseDir() {
        return Paths.get(baseDir).toAbsolutePath().normalize();
    }

    /** exporter 寫入、/static/** 讀取的同一個目錄 */
    public Path resolvePublicDir() {
        return resolveBaseDir().resolve(publicSubdir).normalize();
    }

    /** 寫到一半掛掉會留下 tmp 檔，定期清掉 */
    public static class TmpCleaner {
        private boolean enabled = true;
        private Duration keep = Duration.ofHours(1);
        private Duration fixedDelay = Duration.ofMinutes(10);
        private Duration initialDelay = Duration.ofMinutes(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getKeep() { return keep; }
        public void setKeep(Duration keep) { this.keep = keep; }

        public Duration getFixedDelay() { return fixedDelay; }
        public void setFixedDelay(Duration fixedDelay) { this.fixedDelay = fixedDelay; }

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
    }
}
