package com.babytrack.backend.report.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml:
 * app.report.*
 */
@ConfigurationProperties(prefix = "app.report")
public class ReportProperties {

    /** windowDays 沒帶時用 */
    private int defaultWindowDays = 7;

    /** windowDays 上限（含） */
    private int maxWindowDays = 90;

    /** client 沒帶或帶錯時區 header 時的參考時區 */
    private String defaultZone = "Asia/Jakarta";

    /** 成長曲線每種量測最多讀幾筆 */
    private int growthHistoryLimit = 365;

    /** 渲染用 thread pool（CPU bound，不要開太大） */
    private int renderThreads = 2;

    private int renderQueueCapacity = 50;

    public int getDefaultWindowDays() { return defaultWindowDays; }
    public void setDefaultWindowDays(int defaultWindowDays) { this.defaultWindowDays = defaultWindowDays; }

    public int getMaxWindowDays() { return maxWindowDays; }
    public void setMaxWindowDays(int maxWindowDays) { this.maxWindowDays = maxWindowDays; }

    public String getDefaultZone() { return defaultZone; }
    public void setDefaultZone(String defaultZone) { this.defaultZone = defaultZone; }

    public int getGrowthHistoryLimit() { return growthHistoryLimit; }
    public void setGrowthHistoryLimit(int growthHistoryLimit) { this.growthHistoryLimit = growthHistoryLimit; }

    public int getRenderThreads() { return renderThreads; }
    public void setRenderThreads(int renderThreads) { this.renderThreads = renderThreads; }

    public int getRenderQueueCapacity() { return renderQueueCapacity; }
    public void setRenderQueueCapacity(int renderQueueCapacity) { this.renderQueueCapacity = renderQueueCapacity; }
}
