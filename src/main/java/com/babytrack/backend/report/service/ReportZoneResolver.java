package com.babytrack.backend.report.service;

import com.babytrack.backend.report.config.ReportProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * 從 header 取使用者的參考時區；沒帶或格式錯就用 app.report.default-zone。
 * 必須在 servlet thread 上呼叫（渲染 thread 拿不到 request）。
 */
@Slf4j
@Component
public class ReportZoneResolver {

    static final String[] HEADERS = {"X-Client-Timezone", "X-Client-TZ", "Time-Zone"};

    private final ZoneId fallback;

    public ReportZoneResolver(ReportProperties props) {
        this.fallback = ZoneId.of(props.getDefaultZone());
    }

    public ZoneId resolve(HttpServletRequest req) {
        for (String h : HEADERS) {
            String v = req.getHeader(h);
            if (v != null && !v.isBlank()) return parseOrDefault(v);
        }
        return fallback;
    }

    public ZoneId parseOrDefault(String raw) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            log.debug("invalid client timezone '{}', fallback to {}", raw, fallback);
            return fallback;
        }
    }

    public ZoneId fallback() {
        return fallback;
    }
}
