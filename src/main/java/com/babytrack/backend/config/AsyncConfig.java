package com.babytrack.backend.config;

import com.babytrack.backend.report.config.ReportProperties;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

@Configuration
public class AsyncConfig {

    /** 畫圖 / 產 PDF 專用；queue 滿了直接拒絕（TaskRejectedException → 503 RENDERING_FAILED） */
    @Bean("reportRenderExecutor")
    public TaskExecutor reportRenderExecutor(ReportProperties props) {
        int threads = Math.max(1, props.getRenderThreads());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(threads);
        ex.setMaxPoolSize(threads);
        ex.setQueueCapacity(Math.max(1, props.getRenderQueueCapacity()));
        ex.setThreadNamePrefix("report-render-");
        ex.setTaskDecorator(AsyncConfig::withMdc);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationSeconds(30);
        ex.initialize();
        return ex;
    }

    /** 把 request 的 MDC（rid）帶到渲染 thread */
    static Runnable withMdc(Runnable task) {
        Map<String, String> ctx = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (ctx == null) MDC.clear(); else MDC.setContextMap(ctx);
            try {
                task.run();
            } finally {
                if (previous == null) MDC.clear(); else MDC.setContextMap(previous);
            }
        };
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
