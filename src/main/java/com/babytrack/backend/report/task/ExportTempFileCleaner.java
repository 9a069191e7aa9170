package com.babytrack.backend.report.task;

import com.babytrack.backend.report.config.ExportProperties;
import com.babytrack.backend.report.export.LocalDiskArtifactExporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 清掉匯出時殘留的 tmp 檔（process 在 write 與 move 之間掛掉才會有）。
 * tmp 目錄只有一層，不遞迴。
 */
@Slf4j
@Component
@ConditionalOnProperty(
        prefix = "app.export.tmp-cleaner",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ExportTempFileCleaner {

    private final LocalDiskArtifactExporter exporter;
    private final ExportProperties props;
    private final Clock clock;

    public ExportTempFileCleaner(LocalDiskArtifactExporter exporter, ExportProperties props, Clock clock) {
        this.exporter = exporter;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${app.export.tmp-cleaner.fixed-delay:PT10M}",
            initialDelayString = "${app.export.tmp-cleaner.initial-delay:PT1M}"
    )
    public void clean() {
        if (!props.getTmpCleaner().isEnabled()) return;
        purgeStale();
    }

    /** @return 刪掉的檔案數 */
    int purgeStale() {

        final Path tmpDir = exporter.getTmpDir();
        if (!Files.isDirectory(tmpDir)) return 0;

        final Instant now = clock.instant();
        final Duration keep = props.getTmpCleaner().getKeep();
        int deleted = 0;

        try (DirectoryStream<Path> ds = Files.newDirectoryStream(tmpDir)) {
            for (Path file : ds) {
                if (!Files.isRegularFile(file)) continue;
                try {
                    Instant lm = Files.getLastModifiedTime(file).toInstant();
                    if (Duration.between(lm, now).compareTo(keep) > 0 && Files.deleteIfExists(file)) {
                        deleted++;
                    }
                } catch (IOException e) {
                    log.debug("tmp cleaner: delete file failed. file={}", file, e);
                }
            }
        } catch (IOException e) {
            log.warn("tmp cleaner failed. tmpDir={}", tmpDir, e);
        }

        if (deleted > 0) {
            log.info("tmp cleaner done. tmpDir={}, deletedFiles={}", tmpDir, deleted);
        }
        return deleted;
    }
}
