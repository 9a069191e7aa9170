package com.babytrack.backend.report.export;

import com.babytrack.backend.report.config.ExportProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 本機磁碟匯出。
 *
 * <pre>
 * {base-dir}/public/intake_chart_42.png   ← 對外（/static/**）
 * {base-dir}/tmp/intake_chart_42.png.123.part ← 寫入中
 * </pre>
 * 先寫 tmp 再 rename 蓋過去，所以同一個 identity 併發時是 last-writer-wins，不會出現半個檔。
 */
@Slf4j
@Getter
@Service
public class LocalDiskArtifactExporter implements ArtifactExporter {

    private final Path baseDir;
    private final Path publicDir;
    private final Path tmpDir;
    private final String urlPrefix;

    public LocalDiskArtifactExporter(ExportProperties props) {
        this.baseDir = props.resolveBaseDir();
        this.publicDir = props.resolvePublicDir();
        this.tmpDir = baseDir.resolve(props.getTmpSubdir()).normalize();
        if (!publicDir.startsWith(baseDir) || !tmpDir.startsWith(baseDir)) {
            throw new IllegalStateException("EXPORT_DIRS_OUTSIDE_BASE");
        }
        this.urlPrefix = joinUrl(props.getBaseUrl(), props.getPublicPath());
    }

    @Override
    public ArtifactReference export(byte[] bytes, String identity, ArtifactKind kind) {
        if (bytes == null || bytes.length == 0) throw new IllegalArgumentException("ARTIFACT_EMPTY");
        if (kind == null) throw new IllegalArgumentException("ARTIFACT_KIND_REQUIRED");
        if (identity == null || identity.isBlank()) throw new IllegalArgumentException("IDENTITY_INVALID");

        String fileName = kind.fileName(identity);
        Path target = resolve(fileName);

        Path tmp = null;
        try {
            Files.createDirectories(publicDir);
            Files.createDirectories(tmpDir);
            tmp = Files.createTempFile(tmpDir, fileName + ".", ".part");
            Files.write(tmp, bytes);
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            cleanup(tmp, e);
            log.error("artifact export failed: kind={} identity={} target={}", kind, identity, target, e);
            throw new ArtifactExportException("EXPORT_FAILED", e);
        }

        log.info("artifact exported: kind={} identity={} bytes={} file={}", kind, identity, bytes.length, target);
        return new ArtifactReference(kind, fileName, target, urlPrefix + fileName);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            // fallback：非原子 replace（部分 filesystem 不支援）
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void cleanup(Path tmp, IOException cause) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    /** 檔名解析後必須直接落在 public 目錄底下，不能帶子目錄或 .. */
    private Path resolve(String fileName) {
        Path p = publicDir.resolve(fileName).normalize();
        if (!p.startsWith(publicDir) || !publicDir.equals(p.getParent())) {
            throw new SecurityException("Invalid artifact name");
        }
        return p;
    }

    static String joinUrl(String baseUrl, String publicPath) {
        String base = (baseUrl == null) ? "" : baseUrl.trim();
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);

        String path = (publicPath == null || publicPath.isBlank()) ? "/" : publicPath.trim();
        if (!path.startsWith("/")) path = "/" + path;
        if (!path.endsWith("/")) path = path + "/";
        return base + path;
    }
}
