package com.babytrack.backend.report.export;

import com.babytrack.backend.report.config.ExportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalDiskArtifactExporterTest {

    @TempDir
    Path temp;

    private LocalDiskArtifactExporter exporter;

    @BeforeEach
    void setUp() {
        ExportProperties props = new ExportProperties();
        props.setBaseDir(temp.toString());
        props.setBaseUrl("http://localhost:8000/");
        props.setPublicPath("static");
        exporter = new LocalDiskArtifactExporter(props);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private List<Path> files(Path dir) throws Exception {
        if (!Files.exists(dir)) return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.toList();
        }
    }

    @Test
    void export_uses_deterministic_name_and_url() throws Exception {
        ArtifactReference ref = exporter.export(bytes("png-1"), "42", ArtifactKind.INTAKE_CHART);

        assertThat(ref.fileName()).isEqualTo("intake_chart_42.png");
        assertThat(ref.url()).isEqualTo("http://localhost:8000/static/intake_chart_42.png");
        assertThat(ref.path()).isEqualTo(exporter.getPublicDir().resolve("intake_chart_42.png"));
        assertThat(Files.readAllBytes(ref.path())).isEqualTo(bytes("png-1"));
    }

    @Test
    void exporting_twice_leaves_exactly_one_file_with_second_content() throws Exception {
        exporter.export(bytes("first"), "42", ArtifactKind.INTAKE_REPORT);
        ArtifactReference ref = exporter.export(bytes("second"), "42", ArtifactKind.INTAKE_REPORT);

        assertThat(files(exporter.getPublicDir())).containsExactly(ref.path());
        assertThat(Files.readString(ref.path())).isEqualTo("second");
        assertThat(files(exporter.getTmpDir())).isEmpty();
    }

    @Test
    void identities_and_kinds_do_not_collide() throws Exception {
        exporter.export(bytes("a"), "1", ArtifactKind.INTAKE_CHART);
        exporter.export(bytes("b"), "11", ArtifactKind.INTAKE_CHART);
        exporter.export(bytes("c"), "1", ArtifactKind.GROWTH_CHART);

        assertThat(files(exporter.getPublicDir()))
                .extracting(p -> p.getFileName().toString())
                .containsExactlyInAnyOrder("intake_chart_1.png", "intake_chart_11.png", "growth_chart_1.png");
    }

    @Test
    void concurrent_exports_for_same_identity_end_with_one_complete_file() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ArtifactReference>> futures = Stream.of("aaaa", "bbbb", "cccc", "dddd")
                    .map(s -> pool.submit(() -> {
                        start.await();
                        return exporter.export(bytes(s.repeat(10_000)), "7", ArtifactKind.INTAKE_CHART);
                    }))
                    .toList();
            start.countDown();
            for (Future<ArtifactReference> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        Path file = exporter.getPublicDir().resolve("intake_chart_7.png");
        String content = Files.readString(file);
        assertThat(content).hasSize(40_000);
        assertThat(content.chars().distinct().count()).isEqualTo(1);
        assertThat(files(exporter.getTmpDir())).isEmpty();
    }

    @Test
    void path_traversal_is_rejected() {
        assertThatThrownBy(() -> exporter.export(bytes("x"), "../../etc/passwd", ArtifactKind.INTAKE_CHART))
                .isInstanceOf(SecurityException.class);
        assertThatThrownBy(() -> exporter.export(bytes("x"), "a/b", ArtifactKind.INTAKE_CHART))
                .isInstanceOf(SecurityException.class);
    }

    @Test
    void io_failure_surfaces_as_export_exception() throws Exception {
        // public dir 被一個普通檔案佔住 → createDirectories 失敗
        Files.writeString(temp.resolve("public"), "not a dir");

        assertThatThrownBy(() -> exporter.export(bytes("x"), "42", ArtifactKind.INTAKE_CHART))
                .isInstanceOf(ArtifactExportException.class)
                .hasMessage("EXPORT_FAILED");
    }

    @Test
    void empty_payload_is_rejected() {
        assertThatThrownBy(() -> exporter.export(new byte[0], "42", ArtifactKind.INTAKE_CHART))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("ARTIFACT_EMPTY");
    }

    @Test
    void url_join_normalizes_slashes() {
        assertThat(LocalDiskArtifactExporter.joinUrl("http://h:8000", "/static/")).isEqualTo("http://h:8000/static/");
        assertThat(LocalDiskArtifactExporter.joinUrl("http://h:8000//", "files")).isEqualTo("http://h:8000/files/");
    }
}
