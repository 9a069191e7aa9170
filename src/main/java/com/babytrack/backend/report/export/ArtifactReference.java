package com.babytrack.backend.report.export;

import java.nio.file.Path;

/**
 * @param url 給 client 的公開網址（base-url + public-path + fileName）
 */
public record ArtifactReference(ArtifactKind kind, String fileName, Path path, String url) {}
