package com.babytrack.backend.report.export;

public interface ArtifactExporter {

    /**
     * 以固定檔名寫出 artifact；同名舊檔被整個取代，讀者只會看到完整的舊檔或完整的新檔。
     *
     * @throws ArtifactExportException I/O 失敗
     * @throws SecurityException       檔名解析後跑出匯出根目錄
     */
    ArtifactReference export(byte[] bytes, String identity, ArtifactKind kind);
}
