package com.babytrack.backend.report.export;

/**
 * 寫檔失敗（磁碟滿、權限、搬移失敗）。屬於 server 端錯誤，不是使用者輸入問題。
 */
public class ArtifactExportException extends RuntimeException {

    public ArtifactExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
