package com.babytrack.backend.report.config;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.AWTError;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * 開機時檢查一次能不能畫圖 / 產 PDF，之後只讀結果。
 * 不可用時 pipeline 直接回道歉訊息，不去碰渲染引擎。
 */
@Slf4j
public final class RenderingCapability {

    private final boolean available;
    private final String reason;

    private RenderingCapability(boolean available, String reason) {
        this.available = available;
        this.reason = reason;
    }

    public static RenderingCapability available() {
        return new RenderingCapability(true, null);
    }

    public static RenderingCapability unavailable(String reason) {
        return new RenderingCapability(false, reason);
    }

    public static RenderingCapability probe() {
        if (!ImageIO.getImageWritersByFormatName("png").hasNext()) {
            return unavailable("PNG_WRITER_MISSING");
        }
        try {
            Class.forName("org.apache.pdfbox.pdmodel.PDDocument");
        } catch (ClassNotFoundException e) {
            return unavailable("PDFBOX_MISSING");
        }
        try {
            // 實際畫一次字，字型 / headless 設定有問題會在這裡炸
            BufferedImage img = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = img.createGraphics();
            try {
                g.setFont(new Font("SansSerif", Font.PLAIN, 10));
                g.drawString("0", 0, 8);
            } finally {
                g.dispose();
            }
        } catch (RuntimeException | AWTError | LinkageError e) {
            log.error("rendering probe failed", e);
            return unavailable("JAVA2D_UNAVAILABLE");
        }
        return available();
    }

    public boolean isAvailable() { return available; }

    public String getReason() { return reason; }
}
