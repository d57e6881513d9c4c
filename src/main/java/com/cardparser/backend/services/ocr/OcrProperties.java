package com.cardparser.backend.services.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * OCR fallback settings, prefix "cardparser.ocr".
 *
 * Example:
 * cardparser.ocr.enabled=true
 * cardparser.ocr.language=eng
 * cardparser.ocr.pdf.min-text-length=100
 */
@Data
@ConfigurationProperties(prefix = "cardparser.ocr")
public class OcrProperties {

    /**
     * Enables OCR for scanned/image-only statements. Callers still opt in per request.
     */
    private boolean enabled = false;

    /**
     * Tesseract language(s), e.g. "eng" or "eng+hin".
     */
    private String language = "eng";

    /**
     * Directory containing "tessdata". Empty means the OS installation is used.
     */
    private String tessdataPath = "";

    /**
     * Tesseract page segmentation mode. 3 = fully automatic, 6 = single uniform block.
     */
    private int pageSegMode = 3;

    private Pdf pdf = new Pdf();

    @Data
    public static class Pdf {

        /**
         * The text layer is replaced by OCR output when it is shorter than this (trimmed).
         */
        private int minTextLength = 100;

        private int renderDpi = 300;

        private int maxPages = 10;

        /**
         * Render pages in grayscale instead of RGB; usually better for statement scans.
         */
        private boolean grayscale = true;
    }
}
