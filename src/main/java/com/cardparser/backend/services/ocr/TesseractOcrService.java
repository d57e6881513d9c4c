package com.cardparser.backend.services.ocr;

import java.awt.image.BufferedImage;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

/**
 * Tess4J-backed OCR. Requires a native Tesseract install (or {@code tessdata-path}) at run time.
 */
@Slf4j
public class TesseractOcrService implements OcrService {

    private final String language;
    private final String tessdataPath;
    private final int pageSegMode;

    // Tesseract instances are not thread-safe.
    private final ThreadLocal<Tesseract> engines = ThreadLocal.withInitial(this::newEngine);

    public TesseractOcrService(OcrProperties properties) {
        this.language = blankToNull(properties.getLanguage());
        this.tessdataPath = blankToNull(properties.getTessdataPath());
        this.pageSegMode = properties.getPageSegMode();
    }

    @Override
    public String extractText(BufferedImage image) {
        if (image == null) return "";

        long startMs = System.currentTimeMillis();
        try {
            String text = engines.get().doOCR(image);
            log.debug("[OCR] Page {}x{} recognised in {}ms", image.getWidth(), image.getHeight(),
                    System.currentTimeMillis() - startMs);
            return text == null ? "" : text;
        } catch (TesseractException e) {
            throw new OcrException("Tesseract could not read the statement page", e);
        }
    }

    private Tesseract newEngine() {
        Tesseract engine = new Tesseract();
        if (tessdataPath != null) engine.setDatapath(tessdataPath);
        if (language != null) engine.setLanguage(language);
        if (pageSegMode > 0) engine.setPageSegMode(pageSegMode);
        return engine;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
