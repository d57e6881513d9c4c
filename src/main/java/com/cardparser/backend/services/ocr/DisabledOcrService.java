package com.cardparser.backend.services.ocr;

import java.awt.image.BufferedImage;

/**
 * Registered when {@code cardparser.ocr.enabled} is off. Statement parsing never reaches it on that path,
 * since {@link PdfOcrExtractor} checks the flag first; a direct call is a wiring bug.
 */
public class DisabledOcrService implements OcrService {

    @Override
    public String extractText(BufferedImage image) {
        throw new IllegalStateException("OCR is disabled. Enable it with cardparser.ocr.enabled=true");
    }
}
