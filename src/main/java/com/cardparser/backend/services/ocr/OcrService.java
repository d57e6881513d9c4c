package com.cardparser.backend.services.ocr;

import java.awt.image.BufferedImage;

/**
 * Recognises text on statement pages that carry no usable text layer (scans, image-only PDFs).
 * Pages arrive already rendered by {@link PdfOcrExtractor}.
 */
public interface OcrService {

    /**
     * Extracts text from one rendered statement page.
     *
     * @return recognised text, empty when nothing was recognised
     * @throws OcrException when the engine fails on the page
     */
    String extractText(BufferedImage image);
}
