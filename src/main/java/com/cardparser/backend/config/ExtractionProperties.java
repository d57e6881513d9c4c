package com.cardparser.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Text-length thresholds, loaded with prefix "cardparser.extraction".
 *
 * Example:
 * cardparser.extraction.min-text-length=1
 * cardparser.extraction.pdf-min-text-length=50
 */
@Data
@Component
@ConfigurationProperties(prefix = "cardparser.extraction")
public class ExtractionProperties {

    /**
     * Shortest trimmed text the engine accepts before reporting NO_TEXT.
     */
    private int minTextLength = 1;

    /**
     * Shortest trimmed text a PDF (after the optional OCR pass) must yield to be handed to the engine.
     */
    private int pdfMinTextLength = 50;
}
