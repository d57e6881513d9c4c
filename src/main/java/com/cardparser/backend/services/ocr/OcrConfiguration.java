package com.cardparser.backend.services.ocr;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

/**
 * Picks the OCR backend: Tesseract when {@code cardparser.ocr.enabled=true}, otherwise a stub that refuses work.
 */
@Configuration
@EnableConfigurationProperties(OcrProperties.class)
@Slf4j
public class OcrConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "cardparser.ocr", name = "enabled", havingValue = "true")
    public OcrService tesseractOcrService(OcrProperties properties) {
        OcrProperties.Pdf pdf = properties.getPdf();
        log.info("[OCR] Tesseract enabled: language='{}' psm={} dpi={} grayscale={} maxPages={} minTextLen={}",
                properties.getLanguage(), properties.getPageSegMode(), pdf.getRenderDpi(), pdf.isGrayscale(),
                pdf.getMaxPages(), pdf.getMinTextLength());
        return new TesseractOcrService(properties);
    }

    @Bean
    @ConditionalOnMissingBean(OcrService.class)
    public OcrService disabledOcrService() {
        log.info("[OCR] Disabled; image-only statements will report NO_TEXT");
        return new DisabledOcrService();
    }
}
