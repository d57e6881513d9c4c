package com.cardparser.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class PdfOcrExtractor {

    private final OcrProperties ocrProperties;
    private final OcrService ocrService;

    public boolean isEnabled() {
        return ocrProperties.isEnabled();
    }

    /**
     * Renders up to {@code cardparser.ocr.pdf.max-pages} pages and joins the recognised text, one page per block.
     * Returns "" when OCR is switched off.
     */
    public String extractText(PDDocument document) {
        if (document == null || !isEnabled()) return "";

        OcrProperties.Pdf pdf = ocrProperties.getPdf();
        int dpi = Math.max(72, pdf.getRenderDpi());
        int pages = Math.min(document.getNumberOfPages(), Math.max(1, pdf.getMaxPages()));
        ImageType imageType = pdf.isGrayscale() ? ImageType.GRAY : ImageType.RGB;

        long startMs = System.currentTimeMillis();
        PDFRenderer renderer = new PDFRenderer(document);
        StringBuilder text = new StringBuilder();

        for (int page = 0; page < pages; page++) {
            BufferedImage image = render(renderer, page, dpi, imageType);
            try {
                String pageText = ocrService.extractText(image);
                if (pageText != null && !pageText.isBlank()) {
                    text.append(pageText).append('\n');
                }
            } finally {
                image.flush();
            }
        }

        log.info("[OCR] Statement read: pages={}/{} dpi={} type={} elapsedMs={} textLen={}",
                pages, document.getNumberOfPages(), dpi, imageType,
                System.currentTimeMillis() - startMs, text.length());
        return text.toString();
    }

    private static BufferedImage render(PDFRenderer renderer, int page, int dpi, ImageType imageType) {
        try {
            return renderer.renderImageWithDPI(page, dpi, imageType);
        } catch (IOException e) {
            throw new OcrException("Could not render page " + (page + 1) + " for OCR", e);
        }
    }
}
