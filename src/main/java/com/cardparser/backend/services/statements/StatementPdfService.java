package com.cardparser.backend.services.statements;

import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Service;

import com.cardparser.backend.config.ExtractionProperties;
import com.cardparser.backend.services.ocr.OcrProperties;
import com.cardparser.backend.services.ocr.PdfOcrExtractor;
import com.cardparser.backend.services.ocr.PdfTextExtractor;
import com.cardparser.backend.services.statements.ExtractionOutcome.FailureKind;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns an uploaded PDF into text (text layer first, OCR on request) and hands it to the
 * {@link StatementExtractionEngine}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementPdfService {

    static final String INSUFFICIENT_TEXT_MESSAGE = "Could not extract sufficient text from PDF. Try enabling OCR.";

    private final PdfTextExtractor pdfTextExtractor;
    private final PdfOcrExtractor pdfOcrExtractor;
    private final OcrProperties ocrProperties;
    private final ExtractionProperties extractionProperties;
    private final StatementExtractionEngine engine;

    public ExtractionOutcome parsePdf(byte[] pdfBytes, String password, boolean useOcr) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new IllegalArgumentException("Empty PDF (0 bytes)");
        }
        log.info("[Statement][PDF] Read pdfBytes={} ocrRequested={}", pdfBytes.length, useOcr);

        String text = readText(pdfBytes, password, useOcr);

        int minLen = Math.max(1, extractionProperties.getPdfMinTextLength());
        if (text.strip().length() < minLen) {
            log.info("[Statement][PDF] Insufficient text: len={} min={}", text.strip().length(), minLen);
            return new ExtractionOutcome.Failed(FailureKind.NO_TEXT, INSUFFICIENT_TEXT_MESSAGE, engine.supportedIssuers());
        }

        return engine.parse(text);
    }

    private String readText(byte[] pdfBytes, String password, boolean useOcr) {
        boolean hasPassword = password != null && !password.isBlank();
        try (PDDocument document = hasPassword ? PDDocument.load(pdfBytes, password) : PDDocument.load(pdfBytes)) {
            String text = pdfTextExtractor.extractText(document);
            text = text == null ? "" : text;
            log.info("[Statement][PDF] Text layer: pages={} len={}", document.getNumberOfPages(), text.length());

            if (shouldAttemptOcr(text, useOcr)) {
                String ocrText = pdfOcrExtractor.extractText(document);
                if (ocrText != null && !ocrText.isBlank()) {
                    log.info("[Statement][OCR] Using OCR text (len={}) instead of text layer (len={})",
                            ocrText.length(), text.length());
                    text = ocrText;
                } else {
                    log.info("[Statement][OCR] OCR produced no text; keeping text layer");
                }
            }
            return text;
        } catch (InvalidPasswordException e) {
            if (hasPassword) {
                throw new StatementParsingException("Incorrect password for the PDF file.", e);
            }
            throw new StatementParsingException("The PDF file is password protected. Please provide the password.", e);
        } catch (IOException e) {
            throw new StatementParsingException("Could not read the PDF file: " + e.getMessage(), e);
        }
    }

    private boolean shouldAttemptOcr(String text, boolean useOcr) {
        if (!useOcr) return false;
        if (!pdfOcrExtractor.isEnabled()) {
            log.info("[Statement][OCR] Requested but disabled (cardparser.ocr.enabled=false)");
            return false;
        }
        int minLen = Math.max(0, ocrProperties.getPdf().getMinTextLength());
        return text.strip().length() < minLen;
    }
}
