package com.cardparser.backend.services.ocr;

import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * Reads the embedded text layer of a statement, page by page in reading order.
 */
@Service
public class PdfTextExtractor {

    public String extractText(PDDocument document) throws IOException {
        if (document == null) return "";

        PDFTextStripper stripper = new PDFTextStripper();
        // Statement tables are laid out in columns; stream order mixes label and value lines.
        stripper.setSortByPosition(true);
        stripper.setLineSeparator("\n");
        return stripper.getText(document);
    }
}
