package com.cardparser.backend.controllers;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import com.cardparser.backend.services.ocr.OcrException;
import com.cardparser.backend.services.statements.StatementPdfService;

@SpringBootTest
@AutoConfigureMockMvc
class StatementControllerErrorMappingTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    StatementPdfService statementPdfService;

    private static MockMultipartFile pdf() {
        return new MockMultipartFile("file", "statement.pdf", MediaType.APPLICATION_PDF_VALUE, new byte[] {1, 2, 3});
    }

    @Test
    void ocrFailureIs502() throws Exception {
        when(statementPdfService.parsePdf(any(), isNull(), anyBoolean()))
                .thenThrow(new OcrException("tessdata not found"));

        mockMvc.perform(multipart("/api/statements/parse").file(pdf()).param("ocr", "true"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errors[0]").value("OCR_FAILED"));
    }

    @Test
    void oversizedUploadIs413() throws Exception {
        when(statementPdfService.parsePdf(any(), isNull(), anyBoolean()))
                .thenThrow(new MaxUploadSizeExceededException(10L * 1024 * 1024));

        mockMvc.perform(multipart("/api/statements/parse").file(pdf()))
                .andExpect(status().isPayloadTooLarge());
    }

    @Test
    void unexpectedErrorIs500() throws Exception {
        when(statementPdfService.parsePdf(any(), isNull(), anyBoolean()))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(multipart("/api/statements/parse").file(pdf()))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }
}
