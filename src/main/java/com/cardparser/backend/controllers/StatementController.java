package com.cardparser.backend.controllers;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.cardparser.backend.dto.ApiResponse;
import com.cardparser.backend.dto.StatementTextRequestDTO;
import com.cardparser.backend.services.statements.ExtractionOutcome;
import com.cardparser.backend.services.statements.ParsedStatement;
import com.cardparser.backend.services.statements.StatementDiagnostics;
import com.cardparser.backend.services.statements.StatementExtractionEngine;
import com.cardparser.backend.services.statements.StatementParsingException;
import com.cardparser.backend.services.statements.StatementPdfService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/statements")
@RequiredArgsConstructor
@Slf4j
public class StatementController {

    private final StatementPdfService statementPdfService;
    private final StatementExtractionEngine statementExtractionEngine;

    @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ParsedStatement>> parse(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "password", required = false) String password,
            @RequestParam(value = "ocr", defaultValue = "false") boolean ocr
    ) {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("File is missing or empty"));
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new StatementParsingException("Could not read the uploaded file", e);
        }

        log.info("[Statement][API] parse file='{}' size={} ocr={}", file.getOriginalFilename(), file.getSize(), ocr);
        return toResponse(statementPdfService.parsePdf(bytes, password, ocr));
    }

    @PostMapping("/parse-text")
    public ResponseEntity<ApiResponse<ParsedStatement>> parseText(@Valid @RequestBody StatementTextRequestDTO request) {
        return toResponse(statementExtractionEngine.parse(request.getText()));
    }

    @GetMapping("/issuers")
    public ResponseEntity<ApiResponse<List<String>>> issuers() {
        List<String> issuers = statementExtractionEngine.supportedIssuers();
        return ResponseEntity.ok(ApiResponse.success(issuers, issuers.size() + " issuers supported"));
    }

    @PostMapping("/diagnose")
    public ResponseEntity<ApiResponse<StatementDiagnostics>> diagnose(@Valid @RequestBody StatementTextRequestDTO request) {
        StatementDiagnostics diagnostics = statementExtractionEngine.diagnose(request.getText());
        return ResponseEntity.ok(ApiResponse.success(diagnostics, "Diagnostics computed"));
    }

    private ResponseEntity<ApiResponse<ParsedStatement>> toResponse(ExtractionOutcome outcome) {
        if (outcome instanceof ExtractionOutcome.Parsed parsed) {
            ParsedStatement statement = parsed.statement();
            String message = statement.isComplete()
                    ? "Statement parsed"
                    : "Statement parsed with missing fields";
            return ResponseEntity.ok(ApiResponse.success(statement, message));
        }

        ExtractionOutcome.Failed failed = (ExtractionOutcome.Failed) outcome;
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ApiResponse.error(failed.message(), List.of(failed.kind().name())));
    }
}
