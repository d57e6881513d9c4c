package com.cardparser.backend.services.statements;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.cardparser.backend.config.ExtractionProperties;
import com.cardparser.backend.services.statements.ExtractionOutcome.FailureKind;
import com.cardparser.backend.services.statements.profiles.InstitutionProfile;
import com.cardparser.backend.services.statements.rules.FieldName;
import com.cardparser.backend.services.statements.util.NormalizeUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Text in, {@link ExtractionOutcome} out. Performs no I/O and never retries: re-reading a document
 * (e.g. with OCR) is up to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementExtractionEngine {

    static final String NO_TEXT_MESSAGE = "No statement text was supplied.";

    private final BankDetector bankDetector;
    private final ProfileRegistry profileRegistry;
    private final ExtractionProperties extractionProperties;

    @Value("${cardparser.debug.log-extracted-text:false}")
    private boolean logExtractedText;

    @Value("${cardparser.debug.extracted-text-max-chars:2000}")
    private int extractedTextMaxChars = 2000;

    public ExtractionOutcome parse(String text) {
        if (!hasUsableText(text)) {
            log.info("[Statement][Extract] Rejected: text too short (len={})", text == null ? 0 : text.length());
            return new ExtractionOutcome.Failed(FailureKind.NO_TEXT, NO_TEXT_MESSAGE, profileRegistry.supportedIssuers());
        }

        if (logExtractedText && log.isDebugEnabled()) {
            log.debug("[Statement][Extract] Text preview: {}", NormalizeUtil.preview(text, extractedTextMaxChars));
        }

        Optional<InstitutionProfile> detected = bankDetector.detect(text);
        if (detected.isEmpty()) {
            log.info("[Statement][Detect] No issuer matched (len={})", text.length());
            return bankNotDetected();
        }

        InstitutionProfile profile = detected.get();
        warnIfAmbiguous(profile, text);

        Map<FieldName, String> fields = profile.extractAll(text);
        ParsedStatement statement = ParsedStatement.of(profile.issuerName(), fields);

        List<FieldName> missing = statement.missingFields();
        if (missing.isEmpty()) {
            log.info("[Statement][Extract] issuer={} all fields resolved", profile.issuerName());
        } else {
            log.info("[Statement][Extract] issuer={} missing={}", profile.issuerName(),
                    missing.stream().map(FieldName::key).collect(Collectors.joining(",")));
        }

        return new ExtractionOutcome.Parsed(statement);
    }

    /**
     * Same detection as {@link #parse(String)}, but reports every rule of every field instead of only the winners.
     */
    public StatementDiagnostics diagnose(String text) {
        String t = text == null ? "" : text;
        List<String> matching = bankDetector.detectAll(t).stream()
                .map(InstitutionProfile::issuerName)
                .collect(Collectors.toList());

        Optional<InstitutionProfile> detected = bankDetector.detect(t);
        return new StatementDiagnostics(
                t.length(),
                NormalizeUtil.preview(t, extractedTextMaxChars),
                detected.map(InstitutionProfile::issuerName).orElse(null),
                matching,
                detected.map(p -> p.trace(t)).orElse(List.of())
        );
    }

    public List<String> supportedIssuers() {
        return profileRegistry.supportedIssuers();
    }

    private boolean hasUsableText(String text) {
        if (text == null) return false;
        int min = Math.max(1, extractionProperties.getMinTextLength());
        return text.strip().length() >= min;
    }

    private ExtractionOutcome bankNotDetected() {
        List<String> supported = profileRegistry.supportedIssuers();
        String message = "Could not identify the credit card issuer. Supported issuers: " + String.join(", ", supported);
        return new ExtractionOutcome.Failed(FailureKind.BANK_NOT_DETECTED, message, supported);
    }

    private void warnIfAmbiguous(InstitutionProfile chosen, String text) {
        List<InstitutionProfile> all = bankDetector.detectAll(text);
        if (all.size() <= 1) return;
        log.warn("[Statement][Detect] Ambiguous issuer: matched={} chosen={} (registry order)",
                all.stream().map(InstitutionProfile::issuerName).collect(Collectors.joining(",")),
                chosen.issuerName());
    }
}
