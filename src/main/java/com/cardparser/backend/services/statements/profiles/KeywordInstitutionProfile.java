package com.cardparser.backend.services.statements.profiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.cardparser.backend.services.statements.rules.FieldExtractor;
import com.cardparser.backend.services.statements.rules.FieldName;
import com.cardparser.backend.services.statements.rules.FieldTrace;
import com.cardparser.backend.services.statements.rules.PatternRule;
import com.cardparser.backend.services.statements.util.NormalizeUtil;

/**
 * Base for profiles that recognise their statements by keyword and extract fields from rule tables.
 * Subclasses only supply data: issuer name, keywords and one ordered rule list per field.
 */
public abstract class KeywordInstitutionProfile implements InstitutionProfile {

    private final String issuerName;
    private final List<String> lowerKeywords;
    private final Map<FieldName, FieldExtractor> extractors;

    protected KeywordInstitutionProfile(
            String issuerName,
            List<String> keywords,
            Map<FieldName, List<PatternRule>> ruleTables
    ) {
        if (issuerName == null || issuerName.isBlank()) {
            throw new IllegalArgumentException("Issuer name is required");
        }
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("At least one keyword is required for " + issuerName);
        }

        this.issuerName = issuerName;
        List<String> lowered = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            lowered.add(NormalizeUtil.lower(keyword));
        }
        this.lowerKeywords = List.copyOf(lowered);

        EnumMap<FieldName, FieldExtractor> map = new EnumMap<>(FieldName.class);
        for (FieldName field : FieldName.values()) {
            List<PatternRule> rules = ruleTables == null ? null : ruleTables.get(field);
            if (rules == null || rules.isEmpty()) {
                throw new IllegalStateException(issuerName + " has no rules for " + field.key());
            }
            map.put(field, new FieldExtractor(field, rules));
        }
        this.extractors = Collections.unmodifiableMap(map);
    }

    @Override
    public String issuerName() {
        return issuerName;
    }

    @Override
    public boolean validate(String text) {
        if (text == null || text.isEmpty()) return false;
        return NormalizeUtil.containsAny(NormalizeUtil.lower(text), lowerKeywords);
    }

    @Override
    public Map<FieldName, String> extractAll(String text) {
        EnumMap<FieldName, String> out = new EnumMap<>(FieldName.class);
        for (Map.Entry<FieldName, FieldExtractor> entry : extractors.entrySet()) {
            out.put(entry.getKey(), entry.getValue().extract(text).orElse(null));
        }
        return out;
    }

    @Override
    public List<FieldTrace> trace(String text) {
        List<FieldTrace> traces = new ArrayList<>(extractors.size());
        for (FieldExtractor extractor : extractors.values()) {
            traces.add(extractor.trace(text));
        }
        return traces;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + issuerName + "}";
    }
}
