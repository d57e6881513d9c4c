package com.cardparser.backend.services.statements.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class PatternRuleTest {

    @Test
    void matchesCaseInsensitively() {
        PatternRule rule = PatternRule.single("Total", "total\\s+due\\s+(\\d+)");

        Optional<Capture> capture = rule.apply("TOTAL DUE 500");

        assertTrue(capture.isPresent());
        assertEquals("500", capture.get().value());
        assertFalse(capture.get().isRange());
    }

    @Test
    void onlyFirstOccurrenceCounts() {
        PatternRule rule = PatternRule.single("v", "v=(\\d)");

        assertEquals("1", rule.apply("v=1 v=2").orElseThrow().value());
    }

    @Test
    void lastOfGroupsTakesTrailingGroup() {
        PatternRule rule = PatternRule.lastOfGroups("Full card number", "(\\d{4})\\s+(\\d{4})\\s+(\\d{4})\\s+(\\d{4})");

        assertEquals("4444", rule.apply("Card 4111 2222 3333 4444").orElseThrow().value());
    }

    @Test
    void lastOfGroupsRejectsNonNumericGroups() {
        PatternRule rule = PatternRule.lastOfGroups("pair", "(\\w+)-(\\w+)");

        assertTrue(rule.apply("ab-12").isEmpty());
        assertEquals("12", rule.apply("34-12").orElseThrow().value());
    }

    @Test
    void joinedPairKeepsBothEndpoints() {
        PatternRule rule = PatternRule.joinedPair("range", "(\\d+)\\s+to\\s+(\\d+)");

        Capture capture = rule.apply("1 to 9").orElseThrow();

        assertTrue(capture.isRange());
        assertEquals("1", capture.value());
        assertEquals("9", capture.end());
    }

    @Test
    void rejectsGroupCountIncompatibleWithPolicy() {
        assertThrows(IllegalArgumentException.class, () -> PatternRule.single("none", "Total Due"));
        assertThrows(IllegalArgumentException.class, () -> PatternRule.lastOfGroups("one", "(\\d{4})"));
        assertThrows(IllegalArgumentException.class, () -> PatternRule.joinedPair("three", "(a)(b)(c)"));
    }

    @Test
    void rejectsBlankLabelAndInvalidRegex() {
        assertThrows(IllegalArgumentException.class, () -> PatternRule.single(" ", "(a)"));
        assertThrows(IllegalArgumentException.class, () -> PatternRule.single("broken", "(a"));
    }

    @Test
    void emptyTextNeverMatches() {
        PatternRule rule = PatternRule.single("any", "(.*)");

        assertTrue(rule.apply("").isEmpty());
        assertTrue(rule.apply(null).isEmpty());
    }
}
