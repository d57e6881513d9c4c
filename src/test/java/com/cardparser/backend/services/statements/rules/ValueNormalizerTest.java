package com.cardparser.backend.services.statements.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ValueNormalizerTest {

    @Test
    void amountGetsCurrencyPrefixAndIsTrimmed() {
        assertEquals("₹14,820.00", ValueNormalizer.normalize(FieldName.TOTAL_AMOUNT_DUE, " 14,820.00 "));
    }

    @Test
    void datesAndTokensAreOnlyTrimmed() {
        assertEquals("15 Oct 2025", ValueNormalizer.normalize(FieldName.PAYMENT_DUE_DATE, "15 Oct 2025\n"));
        assertEquals("AYUSH KARANI", ValueNormalizer.normalize(FieldName.CARD_HOLDER, "  AYUSH KARANI "));
        assertEquals("4581", ValueNormalizer.normalize(FieldName.LAST_4_DIGITS, "4581"));
    }

    @Test
    void rangeEndpointsAreJoinedWithSpacedDash() {
        assertEquals("01/09/2025 - 30/09/2025", ValueNormalizer.normalizeRange(" 01/09/2025", "30/09/2025 "));
        assertEquals("01/09/2025 - 30/09/2025",
                ValueNormalizer.normalize(FieldName.BILLING_CYCLE, Capture.range("01/09/2025", "30/09/2025")));
    }
}
