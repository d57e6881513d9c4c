package com.cardparser.backend.services.statements;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.cardparser.backend.services.statements.rules.FieldName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class ParsedStatementTest {

    private static ParsedStatement withoutTotal() {
        Map<FieldName, String> fields = new EnumMap<>(FieldName.class);
        fields.put(FieldName.CARD_HOLDER, "AYUSH KARANI");
        fields.put(FieldName.LAST_4_DIGITS, "4581");
        fields.put(FieldName.BILLING_CYCLE, "01 Sep 2025 - 30 Sep 2025");
        fields.put(FieldName.PAYMENT_DUE_DATE, "15 Oct 2025");
        fields.put(FieldName.TOTAL_AMOUNT_DUE, null);
        return ParsedStatement.of("HDFC Bank", fields);
    }

    @Test
    void flatMapStartsWithIssuerAndKeepsAbsentFields() {
        Map<String, String> map = withoutTotal().toMap();

        assertEquals(List.of("issuer", "card_holder", "last_4_digits", "billing_cycle", "payment_due_date",
                "total_amount_due"), List.copyOf(map.keySet()));
        assertTrue(map.containsKey("total_amount_due"));
        assertEquals("4581", map.get("last_4_digits"));
    }

    @Test
    void reportsMissingFields() {
        ParsedStatement statement = withoutTotal();

        assertEquals(List.of(FieldName.TOTAL_AMOUNT_DUE), statement.missingFields());
        assertFalse(statement.isComplete());
    }

    @Test
    void serializesWithSnakeCaseKeysAndExplicitNulls() throws Exception {
        JsonNode json = new ObjectMapper().valueToTree(withoutTotal());

        assertEquals("HDFC Bank", json.get("issuer").asText());
        assertEquals("AYUSH KARANI", json.get("card_holder").asText());
        assertTrue(json.has("total_amount_due"));
        assertTrue(json.get("total_amount_due").isNull());
        assertFalse(json.has("complete"));
        assertFalse(json.has("missingFields"));
    }
}
