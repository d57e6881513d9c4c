package com.cardparser.backend.services.statements.profiles;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.cardparser.backend.services.statements.rules.FieldName;
import com.cardparser.backend.services.statements.rules.PatternRule;

class InstitutionProfilesTest {

    @Test
    void iciciSample() {
        String text = String.join("\n",
                "ICICI Bank Credit Card Statement",
                "Card Member: AYUSH KARANI",
                "Card Number: XXXX XXXX XXXX 1234",
                "Statement Period: 05 Sep 2025 - 04 Oct 2025",
                "Payment Due Date: 20 Oct 2025",
                "Total Amount Due: Rs. 25,500.00"
        );
        IciciInstitutionProfile profile = new IciciInstitutionProfile();

        assertTrue(profile.validate(text));
        Map<FieldName, String> fields = profile.extractAll(text);
        assertEquals("AYUSH KARANI", fields.get(FieldName.CARD_HOLDER));
        assertEquals("1234", fields.get(FieldName.LAST_4_DIGITS));
        assertEquals("05 Sep 2025 - 04 Oct 2025", fields.get(FieldName.BILLING_CYCLE));
        assertEquals("20 Oct 2025", fields.get(FieldName.PAYMENT_DUE_DATE));
        assertEquals("₹25,500.00", fields.get(FieldName.TOTAL_AMOUNT_DUE));
    }

    @Test
    void sbiSample() {
        String text = String.join("\n",
                "SBI Card Statement",
                "Card Holder: AYUSH KARANI",
                "Card Number: XXXX XXXX XXXX 5678",
                "Billing Cycle: 10 Sep 2025 - 09 Oct 2025",
                "Due Date: 25 Oct 2025",
                "Total Amount Due: Rs. 18,200.00"
        );
        SbiInstitutionProfile profile = new SbiInstitutionProfile();

        assertTrue(profile.validate(text));
        Map<FieldName, String> fields = profile.extractAll(text);
        assertEquals("AYUSH KARANI", fields.get(FieldName.CARD_HOLDER));
        assertEquals("5678", fields.get(FieldName.LAST_4_DIGITS));
        assertEquals("10 Sep 2025 - 09 Oct 2025", fields.get(FieldName.BILLING_CYCLE));
        assertEquals("25 Oct 2025", fields.get(FieldName.PAYMENT_DUE_DATE));
        assertEquals("₹18,200.00", fields.get(FieldName.TOTAL_AMOUNT_DUE));
    }

    @Test
    void axisSample() {
        String text = String.join("\n",
                "Axis Bank Credit Card Statement",
                "Customer Name: AYUSH KARANI",
                "Card Number: XXXX XXXX XXXX 9012",
                "Statement Period: 15 Sep 2025 - 14 Oct 2025",
                "Payment Due Date: 30 Oct 2025",
                "Total Amount Due: Rs. 32,450.00"
        );
        AxisInstitutionProfile profile = new AxisInstitutionProfile();

        assertTrue(profile.validate(text));
        Map<FieldName, String> fields = profile.extractAll(text);
        assertEquals("AYUSH KARANI", fields.get(FieldName.CARD_HOLDER));
        assertEquals("9012", fields.get(FieldName.LAST_4_DIGITS));
        assertEquals("15 Sep 2025 - 14 Oct 2025", fields.get(FieldName.BILLING_CYCLE));
        assertEquals("30 Oct 2025", fields.get(FieldName.PAYMENT_DUE_DATE));
        assertEquals("₹32,450.00", fields.get(FieldName.TOTAL_AMOUNT_DUE));
    }

    @Test
    void axisRequiresCurrencyBeforeAmount() {
        String text = String.join("\n",
                "Axis Bank",
                "Total Amount Due: 32,450.00"
        );

        assertNull(new AxisInstitutionProfile().extractAll(text).get(FieldName.TOTAL_AMOUNT_DUE));
    }

    @Test
    void americanExpressSample() {
        String text = String.join("\n",
                "American Express Statement",
                "Card Member: AYUSH KARANI",
                "Account ending: 3456",
                "Statement Period: 01 Sep 2025 - 30 Sep 2025",
                "Payment Due: 20 Oct 2025",
                "Total Amount Due: Rs. 45,000.00"
        );
        AmericanExpressInstitutionProfile profile = new AmericanExpressInstitutionProfile();

        assertTrue(profile.validate(text));
        Map<FieldName, String> fields = profile.extractAll(text);
        assertEquals("AYUSH KARANI", fields.get(FieldName.CARD_HOLDER));
        assertEquals("3456", fields.get(FieldName.LAST_4_DIGITS));
        assertEquals("01 Sep 2025 - 30 Sep 2025", fields.get(FieldName.BILLING_CYCLE));
        assertEquals("20 Oct 2025", fields.get(FieldName.PAYMENT_DUE_DATE));
        assertEquals("₹45,000.00", fields.get(FieldName.TOTAL_AMOUNT_DUE));
    }

    @Test
    void minimumAmountDueIsNeverTakenAsTotal() {
        String text = String.join("\n",
                "ICICI Bank",
                "Minimum Amount Due: Rs. 500.00"
        );

        assertNull(new IciciInstitutionProfile().extractAll(text).get(FieldName.TOTAL_AMOUNT_DUE));
    }

    @Test
    void minimumAmountDueWithWideGapIsNeverTakenAsTotal() {
        List<KeywordInstitutionProfile> profiles = List.of(
                new HdfcInstitutionProfile(),
                new IciciInstitutionProfile(),
                new SbiInstitutionProfile(),
                new AxisInstitutionProfile(),
                new AmericanExpressInstitutionProfile());

        for (KeywordInstitutionProfile profile : profiles) {
            String text = String.join("\n",
                    profile.issuerName(),
                    "Minimum  Amount Due: Rs. 500.00",
                    "Minimum\tAmount Due: Rs. 600.00"
            );
            assertNull(profile.extractAll(text).get(FieldName.TOTAL_AMOUNT_DUE), profile.issuerName());
        }
    }

    @Test
    void dateFollowedByLongBlankRunIsRejectedQuickly() {
        List<KeywordInstitutionProfile> profiles = List.of(
                new HdfcInstitutionProfile(),
                new IciciInstitutionProfile(),
                new SbiInstitutionProfile(),
                new AxisInstitutionProfile(),
                new AmericanExpressInstitutionProfile());
        String tail = "01 Sep 2025" + " ".repeat(10_000) + "x";

        for (KeywordInstitutionProfile profile : profiles) {
            String text = String.join("\n",
                    profile.issuerName(),
                    "Statement Period: " + tail,
                    "Billing Cycle: " + tail,
                    tail
            );
            Map<FieldName, String> fields = assertTimeoutPreemptively(Duration.ofSeconds(2),
                    () -> profile.extractAll(text), profile.issuerName());
            assertNull(fields.get(FieldName.BILLING_CYCLE), profile.issuerName());
        }
    }

    @Test
    void axisRangeNeedsDashOrTo() {
        AxisInstitutionProfile profile = new AxisInstitutionProfile();

        assertNull(profile.extractAll("Axis Bank\nStatement Period: 15 Sep 2025 14 Oct 2025")
                .get(FieldName.BILLING_CYCLE));
        assertEquals("15 Sep 2025 to 14 Oct 2025",
                profile.extractAll("Axis Bank\nStatement Period: 15 Sep 2025 to 14 Oct 2025")
                        .get(FieldName.BILLING_CYCLE));
    }

    @Test
    void americanExpressRangeNeedsDashOrTo() {
        AmericanExpressInstitutionProfile profile = new AmericanExpressInstitutionProfile();

        assertNull(profile.extractAll("American Express\nStatement Period: 01 Sep 2025 30 Sep 2025")
                .get(FieldName.BILLING_CYCLE));
    }

    @Test
    void misterSalutationWinsOverEarlierMs() {
        String text = String.join("\n",
                "ICICI Bank",
                "Ms. ANITA RAO",
                "Mr. RAVI KUMAR",
                ""
        );

        assertEquals("RAVI KUMAR", new IciciInstitutionProfile().extractAll(text).get(FieldName.CARD_HOLDER));
    }

    @Test
    void cardWordInsideNameDoesNotEndIt() {
        assertEquals("RICARDO SILVA", new IciciInstitutionProfile()
                .extractAll("ICICI Bank\nName on Card: RICARDO SILVA\n").get(FieldName.CARD_HOLDER));
        assertEquals("RICARDO SILVA", new SbiInstitutionProfile()
                .extractAll("SBI Card\nCard Holder: RICARDO SILVA\n").get(FieldName.CARD_HOLDER));
        assertEquals("RICARDO SILVA", new AxisInstitutionProfile()
                .extractAll("Axis Bank\nCard Holder: RICARDO SILVA\n").get(FieldName.CARD_HOLDER));
        assertEquals("RICARDO SILVA", new AmericanExpressInstitutionProfile()
                .extractAll("American Express\nCard Member: RICARDO SILVA\n").get(FieldName.CARD_HOLDER));
    }

    @Test
    void validatorsDoNotOverlapOnSingleIssuerText() {
        String sbi = "SBI Card Statement";

        assertTrue(new SbiInstitutionProfile().validate(sbi));
        assertFalse(new HdfcInstitutionProfile().validate(sbi));
        assertFalse(new IciciInstitutionProfile().validate(sbi));
        assertFalse(new AxisInstitutionProfile().validate(sbi));
        assertFalse(new AmericanExpressInstitutionProfile().validate(sbi));
    }

    @Test
    void profileWithoutRulesForAFieldFailsFast() {
        Map<FieldName, List<PatternRule>> tables = Map.of(
                FieldName.CARD_HOLDER, List.of(PatternRule.single("Name", "Name:\\s*(\\w+)"))
        );

        assertThrows(IllegalStateException.class, () -> new KeywordInstitutionProfile("Test Bank", List.of("test bank"), tables) {
        });
    }

    @Test
    void profileWithoutKeywordsIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new KeywordInstitutionProfile("Test Bank", List.of(), Map.of()) {
                });
    }
}
