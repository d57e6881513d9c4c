package com.cardparser.backend.services.statements.profiles;

import static com.cardparser.backend.services.statements.rules.RulePatterns.AMOUNT;
import static com.cardparser.backend.services.statements.rules.RulePatterns.CURRENCY;
import static com.cardparser.backend.services.statements.rules.RulePatterns.LAST4;
import static com.cardparser.backend.services.statements.rules.RulePatterns.MASK;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NAME;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NOT_MINIMUM;
import static com.cardparser.backend.services.statements.rules.RulePatterns.NUMERIC_DATE;
import static com.cardparser.backend.services.statements.rules.RulePatterns.SEP;
import static com.cardparser.backend.services.statements.rules.RulePatterns.TEXT_DATE;
import static com.cardparser.backend.services.statements.rules.RulePatterns.amountAfter;
import static com.cardparser.backend.services.statements.rules.RulePatterns.bareTextDateRange;
import static com.cardparser.backend.services.statements.rules.RulePatterns.textDateRange;

import java.util.List;
import java.util.Map;

import com.cardparser.backend.services.statements.rules.FieldName;
import com.cardparser.backend.services.statements.rules.PatternRule;

/**
 * ICICI Bank statements. The primary holder is printed as "Card Member".
 */
public class IciciInstitutionProfile extends KeywordInstitutionProfile {

    public static final String ISSUER = "ICICI Bank";

    static final List<String> KEYWORDS = List.of(
            "ICICI Bank",
            "ICICI Credit Card",
            "www.icicibank.com"
    );

    private static final String NAME_END = "(?:\\n|\\bCard\\b|\\bNumber\\b|\\d)";
    private static final String ANY_DATE = "(" + TEXT_DATE + "|" + NUMERIC_DATE + ")";

    static final List<PatternRule> CARD_HOLDER = List.of(
            PatternRule.single("Card Member", "Card\\s+Member" + SEP + NAME + NAME_END),
            PatternRule.single("Card Holder", "Card\\s*Holder(?:\\s+Name)?" + SEP + NAME + NAME_END),
            PatternRule.single("Name on Card", "Name\\s+on\\s+Card" + SEP + NAME + NAME_END),
            PatternRule.single("Customer Name", "Customer\\s+Name" + SEP + NAME + NAME_END),
            PatternRule.single("Dear", "Dear\\s+" + NAME + "(?:,|\\n)"),
            PatternRule.single("Mr.", "\\bMr\\.?\\s+" + NAME + "(?:\\n|,)"),
            PatternRule.single("Ms.", "\\bMs\\.?\\s+" + NAME + "(?:\\n|,)"),
            PatternRule.single("Mrs.", "\\bMrs\\.?\\s+" + NAME + "(?:\\n|,)")
    );

    static final List<PatternRule> LAST_4_DIGITS = List.of(
            PatternRule.single("Card Number", "Card\\s+(?:Number|No\\.?)" + SEP + "(?:X+\\s*)*+" + LAST4),
            PatternRule.single("Masked groups", "(?:" + MASK + "{4}\\s*){3}" + LAST4),
            PatternRule.single("Masked run", MASK + "{12}" + LAST4),
            PatternRule.single("ending with/in", "ending\\s+(?:with\\s+|in\\s+)?" + LAST4),
            PatternRule.lastOfGroups("Full card number", "(\\d{4})\\s+(\\d{4})\\s+(\\d{4})\\s+(\\d{4})")
    );

    static final List<PatternRule> BILLING_CYCLE = List.of(
            PatternRule.single("Statement Period", "Statement\\s+Period" + SEP + textDateRange()),
            PatternRule.single("Billing Cycle/Period", "Billing\\s+(?:Cycle|Period)" + SEP + textDateRange()),
            PatternRule.joinedPair("From/To",
                    "From" + SEP + "(" + NUMERIC_DATE + ")\\s+To" + SEP + "(" + NUMERIC_DATE + ")"),
            PatternRule.single("Bare date range", bareTextDateRange(TEXT_DATE))
    );

    static final List<PatternRule> PAYMENT_DUE_DATE = List.of(
            PatternRule.single("Payment Due Date", "Payment\\s+Due\\s+Date" + SEP + "(" + TEXT_DATE + ")"),
            PatternRule.single("Payment Due Date (numeric)", "Payment\\s+Due\\s+Date" + SEP + "(" + NUMERIC_DATE + ")"),
            PatternRule.single("Due Date", "Due\\s+Date" + SEP + ANY_DATE),
            PatternRule.single("Pay by", "Pay\\s+by" + SEP + ANY_DATE)
    );

    static final List<PatternRule> TOTAL_AMOUNT_DUE = List.of(
            PatternRule.single("Total Amount Due", amountAfter("Total\\s+Amount\\s+Due")),
            PatternRule.single("Total Due", amountAfter("Total\\s+Due")),
            PatternRule.single("Amount Due", amountAfter(NOT_MINIMUM + "Amount\\s+Due")),
            PatternRule.single("Total Outstanding", amountAfter("Total\\s+Outstanding")),
            PatternRule.single("Amount before Total Due",
                    CURRENCY + "\\s*" + AMOUNT + "\\s+Total\\s+(?:Amount\\s+)?Due")
    );

    public IciciInstitutionProfile() {
        super(ISSUER, KEYWORDS, Map.of(
                FieldName.CARD_HOLDER, CARD_HOLDER,
                FieldName.LAST_4_DIGITS, LAST_4_DIGITS,
                FieldName.BILLING_CYCLE, BILLING_CYCLE,
                FieldName.PAYMENT_DUE_DATE, PAYMENT_DUE_DATE,
                FieldName.TOTAL_AMOUNT_DUE, TOTAL_AMOUNT_DUE
        ));
    }
}
