package com.cardparser.backend.services.statements.rules;

/**
 * Regex fragments shared by the institution rule tables.
 * Capturing fragments are marked; everything else is non-capturing.
 */
public final class RulePatterns {

    private RulePatterns() {
    }

    /** "Rs.", "Rs", "INR", "$" or the rupee sign. */
    public static final String CURRENCY = "(?:\\$|Rs\\.?|INR|\u20B9)";

    /** Capturing: "14,820.00", "1,05,000", "250.5". */
    public static final String AMOUNT = "([\\d,]+\\.?\\d*)";

    /** "15 Oct 2025", "1 September 2025". */
    public static final String TEXT_DATE = "\\d{1,2}\\s+[A-Za-z]{3,9}\\s+\\d{4}";

    /** Month abbreviated to three letters only: "15 Oct 2025". */
    public static final String SHORT_TEXT_DATE = "\\d{1,2}\\s+[A-Za-z]{3}\\s+\\d{4}";

    /** "15/10/2025", "15-10-2025". */
    public static final String NUMERIC_DATE = "\\d{1,2}[/-]\\d{1,2}[/-]\\d{4}";

    /**
     * Dash (hyphen or en dash), "to" or whitespace between two range endpoints.
     * Possessive so a date followed by a long blank run fails in linear time.
     */
    public static final String RANGE_JOINER = "[-\u2013to\\s]++";

    /** Like {@link #RANGE_JOINER} but a dash or "to" must be present; whitespace alone does not join. */
    public static final String SEPARATED_RANGE_JOINER = "\\s*+[-\u2013to]++\\s*+";

    /** Dash-only joiner for bare ranges with no leading label. */
    public static final String DASH_JOINER = "\\s*+[-\u2013]++\\s*+";

    /** Separator between a label and its value: colon and/or whitespace. */
    public static final String SEP = "[:\\s]++";

    /** Placed before "Amount Due" so "Minimum Amount Due" is never taken as the total. */
    public static final String NOT_MINIMUM = "(?<!Minimum\\s{1,5})";

    /** Capturing: an upper-case name lazily up to the next terminator. */
    public static final String NAME = "([A-Z][A-Z\\s]+?)";

    /** Masking characters used in printed card numbers. */
    public static final String MASK = "[X\\*]";

    /** Capturing: the four trailing digits. */
    public static final String LAST4 = "(\\d{4})";

    public static String textDateRange() {
        return "(" + TEXT_DATE + RANGE_JOINER + TEXT_DATE + ")";
    }

    public static String shortTextDateRange() {
        return "(" + SHORT_TEXT_DATE + SEPARATED_RANGE_JOINER + SHORT_TEXT_DATE + ")";
    }

    public static String bareTextDateRange(String date) {
        return "(" + date + DASH_JOINER + date + ")";
    }

    /** Label followed by an optional currency marker and a captured amount. */
    public static String amountAfter(String label) {
        return label + SEP + CURRENCY + "?\\s*+" + AMOUNT;
    }

    /** Label followed by a mandatory currency marker and a captured amount. */
    public static String amountAfterCurrency(String label) {
        return label + SEP + CURRENCY + "\\s*+" + AMOUNT;
    }
}
