package com.example.invoice.domain.matcher;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Visits every "Total" label of a document and sorts the amounts into tax-exclusive and tax-inclusive totals.
 * <p>
 * The qualifier is read from the few characters that precede each amount on its label's line: {@code TTC} wins over
 * {@code HT}. An unqualified total is taken as tax-inclusive, but only while no tax-inclusive total is known yet.
 * That default is a layout heuristic (receipts foreground the amount due), not a checked business rule.
 */
public final class TotalsScanner {

    static final int QUALIFIER_WINDOW = 15;

    private static final Pattern TOTAL_PATTERN = Pattern.compile(
            "(?<![\\p{L}\\p{N}])total\\h*(?:TTC|HT)?[:\\s]*((?:€\\h?)?\\d(?:[\\d.,\\h]*\\d)?(?:\\h?€)?)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private TotalsScanner() {
    }

    /**
     * Scans the text for totals.
     *
     * @param text raw document text
     * @return totals found, with empty strings for the missing ones
     */
    public static Totals scan(String text) {
        String excludingTax = "";
        String includingTax = "";
        Matcher matcher = TOTAL_PATTERN.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(1).strip();
            String window = qualifierWindow(text, matcher.start(), matcher.start(1));
            if (window.contains("TTC")) {
                includingTax = value;
            } else if (window.contains("HT")) {
                excludingTax = value;
            } else if (includingTax.isEmpty()) {
                includingTax = value;
            }
        }
        return new Totals(excludingTax, includingTax);
    }

    private static String qualifierWindow(String text, int labelStart, int valueStart) {
        int lineStart = Math.max(text.lastIndexOf('\n', labelStart - 1), text.lastIndexOf('\r', labelStart - 1)) + 1;
        int from = Math.max(lineStart, valueStart - QUALIFIER_WINDOW);
        return text.substring(from, valueStart).toUpperCase(Locale.ROOT);
    }

    /**
     * Totals of one document.
     *
     * @param excludingTax total before tax ("HT"), possibly empty
     * @param includingTax total after tax ("TTC"), possibly empty
     */
    public record Totals(String excludingTax, String includingTax) {
    }
}
