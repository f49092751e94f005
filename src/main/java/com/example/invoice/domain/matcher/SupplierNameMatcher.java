package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the issuer of the invoice.
 * A labelled value (Fournisseur, Société, Vendeur, Émetteur) wins; without any label the first substantive line
 * of the document is used, since issuers usually print their name unlabelled at the top.
 */
public class SupplierNameMatcher implements FieldMatcher {

    private static final Pattern LABEL_PATTERN = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?:fournisseur|soci[eé]t[eé]|vendeur|[ée]metteur)[:\\s]*([^\\r\\n]+)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern EXCLUDED_WORDS = Pattern.compile("facture|total|tva|client", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final int MIN_FALLBACK_LENGTH = 4;

    @Override
    public InvoiceField field() {
        return InvoiceField.SUPPLIER_NAME;
    }

    @Override
    public Optional<String> tryMatch(String text) {
        Matcher matcher = LABEL_PATTERN.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(1).strip();
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return firstSubstantiveLine(text);
    }

    /**
     * Picks the first line that is long enough and does not look like an invoice heading or total.
     *
     * @param text raw document text
     * @return trimmed line, or empty when none qualifies
     */
    private Optional<String> firstSubstantiveLine(String text) {
        for (String line : LINE_BREAK.split(text)) {
            String candidate = line.strip();
            if (candidate.length() >= MIN_FALLBACK_LENGTH && !EXCLUDED_WORDS.matcher(candidate).find()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
