package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the invoice identifier that follows an "Invoice"/"Facture" label (with a number sign, colon, dash or
 * "N°" marker, in any order) or a standalone "No"/"N°" label. Only the first label occurrence in the text is considered.
 */
public class InvoiceNumberMatcher implements FieldMatcher {

    // "N°", "Nº", "No." or a bare "No" that does not start a word such as "Nombre"
    private static final String NUMBER_MARKER = "(?:n[°º]\\.?|no\\.|no(?!\\p{L}))";
    private static final Pattern LABEL_PATTERN = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?:invoice|facture)\\s*(?:(?:[#:\\-]\\s*)?(?:" + NUMBER_MARKER + "|#)\\s*[#:\\-]?|[#:\\-])"
                    + "|(?<![\\p{L}\\p{N}])" + NUMBER_MARKER + "(?=[\\s:#\\-])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern TOKEN_PATTERN = Pattern.compile("[\\s:#\\-]*([A-Za-z0-9][A-Za-z0-9\\-/_.]*)");

    @Override
    public InvoiceField field() {
        return InvoiceField.INVOICE_NUMBER;
    }

    @Override
    public Optional<String> tryMatch(String text) {
        Matcher label = LABEL_PATTERN.matcher(text);
        if (!label.find()) {
            return Optional.empty();
        }
        Matcher token = TOKEN_PATTERN.matcher(text);
        token.region(label.end(), text.length());
        if (!token.lookingAt()) {
            return Optional.empty();
        }
        return Optional.of(token.group(1));
    }
}
