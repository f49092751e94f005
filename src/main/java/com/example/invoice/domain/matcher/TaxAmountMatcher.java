package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the VAT value following a "TVA" label: digits with {@code .}/{@code ,} separators and an optional percent sign.
 */
public class TaxAmountMatcher implements FieldMatcher {

    private static final Pattern TAX_PATTERN = Pattern.compile("TVA[:\\s]*(\\d[\\d.,]{0,19}%?)", Pattern.CASE_INSENSITIVE);

    @Override
    public InvoiceField field() {
        return InvoiceField.TAX_AMOUNT;
    }

    @Override
    public Optional<String> tryMatch(String text) {
        Matcher matcher = TAX_PATTERN.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
