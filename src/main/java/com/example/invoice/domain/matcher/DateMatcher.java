package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first date-like token: day-first {@code DD/MM/YYYY} or year-first {@code YYYY-MM-DD},
 * with {@code /}, {@code -} or {@code .} as separator. The token is returned verbatim and never parsed.
 */
public class DateMatcher implements FieldMatcher {

    private static final Pattern DATE_PATTERN = Pattern.compile(
            "\\b(?:\\d{2}[/\\-.]\\d{2}[/\\-.]\\d{4}|\\d{4}[/\\-.]\\d{2}[/\\-.]\\d{2})\\b");

    @Override
    public InvoiceField field() {
        return InvoiceField.INVOICE_DATE;
    }

    @Override
    public Optional<String> tryMatch(String text) {
        Matcher matcher = DATE_PATTERN.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }
}
