package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the buyer name written after a "Facturé à" or "Client" label.
 * The value is the rest of the logical line following the label; there is no unlabelled fallback.
 */
public class ClientNameMatcher implements FieldMatcher {

    private static final Pattern LABEL_PATTERN = Pattern.compile(
            "(?:(?<![\\p{L}\\p{N}])factur(?:é|ée|ee)\\s+à|(?<![\\p{L}\\p{N}])client[:\\s])[:\\s]*([^\\r\\n]+)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    @Override
    public InvoiceField field() {
        return InvoiceField.CLIENT_NAME;
    }

    @Override
    public Optional<String> tryMatch(String text) {
        Matcher matcher = LABEL_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1).strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
