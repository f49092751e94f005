package com.example.invoice.application.service;

import com.example.invoice.domain.matcher.FieldMatcher;
import com.example.invoice.domain.matcher.PatternCatalog;
import com.example.invoice.domain.model.ExtractedInvoice;
import com.example.invoice.domain.model.InvoiceField;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Application-layer service that runs the {@link PatternCatalog} over one document's text and assembles the
 * resulting {@link ExtractedInvoice}.
 * Each matcher runs in isolation: a matcher that fails leaves its own field empty and nothing else.
 */
@Service
public class FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    private final PatternCatalog catalog;
    private final Clock clock;

    /**
     * Creates the extractor.
     *
     * @param catalog matchers to run, in order
     * @param clock   source of the capture timestamp
     */
    public FieldExtractor(PatternCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.clock = clock;
    }

    /**
     * Extracts the invoice fields from flat text. Never throws.
     *
     * @param text                raw document text, {@code null} treated as empty
     * @param label               document label used in logs
     * @param preferredClientName trusted client name overriding the heuristic one when not blank
     * @return exactly one record, fields empty when not found
     */
    public ExtractedInvoice extractInvoiceFields(String text, String label, String preferredClientName) {
        String source = text == null ? "" : text;
        Map<InvoiceField, String> values = new EnumMap<>(InvoiceField.class);
        for (FieldMatcher matcher : catalog.matchers()) {
            if (values.containsKey(matcher.field())) {
                continue;
            }
            runMatcher(matcher, source, label).ifPresent(value -> values.put(matcher.field(), value));
        }

        ExtractedInvoice invoice = new ExtractedInvoice(
                Instant.now(clock).toString(),
                values.get(InvoiceField.CLIENT_NAME),
                values.get(InvoiceField.SUPPLIER_NAME),
                values.get(InvoiceField.INVOICE_DATE),
                values.get(InvoiceField.INVOICE_NUMBER),
                values.get(InvoiceField.TOTAL_EXCLUDING_TAX),
                values.get(InvoiceField.TOTAL_INCLUDING_TAX),
                values.get(InvoiceField.TAX_AMOUNT)
        );
        if (preferredClientName != null && !preferredClientName.isBlank()) {
            invoice = invoice.withClientName(preferredClientName.strip());
        }

        log.info("Extracted {} field(s) from '{}' ({} chars of text)", values.size(), label, source.length());
        return invoice;
    }

    /**
     * Runs one matcher, turning any failure into "no match" for that field.
     *
     * @param matcher matcher to run
     * @param text    document text
     * @param label   document label used in logs
     * @return non-blank match, or empty
     */
    private Optional<String> runMatcher(FieldMatcher matcher, String text, String label) {
        try {
            Optional<String> match = matcher.tryMatch(text);
            return match == null ? Optional.empty() : match.filter(value -> !value.isBlank());
        } catch (RuntimeException ex) {
            log.warn("Matcher {} failed on '{}', leaving {} empty", matcher.name(), label, matcher.field(), ex);
            return Optional.empty();
        }
    }
}
