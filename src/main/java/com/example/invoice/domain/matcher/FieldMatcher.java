package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;

import java.util.Optional;

/**
 * Heuristic rule that extracts one named field from flat document text.
 * Implementations must be pure: no state is shared or mutated between invocations.
 */
public interface FieldMatcher {

    /**
     * @return field populated by this matcher
     */
    InvoiceField field();

    /**
     * @return stable name used in logs
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Probes the text for this matcher's field.
     *
     * @param text raw document text, never {@code null}
     * @return matched value, or empty when nothing usable was found
     */
    Optional<String> tryMatch(String text);
}
