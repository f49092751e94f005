package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered set of field matchers run against each document.
 * Matchers can be added or removed through {@link #with(FieldMatcher)} and {@link #without(InvoiceField)} without
 * touching the code that runs them.
 */
public final class PatternCatalog {

    private final List<FieldMatcher> matchers;

    public PatternCatalog(List<FieldMatcher> matchers) {
        this.matchers = List.copyOf(Objects.requireNonNull(matchers, "matchers"));
    }

    /**
     * Builds the default catalog covering every extracted invoice field.
     *
     * @return catalog with the date, number, supplier, client, totals and tax matchers
     */
    public static PatternCatalog standard() {
        return new PatternCatalog(List.of(
                new DateMatcher(),
                new InvoiceNumberMatcher(),
                new SupplierNameMatcher(),
                new ClientNameMatcher(),
                new TotalExcludingTaxMatcher(),
                new TotalIncludingTaxMatcher(),
                new TaxAmountMatcher()
        ));
    }

    public List<FieldMatcher> matchers() {
        return matchers;
    }

    /**
     * @param matcher matcher appended after the existing ones
     * @return new catalog
     */
    public PatternCatalog with(FieldMatcher matcher) {
        List<FieldMatcher> copy = new ArrayList<>(matchers);
        copy.add(Objects.requireNonNull(matcher, "matcher"));
        return new PatternCatalog(copy);
    }

    /**
     * @param field field whose matchers are dropped
     * @return new catalog
     */
    public PatternCatalog without(InvoiceField field) {
        return new PatternCatalog(matchers.stream()
                .filter(matcher -> matcher.field() != field)
                .toList());
    }
}
