package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;

import java.util.Optional;

/**
 * Exposes the tax-inclusive (TTC) total chosen by {@link TotalsScanner}.
 */
public class TotalIncludingTaxMatcher implements FieldMatcher {

    @Override
    public InvoiceField field() {
        return InvoiceField.TOTAL_INCLUDING_TAX;
    }

    @Override
    public Optional<String> tryMatch(String text) {
        String total = TotalsScanner.scan(text).includingTax();
        return total.isEmpty() ? Optional.empty() : Optional.of(total);
    }
}
