package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;

import java.util.Optional;

/**
 * Exposes the tax-exclusive (HT) total chosen by {@link TotalsScanner}.
 */
public class TotalExcludingTaxMatcher implements FieldMatcher {

    @Override
    public InvoiceField field() {
        return InvoiceField.TOTAL_EXCLUDING_TAX;
    }

    @Override
    public Optional<String> tryMatch(String text) {
        String total = TotalsScanner.scan(text).excludingTax();
        return total.isEmpty() ? Optional.empty() : Optional.of(total);
    }
}
