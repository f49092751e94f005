package com.example.invoice.domain.matcher;

import com.example.invoice.domain.model.InvoiceField;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PatternCatalogTest {

    @Test
    void standardCatalogCoversEveryExtractedField() {
        assertThat(PatternCatalog.standard().matchers())
                .extracting(FieldMatcher::field)
                .containsExactlyInAnyOrder(
                        InvoiceField.INVOICE_DATE,
                        InvoiceField.INVOICE_NUMBER,
                        InvoiceField.SUPPLIER_NAME,
                        InvoiceField.CLIENT_NAME,
                        InvoiceField.TOTAL_EXCLUDING_TAX,
                        InvoiceField.TOTAL_INCLUDING_TAX,
                        InvoiceField.TAX_AMOUNT);
    }

    @Test
    void withoutAndWithReturnModifiedCopies() {
        PatternCatalog standard = PatternCatalog.standard();
        FieldMatcher fixedSupplier = new FieldMatcher() {
            @Override
            public InvoiceField field() {
                return InvoiceField.SUPPLIER_NAME;
            }

            @Override
            public Optional<String> tryMatch(String text) {
                return Optional.of("Fixed");
            }
        };

        PatternCatalog replaced = standard.without(InvoiceField.SUPPLIER_NAME).with(fixedSupplier);

        assertThat(standard.matchers()).hasSize(7);
        assertThat(replaced.matchers()).hasSize(7);
        assertThat(replaced.matchers().get(6)).isSameAs(fixedSupplier);
        assertThat(replaced.matchers()).filteredOn(m -> m instanceof SupplierNameMatcher).isEmpty();
    }
}
