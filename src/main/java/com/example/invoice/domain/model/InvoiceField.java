package com.example.invoice.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Domain enumeration of the attributes of an {@link ExtractedInvoice}.
 * Each constant carries the column name used by the tabular export, so the record, the matchers and
 * the export stay in lockstep.
 */
public enum InvoiceField {
    CAPTURED_AT("Timestamp", ExtractedInvoice::capturedAt),
    CLIENT_NAME("Nom", ExtractedInvoice::clientName),
    SUPPLIER_NAME("NomFournisseur", ExtractedInvoice::supplierName),
    INVOICE_DATE("DateFacture", ExtractedInvoice::invoiceDate),
    INVOICE_NUMBER("NumFacture", ExtractedInvoice::invoiceNumber),
    TOTAL_EXCLUDING_TAX("TotalHT", ExtractedInvoice::totalExcludingTax),
    TOTAL_INCLUDING_TAX("TotalTTC", ExtractedInvoice::totalIncludingTax),
    TAX_AMOUNT("TVA", ExtractedInvoice::taxAmount);

    private final String columnName;
    private final Function<ExtractedInvoice, String> accessor;

    InvoiceField(String columnName, Function<ExtractedInvoice, String> accessor) {
        this.columnName = columnName;
        this.accessor = accessor;
    }

    public String columnName() {
        return columnName;
    }

	/**
	 * Reads this field from an extracted record.
	 *
	 * @param invoice record to read
	 * @return field value, empty when the field was not found
	 */
    public String valueOf(ExtractedInvoice invoice) {
        return accessor.apply(invoice);
    }

	/**
	 * Lists the export column names in declaration order.
	 *
	 * @return header cells for the tabular export
	 */
    public static List<String> columnNames() {
        return Arrays.stream(values()).map(InvoiceField::columnName).toList();
    }
}
