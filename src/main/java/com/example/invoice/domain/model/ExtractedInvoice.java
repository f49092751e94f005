package com.example.invoice.domain.model;

/**
 * Domain DTO holding the fields extracted from a single invoice document.
 * Every attribute is plain text; a field that could not be found is an empty string, never {@code null}.
 * Returned from {@code FieldExtractor} and serialized as-is by the interfaces layer and the CSV export.
 */
public record ExtractedInvoice(
        String capturedAt,
        String clientName,
        String supplierName,
        String invoiceDate,
        String invoiceNumber,
        String totalExcludingTax,
        String totalIncludingTax,
        String taxAmount
) {

    public ExtractedInvoice {
        capturedAt = orEmpty(capturedAt);
        clientName = orEmpty(clientName);
        supplierName = orEmpty(supplierName);
        invoiceDate = orEmpty(invoiceDate);
        invoiceNumber = orEmpty(invoiceNumber);
        totalExcludingTax = orEmpty(totalExcludingTax);
        totalIncludingTax = orEmpty(totalIncludingTax);
        taxAmount = orEmpty(taxAmount);
    }

    /**
     * Creates a record with every extracted field left empty.
     *
     * @param capturedAt extraction timestamp
     * @return record carrying only the timestamp
     */
    public static ExtractedInvoice empty(String capturedAt) {
        return new ExtractedInvoice(capturedAt, "", "", "", "", "", "", "");
    }

    /**
     * Returns a copy whose client name is replaced by a trusted external value.
     *
     * @param trustedClientName name supplied by the caller
     * @return new record with the overridden client name
     */
    public ExtractedInvoice withClientName(String trustedClientName) {
        return new ExtractedInvoice(capturedAt, trustedClientName, supplierName, invoiceDate, invoiceNumber,
                totalExcludingTax, totalIncludingTax, taxAmount);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
