package com.example.invoice.application.exception;

/**
 * Raised when a CSV export is requested but no invoice could be collected for it.
 */
public class CsvExportValidationException extends ApplicationException {

    public CsvExportValidationException() {
        super("No extracted invoices available for export.");
    }
}
