package com.example.invoice.application.service;

import com.example.invoice.application.exception.CsvExportValidationException;
import com.example.invoice.domain.model.ExtractedInvoice;
import com.example.invoice.domain.model.InvoiceField;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that turns extracted invoices into a downloadable CSV table.
 * Columns follow {@link InvoiceField}, one row per invoice.
 */
@Service
public class CsvExportService {

	/**
	 * Runs validation and returns a CSV string containing the invoices.
	 *
	 * @param invoices extracted records, in output order
	 * @return CSV content ready to stream to the client
	 * @throws CsvExportValidationException when there is nothing to export
	 */
    public String export(List<ExtractedInvoice> invoices) {
        if (invoices == null || invoices.isEmpty()) {
            throw new CsvExportValidationException();
        }

        StringBuilder builder = new StringBuilder();
        builder.append(String.join(",", InvoiceField.columnNames())).append('\n');
        for (ExtractedInvoice invoice : invoices) {
            InvoiceField[] fields = InvoiceField.values();
            for (int i = 0; i < fields.length; i++) {
                if (i > 0) {
                    builder.append(',');
                }
                builder.append(escape(fields[i].valueOf(invoice)));
            }
            builder.append('\n');
        }
        return builder.toString();
    }

	/**
	 * Quotes a value when it holds a separator, a quote or a line break; embedded quotes are doubled.
	 *
	 * @param value raw column value, never {@code null} for an {@link ExtractedInvoice}
	 * @return CSV-safe token
	 */
    private String escape(String value) {
        boolean quoted = value.chars().anyMatch(ch -> ch == ',' || ch == '"' || ch == '\n' || ch == '\r');
        if (!quoted) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
