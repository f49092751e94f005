package com.example.invoice.application.service;

import com.example.invoice.application.exception.CsvExportValidationException;
import com.example.invoice.domain.model.ExtractedInvoice;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvExportServiceTest {

    private final CsvExportService service = new CsvExportService();

    @Test
    void writesHeaderAndOneRowPerInvoice() {
        ExtractedInvoice invoice = new ExtractedInvoice("2024-03-14T10:15:30Z", "Jean Dupont", "ACME SARL",
                "14/03/2024", "INV-2024-0091", "100,00€", "120,00€", "20%");

        String csv = service.export(List.of(invoice, ExtractedInvoice.empty("2024-03-14T10:15:31Z")));

        assertThat(csv.split("\n")).containsExactly(
                "Timestamp,Nom,NomFournisseur,DateFacture,NumFacture,TotalHT,TotalTTC,TVA",
                "2024-03-14T10:15:30Z,Jean Dupont,ACME SARL,14/03/2024,INV-2024-0091,\"100,00€\",\"120,00€\",20%",
                "2024-03-14T10:15:31Z,,,,,,,");
    }

    @Test
    void quotesValuesWithSeparatorsOrQuotes() {
        ExtractedInvoice invoice = new ExtractedInvoice("t", "Dupont, \"Jean\"", "Line\r\nBreak", "", "", "", "", "");

        String row = service.export(List.of(invoice)).split("\n", 2)[1];

        assertThat(row).startsWith("t,\"Dupont, \"\"Jean\"\"\",\"Line\r\nBreak\",");
    }

    @Test
    void emptyListIsRejected() {
        assertThatThrownBy(() -> service.export(List.of()))
                .isInstanceOf(CsvExportValidationException.class)
                .hasMessage("No extracted invoices available for export.");
    }
}
