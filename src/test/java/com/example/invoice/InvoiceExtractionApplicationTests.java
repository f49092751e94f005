package com.example.invoice;

import com.example.invoice.application.service.ExtractionPipeline;
import com.example.invoice.domain.model.ExtractedInvoice;
import com.example.invoice.infrastructure.ocr.DisabledOcrEngine;
import com.example.invoice.infrastructure.ocr.OcrEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class InvoiceExtractionApplicationTests {

    @Autowired
    private OcrEngine ocrEngine;

    @Autowired
    private ExtractionPipeline extractionPipeline;

    @Test
    void contextLoadsWithOcrDisabled() {
        assertThat(ocrEngine).isInstanceOf(DisabledOcrEngine.class);
    }

    @Test
    void unreadableDocumentStillYieldsOneRecord() {
        byte[] garbage = "not a document".getBytes(StandardCharsets.UTF_8);

        ExtractedInvoice invoice = extractionPipeline.extract(garbage, "garbage.bin", "Jean Dupont");

        assertThat(invoice.capturedAt()).isNotEmpty();
        assertThat(invoice.clientName()).isEqualTo("Jean Dupont");
        assertThat(invoice.invoiceNumber()).isEmpty();
        assertThat(invoice.totalIncludingTax()).isEmpty();
    }
}
