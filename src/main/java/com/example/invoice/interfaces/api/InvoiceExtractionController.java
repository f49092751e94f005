package com.example.invoice.interfaces.api;

import com.example.invoice.application.service.CsvExportService;
import com.example.invoice.application.service.FieldExtractor;
import com.example.invoice.application.service.InvoiceBatchService;
import com.example.invoice.domain.model.ExtractedInvoice;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Interfaces-layer REST controller exposing invoice extraction and CSV export.
 */
@RestController
public class InvoiceExtractionController {

    private static final DateTimeFormatter EXPORT_FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final InvoiceBatchService invoiceBatchService;
    private final FieldExtractor fieldExtractor;
    private final CsvExportService csvExportService;
    private final Clock clock;

    /**
     * Creates the controller with the required application services.
     *
     * @param invoiceBatchService service extracting uploaded documents
     * @param fieldExtractor      engine used for text submitted directly
     * @param csvExportService    service responsible for CSV generation
     * @param clock               clock used to name export files
     */
    public InvoiceExtractionController(InvoiceBatchService invoiceBatchService,
                                       FieldExtractor fieldExtractor,
                                       CsvExportService csvExportService,
                                       Clock clock) {
        this.invoiceBatchService = invoiceBatchService;
        this.fieldExtractor = fieldExtractor;
        this.csvExportService = csvExportService;
        this.clock = clock;
    }

    /**
     * Extracts every uploaded invoice.
     *
     * @param files      uploaded PDFs or images
     * @param clientName trusted client name overriding the one found in the documents (optional)
     * @return one record per file, in upload order
     */
    @PostMapping(value = "/api/invoices/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ExtractedInvoice> extract(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                          @RequestParam(value = "clientName", required = false) String clientName) {
        return invoiceBatchService.extractAll(files, clientName);
    }

    /**
     * Runs the field extraction on text the caller already has.
     *
     * @param request text, label and optional client name
     * @return extracted record
     */
    @PostMapping(value = "/api/invoices/extract-text",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ExtractedInvoice extractText(@RequestBody TextExtractionRequest request) {
        String label = request.label() == null || request.label().isBlank() ? "text" : request.label();
        return fieldExtractor.extractInvoiceFields(request.text(), label, request.clientName());
    }

    /**
     * Extracts every uploaded invoice and streams the result as a CSV download.
     *
     * @param files      uploaded PDFs or images
     * @param clientName trusted client name (optional)
     * @return CSV document as a {@link ResponseEntity}
     */
    @PostMapping("/api/invoices/export")
    public ResponseEntity<byte[]> export(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                         @RequestParam(value = "clientName", required = false) String clientName) {
        List<ExtractedInvoice> invoices = invoiceBatchService.extractAll(files, clientName);
        String csv = csvExportService.export(invoices);
        String fileName = "invoices_" + EXPORT_FILE_STAMP.format(clock.instant()) + ".csv";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(TEXT_CSV)
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping(value = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
