package com.example.invoice.application.service;

import com.example.invoice.domain.exception.DocumentRequiredException;
import com.example.invoice.domain.model.ExtractedInvoice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer service that runs the {@link ExtractionPipeline} over every uploaded file of a request.
 * Produces one record per file, in upload order, and is the place where a trusted client name is applied.
 */
@Service
public class InvoiceBatchService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceBatchService.class);

    private final ExtractionPipeline extractionPipeline;

    /**
     * @param extractionPipeline per-document pipeline
     */
    public InvoiceBatchService(ExtractionPipeline extractionPipeline) {
        this.extractionPipeline = extractionPipeline;
    }

    /**
     * Extracts every uploaded document.
     *
     * @param files      uploaded invoices
     * @param clientName trusted client name, optional
     * @return one record per file
     * @throws DocumentRequiredException when no file was uploaded
     */
    public List<ExtractedInvoice> extractAll(List<MultipartFile> files, String clientName) {
        if (files == null || files.isEmpty()) {
            throw new DocumentRequiredException();
        }

        List<ExtractedInvoice> invoices = new ArrayList<>(files.size());
        for (int index = 0; index < files.size(); index++) {
            MultipartFile file = files.get(index);
            String label = resolveLabel(file, index);
            invoices.add(extractionPipeline.extract(readBytes(file, label), label, clientName));
        }
        log.info("Extracted {} invoice(s)", invoices.size());
        return invoices;
    }

    /**
     * Reads the upload; an unreadable upload is passed on as missing content so that it still yields a record.
     *
     * @param file  uploaded file
     * @param label document label
     * @return file bytes, or {@code null} when they cannot be read
     */
    private byte[] readBytes(MultipartFile file, String label) {
        if (file == null) {
            return null;
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            log.warn("Unable to read the upload '{}'", label, e);
            return null;
        }
    }

    /**
     * Determines the label shown in logs for a document.
     *
     * @param file  uploaded file
     * @param index position of the file in the request
     * @return original file name, or {@code file_<index>}
     */
    private String resolveLabel(MultipartFile file, int index) {
        String fileName = file != null ? file.getOriginalFilename() : null;
        if (fileName == null || fileName.isBlank()) {
            return "file_" + index;
        }
        return fileName;
    }
}
