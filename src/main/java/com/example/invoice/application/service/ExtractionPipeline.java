package com.example.invoice.application.service;

import com.example.invoice.domain.model.ExtractedInvoice;
import com.example.invoice.infrastructure.exception.DocumentAcquisitionException;
import com.example.invoice.infrastructure.exception.FatalConfigurationException;
import com.example.invoice.infrastructure.text.DocumentTextReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Application-layer service that turns one document into exactly one {@link ExtractedInvoice}.
 * Text acquisition failures specific to the document are absorbed and the fields come out empty;
 * only a {@link FatalConfigurationException} reaches the caller.
 */
@Service
public class ExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final DocumentTextReader documentTextReader;
    private final FieldExtractor fieldExtractor;

    /**
     * Creates the pipeline.
     *
     * @param documentTextReader collaborator that turns bytes into text
     * @param fieldExtractor     engine that turns text into fields
     */
    public ExtractionPipeline(DocumentTextReader documentTextReader, FieldExtractor fieldExtractor) {
        this.documentTextReader = documentTextReader;
        this.fieldExtractor = fieldExtractor;
    }

    /**
     * Reads and extracts one document.
     *
     * @param content             document bytes, may be {@code null} when the upstream read failed
     * @param label               document label used in logs
     * @param preferredClientName trusted client name, optional
     * @return extracted record, all fields empty when the text could not be read
     * @throws FatalConfigurationException when the OCR dependency is missing for the whole process
     */
    public ExtractedInvoice extract(byte[] content, String label, String preferredClientName) {
        String text = acquireText(content, label);
        return fieldExtractor.extractInvoiceFields(text, label, preferredClientName);
    }

    private String acquireText(byte[] content, String label) {
        try {
            String text = documentTextReader.readText(content, label);
            return text == null ? "" : text;
        } catch (FatalConfigurationException ex) {
            log.error("Server misconfiguration while reading '{}': {}", label, ex.getMessage());
            throw ex;
        } catch (DocumentAcquisitionException ex) {
            log.warn("Could not read '{}', extracting from empty text: {}", label, ex.getMessage(), ex);
            return "";
        } catch (RuntimeException ex) {
            log.error("Unexpected failure while reading '{}', extracting from empty text", label, ex);
            return "";
        }
    }
}
