package com.example.invoice.infrastructure.text;

import com.example.invoice.infrastructure.exception.DocumentAcquisitionException;
import com.example.invoice.infrastructure.exception.FatalConfigurationException;

/**
 * Turns the raw bytes of an invoice document (PDF or image) into flat text.
 */
public interface DocumentTextReader {

    /**
     * Reads the text of one document.
     *
     * @param content document bytes
     * @param label   document label used in logs and messages
     * @return extracted text, possibly empty
     * @throws FatalConfigurationException   when the OCR dependency is missing for the whole process
     * @throws DocumentAcquisitionException  when this particular document cannot be read
     */
    String readText(byte[] content, String label);
}
