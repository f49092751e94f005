package com.example.invoice.infrastructure.exception;

/**
 * Signals that the process cannot read any document because a required OCR dependency is missing
 * (native Tesseract library, tessdata directory or language data).
 * Never mapped to empty data: the operator has to fix the deployment.
 */
public class FatalConfigurationException extends InfrastructureException {

    public FatalConfigurationException(String message) {
        super(message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
