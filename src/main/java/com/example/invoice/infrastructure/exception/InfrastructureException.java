package com.example.invoice.infrastructure.exception;

/**
 * Base unchecked exception for the document adapters: PDF parsing, image decoding and the OCR engine.
 * Subclasses tell the pipeline whether one document or the whole process is affected.
 */
public abstract class InfrastructureException extends RuntimeException {

    protected InfrastructureException(String message) {
        super(message);
    }

	/**
	 * @param message what could not be read or loaded
	 * @param cause   PDFBox, ImageIO or Tess4J failure
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
