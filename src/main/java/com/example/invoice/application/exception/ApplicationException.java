package com.example.invoice.application.exception;

/**
 * Base unchecked exception for failures of the extraction and export use cases.
 * Independent from the HTTP transport and from the OCR/PDF adapters.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message error description that can be shown to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
