package com.example.invoice.domain.exception;

/**
 * Raised when an extraction use case is invoked without any document to read.
 */
public class DocumentRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public DocumentRequiredException() {
        super("Please provide at least one invoice file.");
    }
}
