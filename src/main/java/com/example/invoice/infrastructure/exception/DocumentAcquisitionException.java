package com.example.invoice.infrastructure.exception;

/**
 * Signals that the text of one specific document could not be obtained: corrupt or unsupported file,
 * undecodable image, or an OCR failure on that document.
 * Callers recover by extracting from empty text.
 */
public class DocumentAcquisitionException extends InfrastructureException {

    public DocumentAcquisitionException(String message) {
        super(message);
    }

	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox, ImageIO or Tess4J.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level exception
	 */
    public DocumentAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
