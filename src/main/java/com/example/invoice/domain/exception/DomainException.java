package com.example.invoice.domain.exception;

/**
 * Root of the invoice domain's rejections.
 * Field matching itself never throws; subclasses only guard what a request hands to the domain.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message what the request was missing or got wrong
	 */
    protected DomainException(String message) {
        super(message);
    }
}
