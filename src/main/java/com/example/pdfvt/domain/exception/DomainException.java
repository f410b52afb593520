package com.example.pdfvt.domain.exception;

/**
 * Base type for all domain-level exceptions in the PDF/VT model.
 * Subclasses describe caller mistakes; a malformed document is never reported through this hierarchy.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of what the caller got wrong
	 */
    protected DomainException(String message) {
        super(message);
    }
}
