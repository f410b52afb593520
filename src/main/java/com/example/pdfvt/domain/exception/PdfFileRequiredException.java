package com.example.pdfvt.domain.exception;

/**
 * Raised when an upload-based compliance check arrives without a PDF file.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public PdfFileRequiredException() {
        super("Please choose a PDF file to check.");
    }
}
