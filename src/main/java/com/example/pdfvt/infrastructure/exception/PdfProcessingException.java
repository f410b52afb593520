package com.example.pdfvt.infrastructure.exception;

/**
 * Signals that a PDF could not be written, or an upload could not be buffered to disk.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox or I/O exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
