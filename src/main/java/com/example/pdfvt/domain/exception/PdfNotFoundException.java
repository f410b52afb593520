package com.example.pdfvt.domain.exception;

/**
 * Raised when a compliance check is requested for a path that does not exist.
 * This is the only failure of a check that aborts instead of becoming a diagnostic.
 */
public class PdfNotFoundException extends DomainException {

    private final String path;

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute or relative path that could not be resolved
	 */
    public PdfNotFoundException(String path) {
        super("PDF file not found: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
