package com.example.pdfvt.domain.exception;

/**
 * Raised when an uploaded file does not look like a PDF by name or content type.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF uploads are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
