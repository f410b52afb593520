package com.example.pdfvt.domain.exception;

/**
 * Raised when a caller attempts to check or generate a document without a {@link java.nio.file.Path}.
 */
public class PdfPathRequiredException extends DomainException {

    public PdfPathRequiredException() {
        super("PDF path is required.");
    }
}
