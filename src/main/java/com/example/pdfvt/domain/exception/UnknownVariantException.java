package com.example.pdfvt.domain.exception;

/**
 * Raised when a caller names a PDF/VT variant that has no registered profile.
 */
public class UnknownVariantException extends DomainException {

    public UnknownVariantException(String variant) {
        super("Unknown PDF/VT variant: " + variant + ". Supported: VT1, VT3.");
    }
}
