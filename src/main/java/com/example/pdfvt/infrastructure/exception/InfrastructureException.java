package com.example.pdfvt.infrastructure.exception;

/**
 * Unchecked failure raised by a PDFBox or file-system adapter. The low-level cause is always kept.
 */
public abstract class InfrastructureException extends RuntimeException {

    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }

	/**
	 * @return message of the innermost cause, or this exception's message when there is no cause
	 */
    public String rootCauseMessage() {
        Throwable root = this;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
