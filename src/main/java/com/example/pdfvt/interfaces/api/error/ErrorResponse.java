package com.example.pdfvt.interfaces.api.error;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * JSON body returned by {@link GlobalExceptionHandler} for failed compliance or generation requests.
 *
 * @param timestamp when the failure was mapped
 * @param status    numeric HTTP status
 * @param error     stable error code such as {@code DOMAIN_ERROR}
 * @param message   explanation safe to show to the caller
 * @param path      request URI
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {
    static ErrorResponse of(HttpStatus status, String error, String message, HttpServletRequest request) {
        return new ErrorResponse(Instant.now(), status.value(), error, message, request.getRequestURI());
    }
}
