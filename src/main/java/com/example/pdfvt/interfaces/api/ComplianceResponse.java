package com.example.pdfvt.interfaces.api;

import com.example.pdfvt.domain.model.ComplianceResult;
import com.example.pdfvt.domain.model.VtVariant;

/**
 * API-layer DTO wrapping a verdict with the uploaded file name and, when requested, the expected-variant match.
 */
public record ComplianceResponse(
        String fileName,
        ComplianceResult result,
        VtVariant expectedVariant,
        Boolean matchesExpected
) {
    static ComplianceResponse of(String fileName, ComplianceResult result, VtVariant expected) {
        return new ComplianceResponse(fileName, result, expected, expected == null ? null : result.matches(expected));
    }
}
