package com.example.pdfvt.application.service;

import com.example.pdfvt.domain.model.ComplianceResult;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link ComplianceResult} as the plain-text report shown to operators.
 */
@Component
public class ComplianceReportFormatter {

	/**
	 * @param fileName name of the checked document, may be {@code null}
	 * @param result   verdict to render
	 * @return multi-line report
	 */
    public String format(String fileName, ComplianceResult result) {
        StringBuilder report = new StringBuilder();
        report.append("PDF/VT Compliance Check Results\n");
        if (fileName != null) {
            report.append("   File: ").append(fileName).append('\n');
        }
        report.append("   PDF Version: ").append(valueOrDash(result.declaredPdfVersion())).append('\n');
        report.append("   Detected: ").append(result.rawMarker() != null ? result.rawMarker() : "Not PDF/VT").append('\n');
        report.append("   Compliant: ").append(result.compliant() ? "Yes" : "No").append("\n\n");

        report.append("   Validation Details:\n");
        report.append("   - GTS in Catalog: ").append(mark(result.hasCatalogMarker())).append('\n');
        report.append("   - GTS in XMP:     ").append(mark(result.hasPacketMarker())).append('\n');
        report.append("   - MarkInfo:       ").append(mark(result.hasStructureFlag())).append('\n');

        if (!result.issues().isEmpty()) {
            report.append("\n   Issues:\n");
            for (String issue : result.issues()) {
                report.append("   ! ").append(issue).append('\n');
            }
        }
        return report.toString();
    }

    private String mark(boolean present) {
        return present ? "yes" : "no";
    }

    private String valueOrDash(String value) {
        return value == null ? "-" : value;
    }
}
