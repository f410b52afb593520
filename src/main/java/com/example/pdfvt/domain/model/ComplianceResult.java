package com.example.pdfvt.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Verdict of a single PDF/VT compliance check together with the evidence it was derived from.
 * Instances are immutable; the checker assembles one through {@link Builder} and hands it to the caller.
 *
 * @param compliant          overall verdict
 * @param detectedVariant    variant whose profile matched the marker, {@code null} when none did
 * @param rawMarker          marker exactly as found in the document, even when unrecognized
 * @param declaredPdfVersion declared version normalized to {@code major.minor}
 * @param hasCatalogMarker   {@code GTS_PDFVTVersion} present in the catalog
 * @param hasPacketMarker    the detected marker appears in the XMP packet
 * @param hasStructureFlag   catalog {@code /MarkInfo} declares {@code /Marked true}
 * @param issues             diagnostics in the order they were found
 */
public record ComplianceResult(
        boolean compliant,
        VtVariant detectedVariant,
        String rawMarker,
        String declaredPdfVersion,
        boolean hasCatalogMarker,
        boolean hasPacketMarker,
        boolean hasStructureFlag,
        List<String> issues
) {
    public ComplianceResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

	/**
	 * @param expected variant the caller expects
	 * @return {@code true} when the document is compliant and was detected as {@code expected}
	 */
    public boolean matches(VtVariant expected) {
        return compliant && detectedVariant != null && detectedVariant == expected;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator used while a check runs. Issues are append-only.
     */
    public static final class Builder {
        private boolean compliant;
        private VtVariant detectedVariant;
        private String rawMarker;
        private String declaredPdfVersion;
        private boolean hasCatalogMarker;
        private boolean hasPacketMarker;
        private boolean hasStructureFlag;
        private final List<String> issues = new ArrayList<>();

        private Builder() {
        }

        public Builder compliant(boolean compliant) {
            this.compliant = compliant;
            return this;
        }

        public Builder detectedVariant(VtVariant detectedVariant) {
            this.detectedVariant = detectedVariant;
            return this;
        }

        public Builder rawMarker(String rawMarker) {
            this.rawMarker = rawMarker;
            return this;
        }

        public Builder declaredPdfVersion(String declaredPdfVersion) {
            this.declaredPdfVersion = declaredPdfVersion;
            return this;
        }

        public Builder hasCatalogMarker(boolean hasCatalogMarker) {
            this.hasCatalogMarker = hasCatalogMarker;
            return this;
        }

        public Builder hasPacketMarker(boolean hasPacketMarker) {
            this.hasPacketMarker = hasPacketMarker;
            return this;
        }

        public Builder hasStructureFlag(boolean hasStructureFlag) {
            this.hasStructureFlag = hasStructureFlag;
            return this;
        }

        public Builder addIssue(String issue) {
            issues.add(issue);
            return this;
        }

        public String declaredPdfVersion() {
            return declaredPdfVersion;
        }

        public boolean hasCatalogMarker() {
            return hasCatalogMarker;
        }

        public boolean hasStructureFlag() {
            return hasStructureFlag;
        }

        public ComplianceResult build() {
            return new ComplianceResult(
                    compliant,
                    detectedVariant,
                    rawMarker,
                    declaredPdfVersion,
                    hasCatalogMarker,
                    hasPacketMarker,
                    hasStructureFlag,
                    issues
            );
        }
    }
}
