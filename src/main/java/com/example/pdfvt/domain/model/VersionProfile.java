package com.example.pdfvt.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Requirements and identifiers of one PDF/VT variant.
 * The {@code marker} is the join key between the catalog entry and the XMP packet, so it must be unique
 * across all registered profiles and never change once documents have been stamped with it.
 *
 * @param variant              variant this profile describes
 * @param marker               value of {@code GTS_PDFVTVersion}, e.g. {@code PDF/VT-1}
 * @param targetPdfVersion     PDF version stamped into generated documents
 * @param pdfVersionRule       constraint the checker applies to the declared version
 * @param baseStandardName     production standard the variant builds on
 * @param featureDescriptions  display-only feature list, in presentation order
 * @param extraMetadataFields  XMP properties written in addition to the common ones
 */
public record VersionProfile(
        VtVariant variant,
        String marker,
        String targetPdfVersion,
        PdfVersionRule pdfVersionRule,
        String baseStandardName,
        List<String> featureDescriptions,
        List<XmpField> extraMetadataFields
) {
    public VersionProfile {
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(targetPdfVersion, "targetPdfVersion");
        Objects.requireNonNull(pdfVersionRule, "pdfVersionRule");
        featureDescriptions = featureDescriptions == null ? List.of() : List.copyOf(featureDescriptions);
        extraMetadataFields = extraMetadataFields == null ? List.of() : List.copyOf(extraMetadataFields);
    }
}
