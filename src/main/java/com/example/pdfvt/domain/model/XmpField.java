package com.example.pdfvt.domain.model;

/**
 * Additional namespace-qualified text property a variant requires in its XMP packet,
 * e.g. {@code pdfx6:GTS_PDFXConformance = PDF/X-6}.
 */
public record XmpField(
        String namespaceUri,
        String prefix,
        String property,
        String value
) {
    public String qualifiedName() {
        return prefix + ":" + property;
    }
}
