package com.example.pdfvt.domain.model;

import com.example.pdfvt.domain.exception.UnknownVariantException;

import java.util.Locale;

/**
 * Identifies one supported PDF/VT conformance variant.
 * The variant is only a key; everything a variant requires lives in its {@link VersionProfile}.
 */
public enum VtVariant {
    VT1,
    VT3;

	/**
	 * Parses a caller-supplied variant name. Accepts {@code VT1}, {@code vt-1} and {@code PDF/VT-1} spellings.
	 *
	 * @param rawValue value coming from a request path or form
	 * @return matching variant
	 * @throws UnknownVariantException when the value names no supported variant
	 */
    public static VtVariant parse(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new UnknownVariantException(rawValue);
        }
        String normalized = rawValue.trim()
                .toUpperCase(Locale.ROOT)
                .replace("PDF/", "")
                .replace("-", "");
        try {
            return VtVariant.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new UnknownVariantException(rawValue);
        }
    }
}
