package com.example.pdfvt.domain.model;

import com.example.pdfvt.domain.exception.UnknownVariantException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog of the supported PDF/VT variants.
 * Built once at startup and shared by the metadata writer and the compliance checker.
 * Adding a variant means adding a profile here; detection and validation read everything they need from the profiles.
 */
public final class VersionProfileRegistry {

    /** Catalog and XMP key carrying the variant marker. */
    public static final String COMPLIANCE_KEY = "GTS_PDFVTVersion";

    private final List<VersionProfile> profiles;
    private final Map<VtVariant, VersionProfile> byVariant;
    private final Map<String, VersionProfile> byMarker;
    private final List<VersionProfile> detectionOrder;

	/**
	 * @param profiles one profile per variant, in registration order
	 * @throws IllegalArgumentException when a variant or marker is registered twice
	 */
    public VersionProfileRegistry(List<VersionProfile> profiles) {
        Map<VtVariant, VersionProfile> variants = new EnumMap<>(VtVariant.class);
        Map<String, VersionProfile> markers = new LinkedHashMap<>();
        for (VersionProfile profile : profiles) {
            if (variants.putIfAbsent(profile.variant(), profile) != null) {
                throw new IllegalArgumentException("Duplicate profile for variant " + profile.variant());
            }
            if (markers.putIfAbsent(profile.marker(), profile) != null) {
                throw new IllegalArgumentException("Duplicate marker " + profile.marker());
            }
        }
        this.profiles = List.copyOf(profiles);
        this.byVariant = Collections.unmodifiableMap(variants);
        this.byMarker = Collections.unmodifiableMap(markers);
        this.detectionOrder = mostSpecificFirst(this.profiles);
    }

	/**
	 * Creates the registry with the VT-1 (ISO 16612-2) and VT-3 (ISO 16612-3) profiles.
	 *
	 * @return registry of all supported variants
	 */
    public static VersionProfileRegistry standard() {
        VersionProfile vt1 = new VersionProfile(
                VtVariant.VT1,
                "PDF/VT-1",
                "1.6",
                PdfVersionRule.atLeast(1, 6),
                "PDF/X-4",
                List.of(
                        "Document Part Metadata (DPM) for tracking individual records",
                        "Efficient reuse of common resources across pages",
                        "Support for encapsulated external content",
                        "Optimized for high-speed variable data printing",
                        "Built on PDF/X-4 foundation for print production",
                        "Uses PDF 1.6 with transparency and layers support"
                ),
                List.of()
        );
        VersionProfile vt3 = new VersionProfile(
                VtVariant.VT3,
                "PDF/VT-3",
                "2.0",
                PdfVersionRule.exactly("2.0"),
                "PDF/X-6",
                List.of(
                        "Document Part Metadata (DPM) for tracking individual records",
                        "Efficient reuse of common resources across pages",
                        "Simplified transparency rules (page-level only)",
                        "Per-page Output Intents with optional CxF/X-4 spectral data",
                        "Enhanced Black Point Compensation support",
                        "Built on PDF/X-6 foundation (PDF 2.0)",
                        "Modern toolchain alignment for VDP workflows"
                ),
                List.of(
                        new XmpField("http://ns.adobe.com/pdf/1.3/", "pdf", "PDFVersion", "2.0"),
                        new XmpField("http://www.npes.org/pdfx6/ns/id/", "pdfx6", "GTS_PDFXConformance", "PDF/X-6")
                )
        );
        return new VersionProfileRegistry(List.of(vt1, vt3));
    }

    public Optional<VersionProfile> findByMarker(String marker) {
        if (marker == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byMarker.get(marker));
    }

	/**
	 * @param variant requested variant
	 * @return profile registered for the variant
	 * @throws UnknownVariantException when the variant has no profile
	 */
    public VersionProfile get(VtVariant variant) {
        VersionProfile profile = variant == null ? null : byVariant.get(variant);
        if (profile == null) {
            throw new UnknownVariantException(String.valueOf(variant));
        }
        return profile;
    }

    public List<VersionProfile> all() {
        return profiles;
    }

	/**
	 * Order in which markers are searched for in free text. A marker that contains another marker is longer,
	 * so sorting by length puts it first; equal lengths prefer the later-registered (newer) variant.
	 *
	 * @return profiles in detection order
	 */
    public List<VersionProfile> detectionOrder() {
        return detectionOrder;
    }

    private static List<VersionProfile> mostSpecificFirst(List<VersionProfile> registered) {
        List<VersionProfile> ordered = new ArrayList<>(registered);
        Comparator<VersionProfile> byLength = Comparator.comparingInt(profile -> profile.marker().length());
        Comparator<VersionProfile> byRegistration = Comparator.comparingInt(registered::indexOf);
        ordered.sort(byLength.reversed().thenComparing(byRegistration.reversed()));
        return List.copyOf(ordered);
    }
}
