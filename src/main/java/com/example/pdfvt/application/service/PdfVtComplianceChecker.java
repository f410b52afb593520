package com.example.pdfvt.application.service;

import com.example.pdfvt.application.port.OpenedPdfDocument;
import com.example.pdfvt.application.port.PdfDocumentSource;
import com.example.pdfvt.domain.exception.PdfNotFoundException;
import com.example.pdfvt.domain.exception.PdfPathRequiredException;
import com.example.pdfvt.domain.model.ComplianceResult;
import com.example.pdfvt.domain.model.VersionProfile;
import com.example.pdfvt.domain.model.VersionProfileRegistry;
import com.example.pdfvt.domain.model.VtVariant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks an existing document against the PDF/VT metadata contract.
 * <p>
 * Evidence is collected from the declared PDF version, the catalog {@code GTS_PDFVTVersion} entry, the
 * catalog {@code /MarkInfo} flag and the {@code GTS_PDFVTVersion} values of the XMP packet. The catalog marker
 * takes precedence and must match a profile exactly; the packet values are only used for detection when the
 * catalog has none. The resolved profile's version rule decides the verdict.
 * <p>
 * A missing file is the only failure thrown to the caller. Everything else, including a document PDFBox cannot
 * parse, ends up as an issue on a non-compliant {@link ComplianceResult}.
 */
@Service
public class PdfVtComplianceChecker {

    private static final Logger log = LoggerFactory.getLogger(PdfVtComplianceChecker.class);
    private static final String KEY = VersionProfileRegistry.COMPLIANCE_KEY;
    /** Matches {@code <ns:GTS_PDFVTVersion>value<} and {@code ns:GTS_PDFVTVersion="value"}. */
    private static final Pattern PACKET_MARKER_PATTERN = Pattern.compile(
            "(?:[\\w.-]+:)?" + KEY + "(?:\\s*>\\s*([^<]*?)\\s*<|\\s*=\\s*\"([^\"]*)\")");

    private final PdfDocumentSource documentSource;
    private final VersionProfileRegistry registry;

    public PdfVtComplianceChecker(PdfDocumentSource documentSource, VersionProfileRegistry registry) {
        this.documentSource = documentSource;
        this.registry = registry;
    }

	/**
	 * Runs the full check and additionally requires the detected variant to be {@code expected}.
	 *
	 * @param pdfPath  document to check
	 * @param expected variant the caller expects
	 * @return {@code true} only for a compliant document of the expected variant
	 * @throws PdfNotFoundException when the path does not exist
	 */
    public boolean isCompliant(Path pdfPath, VtVariant expected) {
        return check(pdfPath).matches(expected);
    }

	/**
	 * Inspects the document and returns a fully explained verdict.
	 *
	 * @param pdfPath document to check
	 * @return verdict with evidence and every issue found
	 * @throws PdfPathRequiredException when {@code pdfPath} is null
	 * @throws PdfNotFoundException     when the path does not exist
	 */
    public ComplianceResult check(Path pdfPath) {
        if (pdfPath == null) {
            throw new PdfPathRequiredException();
        }
        if (!Files.exists(pdfPath)) {
            throw new PdfNotFoundException(pdfPath.toAbsolutePath().toString());
        }

        ComplianceResult.Builder result = ComplianceResult.builder();
        try (OpenedPdfDocument document = documentSource.open(pdfPath)) {
            inspect(document, result);
        } catch (NoSuchFileException | FileNotFoundException ex) {
            throw new PdfNotFoundException(pdfPath.toAbsolutePath().toString());
        } catch (PdfNotFoundException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            log.warn("Unable to read {} as a PDF", pdfPath, ex);
            result.compliant(false);
            result.addIssue("Error reading PDF: " + ex.getMessage());
        }

        ComplianceResult verdict = result.build();
        log.info("Checked {}: marker={}, compliant={}, issues={}",
                pdfPath.getFileName(), verdict.rawMarker(), verdict.compliant(), verdict.issues().size());
        return verdict;
    }

    private void inspect(OpenedPdfDocument document, ComplianceResult.Builder result) throws IOException {
        String pdfVersion = document.getDeclaredVersion();
        result.declaredPdfVersion(pdfVersion);
        log.debug("Declared PDF version {}", pdfVersion);

        String candidate = null;
        Optional<String> catalogMarker = document.getCatalogEntry(KEY);
        if (catalogMarker.isPresent()) {
            result.hasCatalogMarker(true);
            candidate = catalogMarker.get();
        } else {
            result.addIssue(KEY + " not found in catalog");
        }

        boolean marked = document.getCatalogStructureFlag().orElse(false);
        result.hasStructureFlag(marked);
        if (!marked) {
            result.addIssue("MarkInfo with Marked=true not found");
        }

        VersionProfile packetProfile = null;
        Optional<byte[]> packet = document.getMetadataPacket();
        if (packet.isEmpty()) {
            result.addIssue("XMP metadata not found");
        } else {
            List<String> packetMarkers = packetMarkerValues(new String(packet.get(), StandardCharsets.UTF_8));
            if (candidate == null) {
                PacketMarker detected = detectPacketMarker(packetMarkers);
                if (detected != null) {
                    candidate = detected.value();
                    packetProfile = detected.profile();
                }
            }
            boolean repeated = candidate != null && packetMarkers.contains(candidate);
            result.hasPacketMarker(repeated);
            if (packetMarkers.isEmpty()) {
                result.addIssue(KEY + " not found in XMP metadata");
            } else if (candidate != null && !repeated) {
                result.addIssue("XMP metadata does not repeat the catalog marker " + candidate);
            }
        }
        log.debug("Evidence: catalog={}, structure={}, candidate={}", result.hasCatalogMarker(), marked, candidate);

        if (candidate == null) {
            result.addIssue("No PDF/VT version marker found");
            return;
        }
        result.rawMarker(candidate);
        Optional<VersionProfile> profile = result.hasCatalogMarker()
                ? registry.findByMarker(candidate)
                : Optional.ofNullable(packetProfile);
        if (profile.isEmpty()) {
            result.addIssue("Unknown PDF/VT version: " + candidate);
            return;
        }
        result.detectedVariant(profile.get().variant());
        result.compliant(validate(profile.get(), result));
    }

	/**
	 * Applies the profile's version rule. Catalog marker and structure flag are required by every variant;
	 * their absence was already reported while collecting evidence.
	 */
    private boolean validate(VersionProfile profile, ComplianceResult.Builder result) {
        boolean valid = true;
        String declared = result.declaredPdfVersion();
        if (!profile.pdfVersionRule().isSatisfiedBy(declared)) {
            result.addIssue(profile.marker() + " requires " + profile.pdfVersionRule().describe() + ", found " + declared);
            valid = false;
        }
        return valid && result.hasCatalogMarker() && result.hasStructureFlag();
    }

	/**
	 * Values of every {@code GTS_PDFVTVersion} property in the packet, in document order. Mentions of a marker
	 * anywhere else, such as the title, are not evidence.
	 */
    private List<String> packetMarkerValues(String xmp) {
        List<String> values = new ArrayList<>();
        Matcher matcher = PACKET_MARKER_PATTERN.matcher(xmp);
        while (matcher.find()) {
            String value = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            if (value != null && !value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

	/**
	 * Fallback detection when the catalog has no marker. Known markers are tried most specific first against the
	 * packet values; the matching value is kept literally and only the variant is resolved from it. Without a
	 * match the first value is returned unresolved so it can be reported.
	 */
    private PacketMarker detectPacketMarker(List<String> values) {
        if (values.isEmpty()) {
            return null;
        }
        for (VersionProfile profile : registry.detectionOrder()) {
            for (String value : values) {
                if (value.contains(profile.marker())) {
                    return new PacketMarker(value, profile);
                }
            }
        }
        return new PacketMarker(values.get(0), null);
    }

    private record PacketMarker(String value, VersionProfile profile) {
    }
}
