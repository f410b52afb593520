package com.example.pdfvt.application.service;

import com.example.pdfvt.application.port.OpenedPdfDocument;
import com.example.pdfvt.domain.exception.PdfNotFoundException;
import com.example.pdfvt.domain.exception.PdfPathRequiredException;
import com.example.pdfvt.domain.model.ComplianceResult;
import com.example.pdfvt.domain.model.PdfVersionRule;
import com.example.pdfvt.domain.model.VersionProfile;
import com.example.pdfvt.domain.model.VersionProfileRegistry;
import com.example.pdfvt.domain.model.VtVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the detection and validation steps of the compliance checker, using an in-memory document.
 */
class PdfVtComplianceCheckerTest {

    @TempDir
    Path tempDir;

    private Path pdfPath;
    private FakeDocument document;
    private PdfVtComplianceChecker checker;

    @BeforeEach
    void setUp() throws IOException {
        pdfPath = Files.writeString(tempDir.resolve("document.pdf"), "%PDF-placeholder");
        document = new FakeDocument();
        checker = new PdfVtComplianceChecker(path -> document, VersionProfileRegistry.standard());
    }

    @Test
    void fullyStampedDocumentIsCompliantWithoutIssues() {
        VersionProfileRegistry registry = new VersionProfileRegistry(List.of(new VersionProfile(
                VtVariant.VT1, "X-1", "1.6", PdfVersionRule.atLeast(1, 6), "PDF/X-4", List.of(), List.of())));
        checker = new PdfVtComplianceChecker(path -> document, registry);
        document.stamp("1.6", "X-1");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isTrue();
        assertThat(result.detectedVariant()).isEqualTo(VtVariant.VT1);
        assertThat(result.rawMarker()).isEqualTo("X-1");
        assertThat(result.declaredPdfVersion()).isEqualTo("1.6");
        assertThat(result.hasCatalogMarker()).isTrue();
        assertThat(result.hasPacketMarker()).isTrue();
        assertThat(result.hasStructureFlag()).isTrue();
        assertThat(result.issues()).isEmpty();
        assertThat(document.closed).isTrue();
    }

    /**
     * The packet is evidence only: losing it is reported but does not fail the check.
     */
    @Test
    void missingPacketIsReportedButNotGating() {
        document.stamp("1.6", "PDF/VT-1");
        document.packet = null;

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isTrue();
        assertThat(result.hasPacketMarker()).isFalse();
        assertThat(result.issues()).containsExactly("XMP metadata not found");
    }

    @Test
    void packetWithoutMarkerIsReportedWithDistinctIssue() {
        document.stamp("1.6", "PDF/VT-1");
        document.packet = xmp("<dc:title>Something else</dc:title>");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isTrue();
        assertThat(result.hasPacketMarker()).isFalse();
        assertThat(result.issues()).containsExactly("GTS_PDFVTVersion not found in XMP metadata");
    }

    @Test
    void packetDisagreeingWithCatalogIsReported() {
        document.stamp("2.0", "PDF/VT-3");
        document.packet = xmp("<pdfx:GTS_PDFVTVersion>PDF/VT-1</pdfx:GTS_PDFVTVersion>");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.detectedVariant()).isEqualTo(VtVariant.VT3);
        assertThat(result.hasPacketMarker()).isFalse();
        assertThat(result.issues()).containsExactly("XMP metadata does not repeat the catalog marker PDF/VT-3");
    }

    @Test
    void markerMentionedOnlyInTitleDoesNotCountAsRepeated() {
        document.stamp("2.0", "PDF/VT-3");
        document.packet = xmp("<dc:title>PDF/VT-3 Sample Document</dc:title>"
                + "<pdfx:GTS_PDFVTVersion>PDF/VT-1</pdfx:GTS_PDFVTVersion>");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isTrue();
        assertThat(result.detectedVariant()).isEqualTo(VtVariant.VT3);
        assertThat(result.hasPacketMarker()).isFalse();
        assertThat(result.issues()).containsExactly("XMP metadata does not repeat the catalog marker PDF/VT-3");
    }

    @Test
    void titleOnlyPacketHasNoPacketMarker() {
        document.stamp("1.6", "PDF/VT-1");
        document.packet = xmp("<dc:title>PDF/VT-1 Sample Document</dc:title>");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.hasPacketMarker()).isFalse();
        assertThat(result.issues()).containsExactly("GTS_PDFVTVersion not found in XMP metadata");
    }

    @Test
    void missingStructureFlagIsNeverCompliant() {
        document.stamp("1.6", "PDF/VT-1");
        document.marked = null;

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isFalse();
        assertThat(result.detectedVariant()).isEqualTo(VtVariant.VT1);
        assertThat(result.hasStructureFlag()).isFalse();
        assertThat(result.issues()).containsExactly("MarkInfo with Marked=true not found");
    }

    @Test
    void structureFlagSetToFalseIsNeverCompliant() {
        document.stamp("2.0", "PDF/VT-3");
        document.marked = false;

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isFalse();
        assertThat(result.issues()).contains("MarkInfo with Marked=true not found");
    }

    /**
     * Without a catalog entry the packet still identifies the variant, but the catalog entry is required.
     */
    @Test
    void packetFallbackDetectsVariantWhenCatalogHasNoMarker() {
        document.stamp("2.0", "PDF/VT-3");
        document.catalogMarker = null;

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isFalse();
        assertThat(result.detectedVariant()).isEqualTo(VtVariant.VT3);
        assertThat(result.rawMarker()).isEqualTo("PDF/VT-3");
        assertThat(result.hasCatalogMarker()).isFalse();
        assertThat(result.hasPacketMarker()).isTrue();
        assertThat(result.issues()).containsExactly("GTS_PDFVTVersion not found in catalog");
    }

    @Test
    void packetFallbackPrefersTheMostSpecificMarker() {
        VersionProfileRegistry registry = new VersionProfileRegistry(List.of(
                new VersionProfile(VtVariant.VT1, "X-1", "1.6", PdfVersionRule.atLeast(1, 6), "PDF/X-4", List.of(), List.of()),
                new VersionProfile(VtVariant.VT3, "X-1b", "1.6", PdfVersionRule.atLeast(1, 6), "PDF/X-4", List.of(), List.of())
        ));
        checker = new PdfVtComplianceChecker(path -> document, registry);
        document.stamp("1.6", "X-1b");
        document.catalogMarker = null;

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.detectedVariant()).isEqualTo(VtVariant.VT3);
        assertThat(result.rawMarker()).isEqualTo("X-1b");
    }

    @Test
    void packetFallbackIgnoresMarkersOutsideTheComplianceProperty() {
        document.stamp("1.6", "PDF/VT-1");
        document.catalogMarker = null;
        document.packet = xmp("<dc:title>PDF/VT-1 Sample Document</dc:title>");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.rawMarker()).isNull();
        assertThat(result.detectedVariant()).isNull();
        assertThat(result.issues()).contains("No PDF/VT version marker found");
    }

    @Test
    void packetFallbackReadsAttributeForm() {
        document.stamp("1.6", "PDF/VT-1");
        document.catalogMarker = null;
        document.packet = xmp("<rdf:Description pdfvtid:GTS_PDFVTVersion=\"PDF/VT-1\"/>");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.detectedVariant()).isEqualTo(VtVariant.VT1);
        assertThat(result.hasPacketMarker()).isTrue();
    }

    @Test
    void packetFallbackKeepsTheLiteralValue() {
        document.stamp("1.6", "PDF/VT-1 rev2");
        document.catalogMarker = null;

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.rawMarker()).isEqualTo("PDF/VT-1 rev2");
        assertThat(result.detectedVariant()).isEqualTo(VtVariant.VT1);
        assertThat(result.hasPacketMarker()).isTrue();
        assertThat(result.issues()).containsExactly("GTS_PDFVTVersion not found in catalog");
    }

    @Test
    void catalogMarkerMustMatchAProfileExactly() {
        document.stamp("1.6", "PDF/VT-1 rev2");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.rawMarker()).isEqualTo("PDF/VT-1 rev2");
        assertThat(result.detectedVariant()).isNull();
        assertThat(result.issues()).containsExactly("Unknown PDF/VT version: PDF/VT-1 rev2");
    }

    @Test
    void unrecognizedMarkerIsReportedAndKeptVerbatim() {
        document.stamp("1.6", "PDF/VT-2");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isFalse();
        assertThat(result.detectedVariant()).isNull();
        assertThat(result.rawMarker()).isEqualTo("PDF/VT-2");
        assertThat(result.issues()).containsExactly("Unknown PDF/VT version: PDF/VT-2");
    }

    @Test
    void unrecognizedPacketMarkerIsReportedWhenCatalogIsEmpty() {
        document.stamp("1.6", "PDF/VT-9");
        document.catalogMarker = null;

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.rawMarker()).isEqualTo("PDF/VT-9");
        assertThat(result.issues()).contains("Unknown PDF/VT version: PDF/VT-9");
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.6", "1.7", "2.0"})
    void vt1AcceptsPdf16AndLater(String version) {
        document.stamp(version, "PDF/VT-1");

        assertThat(checker.check(pdfPath).compliant()).isTrue();
    }

    @Test
    void vt1RejectsPdf15() {
        document.stamp("1.5", "PDF/VT-1");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isFalse();
        assertThat(result.issues()).containsExactly("PDF/VT-1 requires PDF 1.6+, found 1.5");
    }

    @ParameterizedTest
    @ValueSource(strings = {"2.1", "1.6"})
    void vt3RequiresExactlyPdf20(String version) {
        document.stamp(version, "PDF/VT-3");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isFalse();
        assertThat(result.detectedVariant()).isEqualTo(VtVariant.VT3);
        assertThat(result.issues()).containsExactly("PDF/VT-3 requires PDF 2.0, found " + version);
    }

    @Test
    void allViolationsAreRecorded() {
        document.version = "1.4";

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isFalse();
        assertThat(result.issues()).containsExactly(
                "GTS_PDFVTVersion not found in catalog",
                "MarkInfo with Marked=true not found",
                "XMP metadata not found",
                "No PDF/VT version marker found"
        );
    }

    @Test
    void unreadableDocumentBecomesAnIssue() {
        checker = new PdfVtComplianceChecker(path -> {
            throw new IOException("Header doesn't contain versioninfo");
        }, VersionProfileRegistry.standard());

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isFalse();
        assertThat(result.issues()).containsExactly("Error reading PDF: Header doesn't contain versioninfo");
    }

    @Test
    void failureWhileReadingStructureBecomesAnIssueAndClosesTheDocument() {
        document.stamp("1.6", "PDF/VT-1");
        document.packetFailure = new IllegalStateException("broken stream");

        ComplianceResult result = checker.check(pdfPath);

        assertThat(result.compliant()).isFalse();
        assertThat(result.issues()).last().isEqualTo("Error reading PDF: broken stream");
        assertThat(document.closed).isTrue();
    }

    @Test
    void missingFileIsFatal() {
        Path missing = tempDir.resolve("missing.pdf");

        PdfNotFoundException ex = assertThrows(PdfNotFoundException.class, () -> checker.check(missing));
        assertThat(ex.getPath()).endsWith("missing.pdf");
        assertThrows(PdfNotFoundException.class, () -> checker.isCompliant(missing, VtVariant.VT1));
    }

    @Test
    void nullPathIsRejected() {
        assertThrows(PdfPathRequiredException.class, () -> checker.check(null));
    }

    @Test
    void expectedVariantMustMatchDetectedVariant() {
        document.stamp("2.0", "PDF/VT-3");

        assertThat(checker.isCompliant(pdfPath, VtVariant.VT3)).isTrue();
        assertThat(checker.isCompliant(pdfPath, VtVariant.VT1)).isFalse();
    }

    private static byte[] xmp(String body) {
        return ("<x:xmpmeta xmlns:x=\"adobe:ns:meta/\"><rdf:RDF>" + body + "</rdf:RDF></x:xmpmeta>")
                .getBytes(StandardCharsets.UTF_8);
    }

    private static final class FakeDocument implements OpenedPdfDocument {
        private String version = "1.4";
        private String catalogMarker;
        private Boolean marked;
        private byte[] packet;
        private RuntimeException packetFailure;
        private boolean closed;

        void stamp(String pdfVersion, String marker) {
            version = pdfVersion;
            catalogMarker = marker;
            marked = true;
            packet = xmp("<pdfx:GTS_PDFVTVersion>" + marker + "</pdfx:GTS_PDFVTVersion>"
                    + "<pdfvtid:GTS_PDFVTVersion>" + marker + "</pdfvtid:GTS_PDFVTVersion>");
        }

        @Override
        public String getDeclaredVersion() {
            return version;
        }

        @Override
        public Optional<String> getCatalogEntry(String key) {
            return VersionProfileRegistry.COMPLIANCE_KEY.equals(key) ? Optional.ofNullable(catalogMarker) : Optional.empty();
        }

        @Override
        public Optional<Boolean> getCatalogStructureFlag() {
            return Optional.ofNullable(marked);
        }

        @Override
        public Optional<byte[]> getMetadataPacket() {
            if (packetFailure != null) {
                throw packetFailure;
            }
            return Optional.ofNullable(packet);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
