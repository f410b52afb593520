package com.example.pdfvt.application.service;

import com.example.pdfvt.application.port.DocumentAuthoringSession;
import com.example.pdfvt.config.PdfVtProperties;
import com.example.pdfvt.domain.model.DocumentInfo;
import com.example.pdfvt.domain.model.VersionProfile;
import com.example.pdfvt.domain.model.VersionProfileRegistry;
import com.example.pdfvt.domain.model.VtVariant;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the metadata writer against a recording authoring session.
 */
class PdfVtMetadataWriterTest {

    private final VersionProfileRegistry registry = VersionProfileRegistry.standard();
    private final PdfVtMetadataWriter writer = new PdfVtMetadataWriter(new XmpPacketBuilder(), new PdfVtProperties());

    @Test
    void writesAllThreeLocationsWithTheProfileMarker() {
        RecordingSession session = new RecordingSession();

        writer.write(registry.get(VtVariant.VT1), session);

        assertThat(session.catalog).containsEntry(VersionProfileRegistry.COMPLIANCE_KEY, "PDF/VT-1");
        assertThat(session.structureFlag).isTrue();
        assertThat(session.packets).hasSize(1);
        assertThat(new String(session.packets.get(0), StandardCharsets.UTF_8)).contains("PDF/VT-1");
    }

    @Test
    void writesInformationalFields() {
        RecordingSession session = new RecordingSession();

        writer.write(registry.get(VtVariant.VT3), session);

        assertThat(session.info)
                .containsEntry("Title", "PDF/VT-3 Sample Document")
                .containsEntry("Author", "PDFVT Generator")
                .containsEntry("Subject", "Sample PDF/VT-3 document with text and image")
                .containsEntry("Keywords", "PDF/VT-3, Variable Data, Transactional Printing");
    }

    @Test
    void writesMetadataInFixedOrder() {
        RecordingSession session = new RecordingSession();

        writer.write(registry.get(VtVariant.VT1), session,
                new DocumentInfo("Title", null, null, null, "Tool"));

        assertThat(session.calls).containsExactly(
                "info:Title", "info:Creator", "catalog:GTS_PDFVTVersion", "structure:true", "packet");
    }

    @Test
    void collaboratorFailurePropagatesAndStopsWriting() {
        DocumentAuthoringSession session = mock(DocumentAuthoringSession.class);
        doThrow(new IllegalStateException("catalog is read-only"))
                .when(session).setCatalogEntry(anyString(), anyString());
        VersionProfile profile = registry.get(VtVariant.VT1);

        assertThrows(IllegalStateException.class, () -> writer.write(profile, session));
        verify(session, never()).setCatalogStructureFlag(true);
        verify(session, never()).attachMetadataPacket(any());
    }

    private static final class RecordingSession implements DocumentAuthoringSession {
        private final Map<String, String> info = new LinkedHashMap<>();
        private final Map<String, String> catalog = new LinkedHashMap<>();
        private final List<byte[]> packets = new ArrayList<>();
        private final List<String> calls = new ArrayList<>();
        private Boolean structureFlag;

        @Override
        public void setInfoField(String key, String value) {
            info.put(key, value);
            calls.add("info:" + key);
        }

        @Override
        public void setCatalogEntry(String key, String value) {
            catalog.put(key, value);
            calls.add("catalog:" + key);
        }

        @Override
        public void setCatalogStructureFlag(boolean marked) {
            structureFlag = marked;
            calls.add("structure:" + marked);
        }

        @Override
        public void attachMetadataPacket(byte[] packet) {
            packets.add(packet);
            calls.add("packet");
        }
    }
}
