package com.example.pdfvt.application.service;

import com.example.pdfvt.application.port.DocumentAuthoringSession;
import com.example.pdfvt.config.PdfVtProperties;
import com.example.pdfvt.domain.model.DocumentInfo;
import com.example.pdfvt.domain.model.VersionProfile;
import com.example.pdfvt.domain.model.VersionProfileRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Calendar;
import java.util.TimeZone;

/**
 * Stamps a document with the metadata a PDF/VT variant requires: the catalog marker, the tagged-content flag
 * and an XMP packet repeating the marker. Collaborator failures are not caught, so a half-stamped document
 * never reaches the save step.
 * <p>
 * Stateless; one instance serves any number of documents.
 */
@Service
public class PdfVtMetadataWriter {

    private static final Logger log = LoggerFactory.getLogger(PdfVtMetadataWriter.class);

    private final XmpPacketBuilder xmpPacketBuilder;
    private final PdfVtProperties properties;

    public PdfVtMetadataWriter(XmpPacketBuilder xmpPacketBuilder, PdfVtProperties properties) {
        this.xmpPacketBuilder = xmpPacketBuilder;
        this.properties = properties;
    }

	/**
	 * Writes the profile metadata using the configured author and creator tool.
	 *
	 * @param profile target variant
	 * @param session document being authored
	 */
    public void write(VersionProfile profile, DocumentAuthoringSession session) {
        write(profile, session, DocumentInfo.forProfile(profile, properties.getAuthor(), properties.getCreatorTool()));
    }

	/**
	 * Writes info fields, catalog marker, structure flag and XMP packet, in that order.
	 *
	 * @param profile target variant
	 * @param session document being authored
	 * @param info    informational info-dictionary fields
	 */
    public void write(VersionProfile profile, DocumentAuthoringSession session, DocumentInfo info) {
        putInfo(session, "Title", info.title());
        putInfo(session, "Author", info.author());
        putInfo(session, "Subject", info.subject());
        putInfo(session, "Keywords", info.keywords());
        putInfo(session, "Creator", info.creator());

        session.setCatalogEntry(VersionProfileRegistry.COMPLIANCE_KEY, profile.marker());
        session.setCatalogStructureFlag(true);

        Calendar now = Calendar.getInstance(TimeZone.getTimeZone("UTC"));
        byte[] packet = xmpPacketBuilder.build(profile, info, properties.getProducer(), now);
        session.attachMetadataPacket(packet);

        log.debug("Stamped {} metadata ({} byte XMP packet)", profile.marker(), packet.length);
    }

    private void putInfo(DocumentAuthoringSession session, String key, String value) {
        if (value != null) {
            session.setInfoField(key, value);
        }
    }
}
