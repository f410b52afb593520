package com.example.pdfvt.infrastructure.pdf;

import com.example.pdfvt.application.port.DocumentAuthoringSession;
import com.example.pdfvt.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.pdfbox.pdmodel.documentinterchange.logicalstructure.PDMarkInfo;

import java.io.IOException;

/**
 * {@link DocumentAuthoringSession} backed by an in-memory PDFBox {@link PDDocument}.
 * The session does not own the document; whoever created it saves and closes it.
 */
public class PdfBoxAuthoringSession implements DocumentAuthoringSession {

    private final PDDocument document;

    public PdfBoxAuthoringSession(PDDocument document) {
        this.document = document;
    }

	/**
	 * Sets the version written into the {@code %PDF-x.y} header.
	 *
	 * @param version version in {@code major.minor} form
	 */
    public void declareVersion(String version) {
        document.getDocument().setVersion(Float.parseFloat(version));
    }

    @Override
    public void setInfoField(String key, String value) {
        document.getDocumentInformation().setCustomMetadataValue(key, value);
    }

    @Override
    public void setCatalogEntry(String key, String value) {
        document.getDocumentCatalog().getCOSObject().setString(COSName.getPDFName(key), value);
    }

    @Override
    public void setCatalogStructureFlag(boolean marked) {
        PDMarkInfo markInfo = new PDMarkInfo();
        markInfo.setMarked(marked);
        document.getDocumentCatalog().setMarkInfo(markInfo);
    }

    @Override
    public void attachMetadataPacket(byte[] packet) {
        PDDocumentCatalog catalog = document.getDocumentCatalog();
        PDMetadata metadata = new PDMetadata(document);
        try {
            metadata.importXMPMetadata(packet);
        } catch (IOException ex) {
            throw new PdfProcessingException("Unable to attach the XMP metadata stream.", ex);
        }
        catalog.setMetadata(metadata);
    }
}
