package com.example.pdfvt.application.service;

import com.example.pdfvt.domain.model.DocumentInfo;
import com.example.pdfvt.domain.model.VersionProfile;
import com.example.pdfvt.domain.model.VersionProfileRegistry;
import com.example.pdfvt.domain.model.XmpField;
import com.example.pdfvt.infrastructure.exception.PdfProcessingException;

import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.AdobePDFSchema;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.schema.XMPSchema;
import org.apache.xmpbox.xml.XmpSerializer;
import org.springframework.stereotype.Component;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Calendar;

/**
 * Serializes the XMP packet of a PDF/VT document with xmpbox.
 * The variant marker is written under both the PDF/X and the PDF/VT identification namespaces,
 * followed by whatever extra fields the profile declares.
 */
@Component
public class XmpPacketBuilder {

    static final String PDFX_NAMESPACE = "http://ns.adobe.com/pdfx/1.3/";
    static final String PDFVT_ID_NAMESPACE = "http://www.npes.org/pdfvt/ns/id/";

	/**
	 * Builds the packet bytes (UTF-8, wrapped in an {@code xpacket} processing instruction).
	 *
	 * @param profile   variant being stamped
	 * @param info      informational fields mirrored into Dublin Core; null fields are left out
	 * @param producer  producer string for the Adobe PDF schema, may be {@code null}
	 * @param timestamp creation and modification time
	 * @return serialized packet
	 * @throws PdfProcessingException when xmpbox cannot serialize the metadata
	 */
    public byte[] build(VersionProfile profile, DocumentInfo info, String producer, Calendar timestamp) {
        XMPMetadata xmp = XMPMetadata.createXMPMetadata();

        DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
        if (info.title() != null) {
            dc.setTitle(info.title());
        }
        if (info.author() != null) {
            dc.addCreator(info.author());
        }
        dc.setDescription("Sample " + profile.marker() + " document based on " + profile.baseStandardName()
                + " for variable data printing");

        XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
        if (info.creator() != null) {
            basic.setCreatorTool(info.creator());
        }
        basic.setCreateDate(timestamp);
        basic.setModifyDate(timestamp);

        AdobePDFSchema pdf = xmp.createAndAddAdobePDFSchema();
        if (producer != null) {
            pdf.setProducer(producer);
        }
        if (info.keywords() != null) {
            pdf.setKeywords(info.keywords());
        }

        setText(xmp, PDFX_NAMESPACE, "pdfx", VersionProfileRegistry.COMPLIANCE_KEY, profile.marker());
        setText(xmp, PDFVT_ID_NAMESPACE, "pdfvtid", VersionProfileRegistry.COMPLIANCE_KEY, profile.marker());
        for (XmpField field : profile.extraMetadataFields()) {
            setText(xmp, field.namespaceUri(), field.prefix(), field.property(), field.value());
        }

        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            new XmpSerializer().serialize(xmp, out, true);
            return out.toByteArray();
        } catch (TransformerException | IOException ex) {
            throw new PdfProcessingException("Unable to serialize XMP metadata for " + profile.marker(), ex);
        }
    }

    private void setText(XMPMetadata xmp, String namespace, String prefix, String property, String value) {
        XMPSchema schema = xmp.getSchema(namespace);
        if (schema == null) {
            schema = new XMPSchema(xmp, namespace, prefix);
            xmp.addSchema(schema);
        }
        schema.setTextPropertyValue(property, value);
    }
}
