package com.example.pdfvt.application.service;

import com.example.pdfvt.domain.exception.PdfPathRequiredException;
import com.example.pdfvt.domain.model.VersionProfile;
import com.example.pdfvt.domain.model.VersionProfileRegistry;
import com.example.pdfvt.domain.model.VtVariant;
import com.example.pdfvt.infrastructure.exception.PdfProcessingException;
import com.example.pdfvt.infrastructure.pdf.PdfBoxAuthoringSession;
import com.example.pdfvt.infrastructure.pdf.PdfBoxPageComposer;

import org.apache.pdfbox.pdfwriter.compress.CompressParameters;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Application-layer service that produces complete PDF/VT sample documents.
 * Layout is delegated to {@link PdfBoxPageComposer}, metadata to {@link PdfVtMetadataWriter}; the document is
 * serialized only after both have finished, so a failure leaves no output behind.
 */
@Service
public class PdfVtDocumentService {

    private static final Logger log = LoggerFactory.getLogger(PdfVtDocumentService.class);

    private final VersionProfileRegistry registry;
    private final PdfBoxPageComposer pageComposer;
    private final PdfVtMetadataWriter metadataWriter;

    public PdfVtDocumentService(VersionProfileRegistry registry,
                                PdfBoxPageComposer pageComposer,
                                PdfVtMetadataWriter metadataWriter) {
        this.registry = registry;
        this.pageComposer = pageComposer;
        this.metadataWriter = metadataWriter;
    }

	/**
	 * Generates a document for the variant in memory.
	 *
	 * @param variant target variant
	 * @return PDF bytes
	 * @throws PdfProcessingException when PDFBox fails to build or save the document
	 */
    public byte[] createDocument(VtVariant variant) {
        VersionProfile profile = registry.get(variant);
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PdfBoxAuthoringSession session = new PdfBoxAuthoringSession(document);
            session.declareVersion(profile.targetPdfVersion());
            pageComposer.compose(document, profile);
            metadataWriter.write(profile, session);
            document.save(out, CompressParameters.NO_COMPRESSION);
            byte[] pdf = out.toByteArray();
            log.info("Created {} document (PDF {}, {} bytes)", profile.marker(), profile.targetPdfVersion(), pdf.length);
            return pdf;
        } catch (IOException ex) {
            throw new PdfProcessingException("Unable to create " + profile.marker() + " document.", ex);
        }
    }

	/**
	 * Generates a document for the variant and writes it to {@code outputPath}, replacing any existing file.
	 *
	 * @param variant    target variant
	 * @param outputPath destination file
	 * @return the written path
	 */
    public Path createDocument(VtVariant variant, Path outputPath) {
        if (outputPath == null) {
            throw new PdfPathRequiredException();
        }
        byte[] pdf = createDocument(variant);
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(outputPath, pdf);
            log.info("Wrote {} to {}", variant, outputPath);
            return outputPath;
        } catch (IOException ex) {
            throw new PdfProcessingException("Unable to write the PDF to " + outputPath, ex);
        }
    }
}
