package com.example.pdfvt.infrastructure.pdf;

import com.example.pdfvt.application.port.OpenedPdfDocument;
import com.example.pdfvt.application.port.PdfDocumentSource;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.pdfbox.pdmodel.documentinterchange.logicalstructure.PDMarkInfo;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Opens documents with PDFBox and exposes the header version, catalog entries and XMP packet.
 */
@Component
public class PdfBoxDocumentSource implements PdfDocumentSource {

    @Override
    public OpenedPdfDocument open(Path path) throws IOException {
        return new PdfBoxOpenedDocument(Loader.loadPDF(path.toFile()));
    }

    static final class PdfBoxOpenedDocument implements OpenedPdfDocument {
        private final PDDocument document;

        PdfBoxOpenedDocument(PDDocument document) {
            this.document = document;
        }

        /**
         * PDFBox reports the later of the header version and the catalog {@code /Version}.
         */
        @Override
        public String getDeclaredVersion() {
            return String.format(Locale.ROOT, "%.1f", document.getVersion());
        }

        @Override
        public Optional<String> getCatalogEntry(String key) {
            COSBase value = catalog().getCOSObject().getDictionaryObject(COSName.getPDFName(key));
            if (value instanceof COSString string) {
                return Optional.of(string.getString());
            }
            if (value instanceof COSName name) {
                return Optional.of(name.getName());
            }
            return Optional.empty();
        }

        @Override
        public Optional<Boolean> getCatalogStructureFlag() {
            PDMarkInfo markInfo = catalog().getMarkInfo();
            if (markInfo == null) {
                return Optional.empty();
            }
            return Optional.of(markInfo.isMarked());
        }

        @Override
        public Optional<byte[]> getMetadataPacket() throws IOException {
            PDMetadata metadata = catalog().getMetadata();
            if (metadata == null) {
                return Optional.empty();
            }
            try (InputStream stream = metadata.exportXMPMetadata()) {
                if (stream == null) {
                    return Optional.empty();
                }
                return Optional.of(stream.readAllBytes());
            }
        }

        @Override
        public void close() throws IOException {
            document.close();
        }

        private PDDocumentCatalog catalog() {
            return document.getDocumentCatalog();
        }
    }
}
