package com.example.pdfvt.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens existing documents for read-only inspection.
 */
public interface PdfDocumentSource {

	/**
	 * @param path document on disk
	 * @return handle that must be closed by the caller
	 * @throws IOException when the file is missing or cannot be parsed as a PDF
	 */
    OpenedPdfDocument open(Path path) throws IOException;
}
