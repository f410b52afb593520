package com.example.pdfvt.application.port;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Read-only view of the three metadata locations the PDF/VT checker inspects.
 */
public interface OpenedPdfDocument extends Closeable {

	/**
	 * @return declared PDF version normalized to {@code major.minor}
	 */
    String getDeclaredVersion();

    Optional<String> getCatalogEntry(String key);

    Optional<Boolean> getCatalogStructureFlag();

    Optional<byte[]> getMetadataPacket() throws IOException;
}
