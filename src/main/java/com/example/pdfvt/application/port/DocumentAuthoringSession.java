package com.example.pdfvt.application.port;

/**
 * Write access to a document that is still being authored.
 * Implementations mutate an in-memory document; nothing reaches disk until the owner saves it.
 */
public interface DocumentAuthoringSession {

    void setInfoField(String key, String value);

    void setCatalogEntry(String key, String value);

	/**
	 * @param marked whether the catalog declares tagged content ({@code /MarkInfo /Marked})
	 */
    void setCatalogStructureFlag(boolean marked);

	/**
	 * @param packet serialized XMP packet to attach as the document-level metadata stream
	 */
    void attachMetadataPacket(byte[] packet);
}
