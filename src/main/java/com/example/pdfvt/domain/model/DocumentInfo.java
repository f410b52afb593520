package com.example.pdfvt.domain.model;

/**
 * Informational document-info dictionary fields. Written for readers, never validated.
 */
public record DocumentInfo(
        String title,
        String author,
        String subject,
        String keywords,
        String creator
) {

	/**
	 * Builds the standard info fields for a generated document of the given profile.
	 *
	 * @param profile profile the document is stamped for
	 * @param author  configured author name
	 * @param creator configured creator tool
	 * @return populated info fields
	 */
    public static DocumentInfo forProfile(VersionProfile profile, String author, String creator) {
        String marker = profile.marker();
        return new DocumentInfo(
                marker + " Sample Document",
                author,
                "Sample " + marker + " document with text and image",
                marker + ", Variable Data, Transactional Printing",
                creator
        );
    }
}
