package com.example.pdfvt.interfaces.api;

import com.example.pdfvt.application.service.PdfVtDocumentService;
import com.example.pdfvt.domain.model.VersionProfileRegistry;
import com.example.pdfvt.domain.model.VtVariant;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * REST endpoints for listing the supported variants and generating sample documents.
 */
@RestController
@RequestMapping("/api")
public class DocumentController {

    private final PdfVtDocumentService documentService;
    private final VersionProfileRegistry registry;

    public DocumentController(PdfVtDocumentService documentService, VersionProfileRegistry registry) {
        this.documentService = documentService;
        this.registry = registry;
    }

    @GetMapping(value = "/profiles", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ProfileView> profiles() {
        return registry.all().stream().map(ProfileView::from).toList();
    }

	/**
	 * Generates a sample document for the variant and returns it as a download.
	 *
	 * @param variant variant name, e.g. {@code VT1} or {@code vt-3}
	 * @return PDF bytes
	 */
    @PostMapping("/documents/{variant}")
    public ResponseEntity<byte[]> generate(@PathVariable("variant") String variant) {
        VtVariant parsed = VtVariant.parse(variant);
        byte[] pdf = documentService.createDocument(parsed);
        String fileName = "pdfvt-" + parsed.name().substring(2).toLowerCase(Locale.ROOT) + ".pdf";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }
}
