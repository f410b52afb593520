package com.example.pdfvt.application.service;

import com.example.pdfvt.domain.exception.PdfFileRequiredException;
import com.example.pdfvt.domain.exception.UnsupportedPdfFormatException;
import com.example.pdfvt.domain.model.ComplianceResult;
import com.example.pdfvt.infrastructure.exception.PdfProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Runs the compliance check on uploaded files by buffering them to a temporary file first.
 */
@Service
public class ComplianceUploadService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceUploadService.class);

    private final PdfVtComplianceChecker checker;

    public ComplianceUploadService(PdfVtComplianceChecker checker) {
        this.checker = checker;
    }

	/**
	 * @param file uploaded PDF
	 * @return verdict for the uploaded document
	 * @throws PdfFileRequiredException      when the upload is missing or empty
	 * @throws UnsupportedPdfFormatException when the upload does not look like a PDF
	 * @throws PdfProcessingException        when the upload cannot be buffered
	 */
    public ComplianceResult check(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }

        Path buffered = null;
        try {
            buffered = Files.createTempFile("pdfvt-upload-", ".pdf");
            file.transferTo(buffered);
            return checker.check(buffered);
        } catch (IOException ex) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file.", ex);
        } finally {
            deleteBuffer(buffered);
        }
    }

    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("pdf")) {
            return true;
        }
        String name = file.getOriginalFilename();
        return name != null && name.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private void deleteBuffer(Path buffered) {
        if (buffered == null) {
            return;
        }
        try {
            Files.deleteIfExists(buffered);
        } catch (IOException ex) {
            log.warn("Could not delete temporary upload {}", buffered, ex);
        }
    }
}
