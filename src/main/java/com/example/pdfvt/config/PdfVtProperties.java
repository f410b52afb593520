package com.example.pdfvt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings bound from {@code pdfvt.*} that end up in generated documents.
 */
@Component
@ConfigurationProperties(prefix = "pdfvt")
public class PdfVtProperties {

    private String author = "PDFVT Generator";
    private String creatorTool = "PDFVT Generator (Apache PDFBox 3)";
    private String producer = "Apache PDFBox 3";
    /** Page margin in points. */
    private float pageMargin = 50f;

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getCreatorTool() {
        return creatorTool;
    }

    public void setCreatorTool(String creatorTool) {
        this.creatorTool = creatorTool;
    }

    public String getProducer() {
        return producer;
    }

    public void setProducer(String producer) {
        this.producer = producer;
    }

    public float getPageMargin() {
        return pageMargin;
    }

    public void setPageMargin(float pageMargin) {
        this.pageMargin = pageMargin;
    }
}
