package com.example.pdfvt.infrastructure.pdf;

import com.example.pdfvt.config.PdfVtProperties;
import com.example.pdfvt.domain.model.VersionProfile;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lays out the single A4 sample page of a generated PDF/VT document: heading, description of the variant,
 * its feature list, an embedded raster illustration and a footer.
 */
@Component
public class PdfBoxPageComposer {

    private static final PDFont REGULAR = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private static final PDFont BOLD = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    private static final PDFont ITALIC = new PDType1Font(Standard14Fonts.FontName.HELVETICA_OBLIQUE);
    private static final Color TEXT = new Color(33, 37, 41);
    private static final Color MUTED = new Color(108, 117, 125);
    private static final Color FEATURE = new Color(73, 80, 87);
    private static final Color RULE = new Color(206, 212, 218);
    private static final int IMAGE_WIDTH = 400;
    private static final int IMAGE_HEIGHT = 300;
    private static final float IMAGE_DISPLAY_WIDTH = 300f;
    private static final DateTimeFormatter FOOTER_DATE =
            DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' HH:mm:ss", Locale.ENGLISH);

    private final PdfVtProperties properties;

    public PdfBoxPageComposer(PdfVtProperties properties) {
        this.properties = properties;
    }

	/**
	 * Appends the sample page to {@code document}.
	 *
	 * @param document document being authored
	 * @param profile  variant the page describes
	 * @throws IOException when PDFBox cannot write the content stream or embed the image
	 */
    public void compose(PDDocument document, VersionProfile profile) throws IOException {
        PDPage page = new PDPage(PDRectangle.A4);
        document.addPage(page);
        PDImageXObject illustration = LosslessFactory.createFromImage(document, createIllustration());

        float margin = properties.getPageMargin();
        float pageWidth = page.getMediaBox().getWidth();
        float contentWidth = pageWidth - 2 * margin;
        String marker = profile.marker();

        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            float y = page.getMediaBox().getHeight() - margin - 28;

            centered(content, BOLD, 28, TEXT, marker + " Document Sample", pageWidth, y);
            y -= 40;
            centered(content, REGULAR, 16, MUTED, "Variable Data & Transactional Printing", pageWidth, y);
            y -= 50;

            String intro = "This document demonstrates " + marker + " (Variable Data and Transactional Printing) "
                    + "capabilities using Apache PDFBox. This version is based on " + profile.baseStandardName()
                    + " and uses PDF " + profile.targetPdfVersion() + " features.";
            for (String line : wrap(intro, REGULAR, 12, contentWidth)) {
                text(content, REGULAR, 12, TEXT, line, margin, y);
                y -= 16;
            }
            y -= 20;

            text(content, BOLD, 14, TEXT, "Key Features of " + marker + ":", margin, y);
            y -= 22;
            for (String feature : profile.featureDescriptions()) {
                for (String line : wrap("• " + feature, REGULAR, 11, contentWidth - 20)) {
                    text(content, REGULAR, 11, FEATURE, line, margin + 20, y);
                    y -= 16;
                }
            }
            y -= 24;

            text(content, BOLD, 14, TEXT, "Sample Embedded Image", margin, y);
            y -= 15;
            float imageHeight = IMAGE_DISPLAY_WIDTH * IMAGE_HEIGHT / IMAGE_WIDTH;
            y -= imageHeight;
            content.drawImage(illustration, (pageWidth - IMAGE_DISPLAY_WIDTH) / 2, y, IMAGE_DISPLAY_WIDTH, imageHeight);
            y -= 18;
            centered(content, ITALIC, 10, MUTED,
                    "Figure 1: Geometric design sample demonstrating embedded image support", pageWidth, y);

            float footerY = margin + 20;
            content.setStrokingColor(RULE);
            content.moveTo(margin, footerY + 20);
            content.lineTo(pageWidth - margin, footerY + 20);
            content.stroke();
            centered(content, REGULAR, 9, MUTED, "Generated on " + FOOTER_DATE.format(LocalDateTime.now()),
                    pageWidth, footerY);
            centered(content, REGULAR, 9, MUTED, "Created with Apache PDFBox | " + marker + " Compliant",
                    pageWidth, footerY - 12);
        }
    }

	/**
	 * Draws the overlapping circles and bars used as the embedded illustration.
	 */
    BufferedImage createIllustration() {
        BufferedImage image = new BufferedImage(IMAGE_WIDTH, IMAGE_HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, IMAGE_WIDTH, IMAGE_HEIGHT);
            Color blue = new Color(66, 133, 244);
            graphics.setColor(blue);
            graphics.fillOval(50, 50, 150, 150);
            graphics.setColor(new Color(251, 188, 4));
            graphics.fillOval(120, 80, 140, 140);
            graphics.setColor(new Color(52, 168, 83));
            graphics.fillOval(200, 100, 130, 130);
            graphics.setColor(new Color(234, 67, 53));
            graphics.fillRect(280, 40, 80, 80);
            graphics.setColor(blue);
            graphics.fillRect(100, 200, 200, 60);
        } finally {
            graphics.dispose();
        }
        return image;
    }

    private void text(PDPageContentStream content, PDFont font, float size, Color color,
                      String value, float x, float y) throws IOException {
        content.beginText();
        content.setFont(font, size);
        content.setNonStrokingColor(color);
        content.newLineAtOffset(x, y);
        content.showText(value);
        content.endText();
    }

    private void centered(PDPageContentStream content, PDFont font, float size, Color color,
                          String value, float pageWidth, float y) throws IOException {
        float width = width(font, size, value);
        text(content, font, size, color, value, (pageWidth - width) / 2, y);
    }

    private List<String> wrap(String value, PDFont font, float size, float maxWidth) throws IOException {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : value.split(" ")) {
            String candidate = line.length() == 0 ? word : line + " " + word;
            if (line.length() > 0 && width(font, size, candidate) > maxWidth) {
                lines.add(line.toString());
                line = new StringBuilder(word);
            } else {
                line = new StringBuilder(candidate);
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }

    private float width(PDFont font, float size, String value) throws IOException {
        return font.getStringWidth(value) / 1000f * size;
    }
}
