package com.cardledger.backend.services.extraction;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import javax.imageio.ImageIO;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import com.cardledger.backend.config.ExtractionProperties;
import com.cardledger.backend.dto.extraction.RenderedPage;
import com.cardledger.backend.dto.reconciliation.UploadedFile;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns an uploaded statement into page images: every page of a PDF, or the single image of a
 * JPG/PNG upload.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentPageRenderer {

    private final ExtractionProperties extractionProperties;

    public List<RenderedPage> render(UploadedFile file, String password) {
        if (file == null || file.content() == null || file.content().length == 0) {
            throw new IllegalArgumentException("Missing or empty file");
        }
        String name = file.filename().toLowerCase(Locale.ROOT);
        if (name.endsWith(".pdf")) {
            return renderPdf(file, password);
        }
        if (name.endsWith(".jpg") || name.endsWith(".jpeg") || name.endsWith(".png")) {
            return List.of(new RenderedPage(file.filename(), 0, readImage(file)));
        }
        throw new IllegalArgumentException("Unsupported file type: " + file.filename() + " (PDF, JPG, JPEG or PNG expected)");
    }

    private List<RenderedPage> renderPdf(UploadedFile file, String password) {
        boolean hasPassword = password != null && !password.isBlank();
        try (PDDocument document = hasPassword
                ? PDDocument.load(file.content(), password)
                : PDDocument.load(file.content())) {

            int dpi = Math.max(72, extractionProperties.renderDpi());
            int totalPages = document.getNumberOfPages();
            int pagesToRender = Math.min(totalPages, Math.max(1, extractionProperties.maxPages()));
            if (pagesToRender < totalPages) {
                log.warn("[Extraction] {} has {} pages, rendering the first {}", file.filename(), totalPages, pagesToRender);
            }

            PDFRenderer renderer = new PDFRenderer(document);
            List<RenderedPage> pages = new ArrayList<>(pagesToRender);
            for (int i = 0; i < pagesToRender; i++) {
                BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
                pages.add(new RenderedPage(file.filename(), i, image));
            }
            log.info("[Extraction] rendered {} page(s) of {} at {} dpi", pages.size(), file.filename(), dpi);
            return pages;
        } catch (InvalidPasswordException e) {
            if (hasPassword) {
                throw new IllegalArgumentException("Wrong password for PDF " + file.filename());
            }
            throw new IllegalArgumentException("PDF " + file.filename() + " is password protected, please provide the password");
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not read PDF " + file.filename() + ": " + e.getMessage(), e);
        }
    }

    private static BufferedImage readImage(UploadedFile file) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(file.content()));
            if (image == null) {
                throw new IllegalArgumentException("Could not decode image " + file.filename());
            }
            return image;
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not read image " + file.filename() + ": " + e.getMessage(), e);
        }
    }
}
