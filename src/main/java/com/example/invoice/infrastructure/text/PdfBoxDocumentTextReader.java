package com.example.invoice.infrastructure.text;

import com.example.invoice.infrastructure.exception.DocumentAcquisitionException;
import com.example.invoice.infrastructure.ocr.OcrEngine;
import com.example.invoice.infrastructure.ocr.OcrProperties;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Infrastructure service that reads invoice text with PDFBox, falling back to OCR for scanned documents.
 * PDFs are read from their text layer first; pages are rendered and OCR'd only when that layer is (nearly) empty.
 * Anything that is not a PDF is decoded as an image and OCR'd.
 */
@Service
public class PdfBoxDocumentTextReader implements DocumentTextReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentTextReader.class);
    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final int PDF_HEADER_SEARCH_LIMIT = 1024;

    private final OcrEngine ocrEngine;
    private final OcrProperties ocrProperties;

    /**
     * Creates the reader.
     *
     * @param ocrEngine     engine used for scanned pages and images
     * @param ocrProperties thresholds and rendering options
     */
    public PdfBoxDocumentTextReader(OcrEngine ocrEngine, OcrProperties ocrProperties) {
        this.ocrEngine = ocrEngine;
        this.ocrProperties = ocrProperties;
    }

    @Override
    public String readText(byte[] content, String label) {
        if (content == null || content.length == 0) {
            throw new DocumentAcquisitionException("Document '" + label + "' is empty.");
        }
        if (looksLikePdf(content)) {
            return readPdf(content, label);
        }
        return readImage(content, label);
    }

    /**
     * Reads a PDF, using OCR when the text layer is too short to be useful.
     *
     * @param content PDF bytes
     * @param label   document label
     * @return document text
     */
    private String readPdf(byte[] content, String label) {
        try (PDDocument document = Loader.loadPDF(content)) {
            String text = extractTextLayer(document);
            int minTextLength = ocrProperties.getPdf().getMinTextLength();
            if (text.length() >= minTextLength || !ocrEngine.isEnabled()) {
                log.info("Read text layer of '{}': pages={} textLen={}", label, document.getNumberOfPages(), text.length());
                return text;
            }

            log.info("Text layer of '{}' is below {} chars ({}), running OCR", label, minTextLength, text.length());
            String ocrText = ocrPages(document, label);
            return ocrText.isBlank() ? text : ocrText;
        } catch (IOException e) {
            throw new DocumentAcquisitionException("Unable to read the PDF '" + label + "'.", e);
        }
    }

    /**
     * Uses {@link PDFTextStripper} to extract the text of every page, lines in reading order.
     *
     * @param document loaded PDF document
     * @return stripped text
     * @throws IOException when PDFBox cannot read the page content
     */
    private String extractTextLayer(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setLineSeparator("\n");
        stripper.setParagraphEnd("\n");
        return stripper.getText(document).strip();
    }

    /**
     * Renders up to {@code invoice.ocr.pdf.max-pages} pages and OCRs them one by one.
     * A page whose OCR fails contributes no text; the other pages are kept.
     *
     * @param document loaded PDF document
     * @param label    document label
     * @return page texts joined by line breaks
     * @throws IOException when a page cannot be rendered
     */
    private String ocrPages(PDDocument document, String label) throws IOException {
        int dpi = Math.max(72, ocrProperties.getPdf().getRenderDpi());
        int maxPages = Math.max(1, ocrProperties.getPdf().getMaxPages());
        int totalPages = document.getNumberOfPages();
        int pagesToProcess = Math.min(totalPages, maxPages);

        long startMs = System.currentTimeMillis();
        PDFRenderer renderer = new PDFRenderer(document);
        List<String> pages = new ArrayList<>();
        for (int pageIndex = 0; pageIndex < pagesToProcess; pageIndex++) {
            BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
            try {
                pages.add(Objects.toString(ocrEngine.extractText(image), ""));
            } catch (DocumentAcquisitionException ex) {
                log.warn("OCR failed on page {} of '{}'", pageIndex + 1, label, ex);
            } finally {
                image.flush();
            }
        }

        String result = String.join("\n", pages);
        log.info("[OCR] Completed '{}': pages={}/{} dpi={} elapsedMs={} textLen={}",
                label, pagesToProcess, totalPages, dpi, System.currentTimeMillis() - startMs, result.length());
        return result;
    }

    /**
     * Decodes the bytes as an image and OCRs it.
     *
     * @param content image bytes
     * @param label   document label
     * @return recognized text
     */
    private String readImage(byte[] content, String label) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new DocumentAcquisitionException("Unable to decode the image '" + label + "'.", e);
        }
        if (image == null) {
            throw new DocumentAcquisitionException("'" + label + "' is neither a PDF nor a recognizable image.");
        }
        try {
            String text = Objects.toString(ocrEngine.extractText(image), "");
            log.info("[OCR] Read image '{}': {}x{} textLen={}", label, image.getWidth(), image.getHeight(), text.length());
            return text;
        } finally {
            image.flush();
        }
    }

    /**
     * Looks for the PDF header near the start of the bytes.
     *
     * @param content document bytes
     * @return {@code true} when a {@code %PDF-} marker is present
     */
    private boolean looksLikePdf(byte[] content) {
        int limit = Math.min(content.length, PDF_HEADER_SEARCH_LIMIT) - PDF_MAGIC.length;
        for (int offset = 0; offset <= limit; offset++) {
            boolean matches = true;
            for (int i = 0; i < PDF_MAGIC.length; i++) {
                if (content[offset + i] != PDF_MAGIC[i]) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                return true;
            }
        }
        return false;
    }
}
