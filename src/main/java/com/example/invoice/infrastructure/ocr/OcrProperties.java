package com.example.invoice.infrastructure.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@code invoice.ocr.*} settings for the Tesseract engine and for rendering scanned PDF pages.
 */
@ConfigurationProperties(prefix = "invoice.ocr")
public class OcrProperties {

    /**
     * Enables Tesseract OCR for scanned PDFs and images.
     */
    private boolean enabled = true;

    /**
     * Tesseract language codes, e.g. "fra" and "eng".
     */
    private Set<String> languages = new LinkedHashSet<>(List.of("fra", "eng"));

    /**
     * Directory holding one "&lt;lang&gt;.traineddata" file per configured language.
     * Blank means the Tesseract installation default, which is not checked up front.
     */
    private String tessdataPath = "";

    private Pdf pdf = new Pdf();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Set<String> getLanguages() {
        return languages;
    }

    public void setLanguages(Set<String> languages) {
        this.languages = languages;
    }

    public String getTessdataPath() {
        return tessdataPath;
    }

    public void setTessdataPath(String tessdataPath) {
        this.tessdataPath = tessdataPath;
    }

    public Pdf getPdf() {
        return pdf;
    }

    public void setPdf(Pdf pdf) {
        this.pdf = pdf;
    }

    /**
     * Tesseract language argument, e.g. "fra+eng".
     */
    public String languageSpec() {
        if (languages == null) {
            return "";
        }
        return languages.stream()
                .filter(language -> language != null && !language.isBlank())
                .map(String::strip)
                .collect(Collectors.joining("+"));
    }

    public static class Pdf {

        /**
         * If the PDF text layer is shorter than this, the pages are OCR'd instead.
         */
        private int minTextLength = 50;

        /**
         * Resolution used to rasterize a page before recognition; values below 72 are raised to 72.
         */
        private int renderDpi = 300;

        /**
         * Upper bound on the number of pages rendered for OCR per document.
         */
        private int maxPages = 10;

        public int getMinTextLength() {
            return minTextLength;
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = minTextLength;
        }

        public int getRenderDpi() {
            return renderDpi;
        }

        public void setRenderDpi(int renderDpi) {
            this.renderDpi = renderDpi;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }
    }
}
