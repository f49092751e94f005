package com.example.invoice.infrastructure.ocr;

import java.awt.image.BufferedImage;

/**
 * Optical character recognition over a rendered page or a scanned image.
 */
public interface OcrEngine {

    /**
     * Extracts text from an image using OCR.
     *
     * @param image page or photo to recognize
     * @return recognized text, empty when nothing was recognized
     */
    String extractText(BufferedImage image);

    /**
     * @return {@code false} when OCR has been switched off by configuration
     */
    default boolean isEnabled() {
        return true;
    }
}
