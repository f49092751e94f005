package com.example.invoice.infrastructure.ocr;

import com.example.invoice.infrastructure.exception.DocumentAcquisitionException;

import java.awt.image.BufferedImage;

/**
 * Engine wired when {@code invoice.ocr.enabled=false}. Documents that need OCR yield no text.
 */
public class DisabledOcrEngine implements OcrEngine {

    @Override
    public String extractText(BufferedImage image) {
        throw new DocumentAcquisitionException("Document needs OCR but invoice.ocr.enabled is false");
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
