package com.example.invoice.infrastructure.ocr;

import com.example.invoice.infrastructure.exception.DocumentAcquisitionException;
import com.example.invoice.infrastructure.exception.FatalConfigurationException;

import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tess4J-backed OCR engine.
 * A missing native library or missing language data is reported as a {@link FatalConfigurationException};
 * a recognition failure on one image is a {@link DocumentAcquisitionException}.
 */
public class TesseractOcrEngine implements OcrEngine {

    private final OcrProperties ocrProperties;

    // a Tesseract handle must not be shared between request threads
    private final ThreadLocal<Tesseract> tesseractPerThread;

    public TesseractOcrEngine(OcrProperties ocrProperties) {
        this.ocrProperties = ocrProperties;
        this.tesseractPerThread = ThreadLocal.withInitial(this::createTesseract);
    }

    @Override
    public String extractText(BufferedImage image) {
        if (image == null) {
            return "";
        }
        verifyLanguageData();

        try {
            String text = tesseractPerThread.get().doOCR(image);
            return text == null ? "" : text;
        } catch (LinkageError e) {
            throw new FatalConfigurationException("Tesseract native library is not installed or cannot be loaded", e);
        } catch (TesseractException | RuntimeException e) {
            throw new DocumentAcquisitionException("Tesseract failed to recognize the image", e);
        }
    }

    /**
     * Checks that the configured tessdata directory holds every configured language.
     * Nothing is checked when no directory is configured; Tesseract then uses its installation default.
     *
     * @throws FatalConfigurationException when the directory or a language file is missing
     */
    void verifyLanguageData() {
        String datapath = ocrProperties.getTessdataPath();
        if (datapath == null || datapath.isBlank()) {
            return;
        }
        Path directory = Path.of(datapath.strip());
        if (!Files.isDirectory(directory)) {
            throw new FatalConfigurationException("Tessdata directory not found: " + directory.toAbsolutePath());
        }
        for (String language : ocrProperties.languageSpec().split("\\+")) {
            if (language.isEmpty()) {
                continue;
            }
            Path trainedData = directory.resolve(language + ".traineddata");
            if (!Files.isRegularFile(trainedData)) {
                throw new FatalConfigurationException("Tesseract language data missing: " + trainedData.toAbsolutePath());
            }
        }
    }

    private Tesseract createTesseract() {
        Tesseract tesseract = new Tesseract();
        String datapath = ocrProperties.getTessdataPath();
        if (datapath != null && !datapath.isBlank()) {
            tesseract.setDatapath(datapath.strip());
        }
        String languageSpec = ocrProperties.languageSpec();
        if (!languageSpec.isEmpty()) {
            tesseract.setLanguage(languageSpec);
        }
        // fully automatic page segmentation, no OSD
        tesseract.setPageSegMode(3);
        return tesseract;
    }
}
