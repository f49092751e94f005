package com.example.invoice.infrastructure.ocr;

import com.example.invoice.infrastructure.exception.FatalConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Checks the language-data verification done before any native call.
 */
class TesseractOcrEngineTest {

    @TempDir
    Path tempDir;

    @Test
    void missingTessdataDirectoryIsFatal() {
        TesseractOcrEngine engine = new TesseractOcrEngine(properties(tempDir.resolve("missing")));

        assertThatThrownBy(engine::verifyLanguageData)
                .isInstanceOf(FatalConfigurationException.class)
                .hasMessageStartingWith("Tessdata directory not found");
    }

    @Test
    void missingLanguageFileIsFatal() throws IOException {
        Files.createFile(tempDir.resolve("eng.traineddata"));
        TesseractOcrEngine engine = new TesseractOcrEngine(properties(tempDir));

        assertThatThrownBy(engine::verifyLanguageData)
                .isInstanceOf(FatalConfigurationException.class)
                .hasMessageContaining("fra.traineddata");
    }

    @Test
    void fatalErrorIsRaisedBeforeRecognition() {
        TesseractOcrEngine engine = new TesseractOcrEngine(properties(tempDir.resolve("missing")));
        BufferedImage image = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);

        assertThatThrownBy(() -> engine.extractText(image)).isInstanceOf(FatalConfigurationException.class);
    }

    @Test
    void completeLanguageDataPassesVerification() throws IOException {
        Files.createFile(tempDir.resolve("fra.traineddata"));
        Files.createFile(tempDir.resolve("eng.traineddata"));
        TesseractOcrEngine engine = new TesseractOcrEngine(properties(tempDir));

        assertThatCode(engine::verifyLanguageData).doesNotThrowAnyException();
    }

    @Test
    void blankTessdataPathSkipsVerification() {
        OcrProperties properties = new OcrProperties();

        assertThatCode(new TesseractOcrEngine(properties)::verifyLanguageData).doesNotThrowAnyException();
    }

    @Test
    void nullImageYieldsEmptyText() {
        TesseractOcrEngine engine = new TesseractOcrEngine(properties(tempDir.resolve("missing")));

        assertThat(engine.extractText(null)).isEmpty();
    }

    private static OcrProperties properties(Path tessdata) {
        OcrProperties properties = new OcrProperties();
        properties.setTessdataPath(tessdata.toString());
        return properties;
    }
}
