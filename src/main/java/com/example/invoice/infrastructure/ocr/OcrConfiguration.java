package com.example.invoice.infrastructure.ocr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the {@link OcrEngine}: Tesseract unless {@code invoice.ocr.enabled=false}.
 */
@Configuration
@EnableConfigurationProperties(OcrProperties.class)
public class OcrConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OcrConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "invoice.ocr", name = "enabled", havingValue = "true", matchIfMissing = true)
    public OcrEngine tesseractOcrEngine(OcrProperties ocrProperties) {
        OcrProperties.Pdf pdf = ocrProperties.getPdf();
        String tessdata = ocrProperties.getTessdataPath();
        log.info("[OCR] Tesseract engine: languages={} tessdata={} minTextLength={} dpi={} maxPages={}",
                ocrProperties.languageSpec(),
                tessdata == null || tessdata.isBlank() ? "<installation default>" : tessdata,
                pdf.getMinTextLength(),
                pdf.getRenderDpi(),
                pdf.getMaxPages());
        return new TesseractOcrEngine(ocrProperties);
    }

    @Bean
    @ConditionalOnMissingBean(OcrEngine.class)
    public OcrEngine disabledOcrEngine() {
        log.info("[OCR] Disabled, scanned documents will yield empty fields");
        return new DisabledOcrEngine();
    }
}
