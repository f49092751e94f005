package com.example.invoice.infrastructure.ocr;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;

import static org.assertj.core.api.Assertions.assertThat;

class OcrPropertiesTest {

    @Test
    void defaultsMatchFrenchAndEnglishInvoices() {
        OcrProperties properties = new OcrProperties();

        assertThat(properties.isEnabled()).isTrue();
        assertThat(properties.languageSpec()).isEqualTo("fra+eng");
        assertThat(properties.getPdf().getMinTextLength()).isEqualTo(50);
        assertThat(properties.getPdf().getRenderDpi()).isEqualTo(300);
        assertThat(properties.getPdf().getMaxPages()).isEqualTo(10);
    }

    @Test
    void languageSpecSkipsBlankEntries() {
        OcrProperties properties = new OcrProperties();
        properties.setLanguages(new LinkedHashSet<>(Arrays.asList(" deu ", "", null, "eng")));

        assertThat(properties.languageSpec()).isEqualTo("deu+eng");
    }

    @Test
    void missingLanguagesYieldEmptySpec() {
        OcrProperties properties = new OcrProperties();
        properties.setLanguages(null);

        assertThat(properties.languageSpec()).isEmpty();
    }
}
