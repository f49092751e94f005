package com.example.invoice.domain.matcher;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the supplier name matcher, labelled values and the first-line fallback.
 */
class SupplierNameMatcherTest {

    private final SupplierNameMatcher matcher = new SupplierNameMatcher();

    @Test
    void readsLabelledSupplier() {
        assertThat(matcher.tryMatch("Fournisseur: ACME SARL\nClient: Dupont")).contains("ACME SARL");
    }

    @Test
    void readsAccentedLabelWithSpacedColon() {
        assertThat(matcher.tryMatch("Société : Boulangerie Martin\nTotal: 12,00")).contains("Boulangerie Martin");
    }

    /**
     * A label anywhere in the document beats an unlabelled first line.
     */
    @Test
    void labelWinsOverFirstLine() {
        assertThat(matcher.tryMatch("Mon Entreprise\nVendeur: Shop & Co.")).contains("Shop & Co.");
    }

    @Test
    void fallsBackToFirstSubstantiveLine() {
        String text = "FACTURE\nACME Distribution SARL\n12 rue de Paris\nTotal: 10,00€";

        assertThat(matcher.tryMatch(text)).contains("ACME Distribution SARL");
    }

    @Test
    void fallbackSkipsShortAndKeywordLines() {
        String text = "  \nN°\nabc\nTVA 20%\nClient: X\n  Maison Dupont  \n";

        assertThat(matcher.tryMatch(text)).contains("Maison Dupont");
    }

    @Test
    void emptyTextHasNoSupplier() {
        assertThat(matcher.tryMatch("")).isEmpty();
        assertThat(matcher.tryMatch("\n\n")).isEmpty();
    }
}
