package com.example.invoice.domain.matcher;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the invoice number matcher.
 */
class InvoiceNumberMatcherTest {

    private final InvoiceNumberMatcher matcher = new InvoiceNumberMatcher();

    @Test
    void readsTokenAfterFactureNumeroLabel() {
        assertThat(matcher.tryMatch("Facture N° INV-2024-0091")).contains("INV-2024-0091");
    }

    @Test
    void readsTokenAfterInvoiceNumberSign() {
        assertThat(matcher.tryMatch("INVOICE #: A12/2024\nDate: 01/01/2024")).contains("A12/2024");
    }

    @Test
    void readsTokenAfterColon() {
        assertThat(matcher.tryMatch("facture: F_2023.17\n")).contains("F_2023.17");
    }

    /**
     * The number marker may also come after the separator that follows "Facture".
     */
    @Test
    void skipsNumeroMarkerPlacedAfterSeparator() {
        assertThat(matcher.tryMatch("Facture : N° 2024-001")).contains("2024-001");
        assertThat(matcher.tryMatch("Facture - No 2024-001")).contains("2024-001");
        assertThat(matcher.tryMatch("Invoice # No. A-77")).contains("A-77");
    }

    @Test
    void readsTokenAfterColonWithoutMarker() {
        assertThat(matcher.tryMatch("Facture : 2024-001")).contains("2024-001");
    }

    @Test
    void readsTokenGluedToNumeroMarker() {
        assertThat(matcher.tryMatch("Facture No2024-15")).contains("2024-15");
    }

    @Test
    void readsTokenAfterStandaloneNumeroLabel() {
        assertThat(matcher.tryMatch("Bon de livraison\nNo 58213")).contains("58213");
    }

    /**
     * "Facture" followed by an ordinary word is not a label.
     */
    @Test
    void ignoresFactureFollowedByText() {
        assertThat(matcher.tryMatch("Facture du 14/03/2024 pour un montant de...")).isEmpty();
    }

    @Test
    void ignoresWordsStartingWithNo() {
        assertThat(matcher.tryMatch("Nombre d'articles: 3\nNotes: aucune")).isEmpty();
    }

    @Test
    void usesFirstLabelOnly() {
        assertThat(matcher.tryMatch("No: 42\nFacture N° 99")).contains("42");
    }
}
