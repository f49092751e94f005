package com.example.invoice.interfaces.api;

/**
 * API-layer DTO carrying already-acquired document text.
 *
 * @param text       raw document text
 * @param label      document label used in logs, optional
 * @param clientName trusted client name, optional
 */
public record TextExtractionRequest(String text, String label, String clientName) {
}
