package com.naag.docsync.transform;

import com.naag.docsync.llm.GenerativeClient;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Best-effort text extraction from page images through a multimodal model. Never throws:
 * an empty result only costs the caller that page.
 */
@Slf4j
public class OcrService {

    static final String PROMPT = """
            Task: Extract the exact text content from this document page.
            Rules:
            1. Extract ONLY the text visible on the page. Do NOT add any words, interpretations, or descriptions.
            2. Maintain the strict reading order (top-to-bottom, left-to-right).
            3. If a section is a table, extract the text row-by-row, cell-by-cell, separated by spaces or tabs, preserving the order.
            4. Ignore purely visual elements like shapes or icons unless they contain text labels.
            5. Do NOT use Markdown formatting (no headers, no bolding). Just plain text.
            6. Strictly follow the primary language of the document.
            7. Output nothing but the extracted text.
            """;

    private final GenerativeClient client;
    private final String model;

    public OcrService(GenerativeClient client, String model) {
        this.client = client;
        this.model = model;
    }

    public boolean isAvailable() {
        return client != null && client.isAvailable();
    }

    public Optional<String> extractText(byte[] document, String mimeType, String label) {
        if (!isAvailable()) {
            log.debug("OCR unavailable, skipping {}", label);
            return Optional.empty();
        }
        try {
            String text = client.generateFromDocument(model, PROMPT, document, mimeType);
            if (text == null || text.isBlank()) {
                log.warn("OCR returned no text for {}", label);
                return Optional.empty();
            }
            return Optional.of(text.trim());
        } catch (RuntimeException e) {
            log.warn("OCR failed for {}: {}", label, e.getMessage());
            return Optional.empty();
        }
    }
}
