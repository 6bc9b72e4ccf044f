package com.naag.docsync.llm;

/**
 * Text generation used for OCR and field extraction. Implementations throw on transport errors;
 * callers decide whether a failure is fatal.
 */
public interface GenerativeClient {

    /** False when no credentials are configured; callers skip LLM steps instead of calling. */
    boolean isAvailable();

    String generate(String model, String prompt);

    String generateFromDocument(String model, String prompt, byte[] document, String mimeType);
}
