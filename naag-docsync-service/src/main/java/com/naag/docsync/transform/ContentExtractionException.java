package com.naag.docsync.transform;

/** Unsupported or unreadable content; always scoped to a single file. */
public class ContentExtractionException extends RuntimeException {

    public ContentExtractionException(String message) {
        super(message);
    }

    public ContentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
