package com.naag.docsync.transform;

/** When page images go through OCR instead of (or in addition to) native text extraction. */
public enum OcrPolicy {
    NEVER,
    /** Only pages without a native text layer. */
    WHEN_SCANNED,
    ALWAYS
}
