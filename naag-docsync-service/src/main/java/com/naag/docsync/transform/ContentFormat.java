package com.naag.docsync.transform;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of formats the transformer understands, keyed by file extension.
 */
public enum ContentFormat {
    STRUCTURED_RECORD(Set.of(".json")),
    PDF(Set.of(".pdf")),
    SLIDE_DECK(Set.of(".ppt", ".pptx")),
    SPREADSHEET(Set.of(".xlsx", ".xls"));

    private final Set<String> extensions;

    ContentFormat(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> extensions() {
        return extensions;
    }

    public static Optional<ContentFormat> fromFilename(String filename) {
        if (filename == null) return Optional.empty();
        String lower = filename.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        if (dot < 0) return Optional.empty();
        String ext = lower.substring(dot);
        for (ContentFormat f : values()) {
            if (f.extensions.contains(ext)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
