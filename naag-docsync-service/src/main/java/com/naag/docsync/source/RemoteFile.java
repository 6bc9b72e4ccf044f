package com.naag.docsync.source;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Snapshot of a file in the remote drive, re-fetched on every listing.
 *
 * @param lastModified the ISO-8601 timestamp exactly as reported by the source; it is copied
 *                     verbatim into stored payloads and is the only change-detection signal
 */
public record RemoteFile(
        String id,
        String name,
        String lastModified,
        long size,
        String webUrl,
        String contentRef
) {

    public Instant modifiedAt() {
        return parseTimestamp(lastModified);
    }

    public String extension() {
        if (name == null) return "";
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    public String stem() {
        if (name == null) return "";
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    /**
     * Parses an ISO-8601 instant with a {@code Z} suffix or an explicit offset.
     *
     * @throws DateTimeParseException when the value is not a timestamp
     */
    public static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            throw new DateTimeParseException("Empty timestamp", String.valueOf(value), 0);
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(value.trim()).toInstant();
        }
    }
}
