package com.naag.docsync.transform;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of extracting one file. Which parts are populated depends on the format:
 * structured records fill {@code structuredFields}, documents fill {@code pages},
 * spreadsheets fill {@code rows}.
 *
 * @param totalPages page count of the source document, including pages that yielded no text
 */
public record ExtractedContent(
        ContentFormat format,
        JsonNode structuredFields,
        List<PageText> pages,
        int totalPages,
        List<Map<String, String>> rows
) {

    public static ExtractedContent ofStructured(JsonNode fields) {
        return new ExtractedContent(ContentFormat.STRUCTURED_RECORD, fields, List.of(), 0, List.of());
    }

    public static ExtractedContent ofPages(ContentFormat format, List<PageText> pages, int totalPages) {
        return new ExtractedContent(format, null, List.copyOf(pages), totalPages, List.of());
    }

    public static ExtractedContent ofRows(List<Map<String, String>> rows) {
        return new ExtractedContent(ContentFormat.SPREADSHEET, null, List.of(), 0, List.copyOf(rows));
    }

    /** All page text joined with blank lines. */
    public String text() {
        return pages.stream().map(PageText::text).collect(Collectors.joining("\n\n"));
    }
}
