package com.naag.docsync.store.payload;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** One HS code entry from the trade regulation export. */
public record RegulationPayload(
        String hsCode,
        String description,
        String goodsDescription,
        String section,
        String chapter,
        List<String> parentDescriptions,
        List<String> customsDocumentTypes,
        String link,
        JsonNode fullDocument,
        String lastModified,
        String sourceFileId,
        String sourceName,
        String sourceUrl,
        String searchText
) implements RecordPayload {}
