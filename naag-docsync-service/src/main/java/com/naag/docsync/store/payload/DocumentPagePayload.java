package com.naag.docsync.store.payload;

/** One page of an unstructured document. */
public record DocumentPagePayload(
        String content,
        int pageNumber,
        int chunkIndex,
        int totalPages,
        String lastModified,
        String sourceFileId,
        String sourceName,
        String sourceUrl,
        String searchText
) implements RecordPayload {}
