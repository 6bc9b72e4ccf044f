package com.naag.docsync.store.payload;

/** One question/answer row from a case workbook. */
public record CasePayload(
        String caseNo,
        String date,
        String question,
        String answer,
        String fullText,
        String lastModified,
        String sourceFileId,
        String sourceName,
        String sourceUrl,
        String searchText
) implements RecordPayload {}
