package com.naag.docsync.store.payload;

/** A standard operating procedure (SOP) or work instruction (IK) document. */
public record ProcedurePayload(
        String title,
        String type,
        String purpose,
        String description,
        String documents,
        String date,
        String docNo,
        String revision,
        String fullText,
        long size,
        String lastModified,
        String sourceFileId,
        String sourceName,
        String sourceUrl,
        String searchText
) implements RecordPayload {}
