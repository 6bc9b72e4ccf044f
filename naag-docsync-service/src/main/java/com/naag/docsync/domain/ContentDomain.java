package com.naag.docsync.domain;

import java.util.List;

/**
 * Content domains the service knows how to map into records. Each domain has one payload
 * schema and one id rule.
 */
public enum ContentDomain {
    /** SOP / IK procedure PDFs, one record per file. */
    PROCEDURE(false, ".pdf"),
    /** HS code regulation JSON exports, one record per file. */
    REGULATION(false, ".json"),
    /** Case Q&A workbooks, one record per row. */
    CASE(true, ".xlsx", ".xls"),
    /** Unstructured documents and slide decks, one record per page. */
    DOCUMENT_PAGE(true, ".pdf", ".pptx", ".ppt");

    private final boolean multiRecord;
    private final List<String> defaultExtensions;

    ContentDomain(boolean multiRecord, String... defaultExtensions) {
        this.multiRecord = multiRecord;
        this.defaultExtensions = List.of(defaultExtensions);
    }

    /** Extensions a pipeline of this domain accepts when none are configured. */
    public List<String> defaultExtensions() {
        return defaultExtensions;
    }

    /** Whether one source file produces several records, which are looked up by source file id. */
    public boolean isMultiRecord() {
        return multiRecord;
    }
}
