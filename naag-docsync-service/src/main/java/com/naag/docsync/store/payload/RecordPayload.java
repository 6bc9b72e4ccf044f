package com.naag.docsync.store.payload;

/**
 * Typed payload stored next to a record's vectors. Each collection has its own schema;
 * all of them carry the fields change detection and source lookups rely on.
 */
public interface RecordPayload {

    /** Remote last-modified timestamp, copied verbatim from the source listing. */
    String lastModified();

    String sourceFileId();

    String sourceName();

    String sourceUrl();

    String searchText();
}
