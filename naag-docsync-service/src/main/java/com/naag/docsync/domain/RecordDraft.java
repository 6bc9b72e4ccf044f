package com.naag.docsync.domain;

import com.naag.docsync.store.payload.RecordPayload;

/** A record ready for embedding: id, the text to embed, and its typed payload. */
public record RecordDraft(String id, String searchText, RecordPayload payload) {}
