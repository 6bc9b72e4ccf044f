package com.naag.docsync.store;

import java.util.Map;

/** A query hit; the payload is the stored JSON object as a map. */
public record ScoredRecord(String id, double score, Map<String, Object> payload) {}
