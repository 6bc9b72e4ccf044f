package com.naag.docsync.search;

import java.util.Map;

public record SearchHit(String collection, String id, double score, Map<String, Object> payload) {}
