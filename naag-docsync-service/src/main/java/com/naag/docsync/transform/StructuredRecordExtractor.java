package com.naag.docsync.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.naag.docsync.json.Json;
import com.naag.docsync.source.RemoteFile;

public class StructuredRecordExtractor implements FormatExtractor {

    @Override
    public ContentFormat format() {
        return ContentFormat.STRUCTURED_RECORD;
    }

    @Override
    public ExtractedContent extract(byte[] bytes, RemoteFile file, OcrPolicy ocrPolicy) {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(bytes);
        } catch (Exception e) {
            throw new ContentExtractionException("Invalid JSON in " + file.name() + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ContentExtractionException("Expected a JSON object in " + file.name());
        }
        return ExtractedContent.ofStructured(root);
    }
}
