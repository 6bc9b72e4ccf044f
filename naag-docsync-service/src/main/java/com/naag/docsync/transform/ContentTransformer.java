package com.naag.docsync.transform;

import com.naag.docsync.source.RemoteFile;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches raw file bytes to the extractor registered for the file's format.
 */
public class ContentTransformer {

    private final Map<ContentFormat, FormatExtractor> extractors = new EnumMap<>(ContentFormat.class);

    public ContentTransformer(List<FormatExtractor> extractors) {
        for (FormatExtractor extractor : extractors) {
            this.extractors.put(extractor.format(), extractor);
        }
    }

    public ExtractedContent transform(byte[] bytes, RemoteFile file, OcrPolicy ocrPolicy) {
        ContentFormat format = ContentFormat.fromFilename(file.name())
                .orElseThrow(() -> new ContentExtractionException("Unsupported file type: " + file.name()));
        FormatExtractor extractor = extractors.get(format);
        if (extractor == null) {
            throw new ContentExtractionException("No extractor registered for " + format + " (" + file.name() + ")");
        }
        if (bytes == null || bytes.length == 0) {
            throw new ContentExtractionException("Empty content for " + file.name());
        }
        return extractor.extract(bytes, file, ocrPolicy);
    }
}
