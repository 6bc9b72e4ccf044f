package com.naag.docsync.domain;

import com.naag.docsync.source.RemoteFile;
import com.naag.docsync.transform.OcrPolicy;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable configuration of one pipeline: where its files live, which collection they go to
 * and how they are processed.
 *
 * @param lookback window for scheduled runs; null restricts listing to files modified today
 */
public record DomainDefinition(
        String name,
        ContentDomain domain,
        String folderPath,
        String collection,
        Set<String> extensions,
        int batchSize,
        Duration lookback,
        OcrPolicy ocrPolicy,
        int workers,
        Duration fileTimeout
) {

    public DomainDefinition {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("pipeline name is required");
        if (domain == null) throw new IllegalArgumentException("domain is required for pipeline " + name);
        if (collection == null || collection.isBlank()) throw new IllegalArgumentException("collection is required for pipeline " + name);
        extensions = extensions.stream()
                .map(e -> e.startsWith(".") ? e : "." + e)
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        batchSize = batchSize > 0 ? batchSize : 50;
        workers = Math.max(1, workers);
        ocrPolicy = ocrPolicy == null ? OcrPolicy.WHEN_SCANNED : ocrPolicy;
        fileTimeout = fileTimeout == null ? Duration.ofMinutes(10) : fileTimeout;
    }

    public boolean accepts(RemoteFile file) {
        return extensions.contains(file.extension());
    }
}
