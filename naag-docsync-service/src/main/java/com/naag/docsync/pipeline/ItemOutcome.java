package com.naag.docsync.pipeline;

/**
 * Per-file entries of a run summary.
 */
public final class ItemOutcome {

    private ItemOutcome() {}

    /** A file whose records were written, or would have been in a dry run. */
    public record Upserted(String fileId, String name, String lastModified, int recordCount, boolean dryRun) {}

    public record Skipped(String fileId, String name, String lastModified, String storedLastModified) {}

    public record Failed(String fileId, String name, ErrorPhase phase, String message) {}
}
