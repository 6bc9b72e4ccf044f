package com.naag.docsync.pipeline;

/** Step of a run in which an error was recorded. */
public enum ErrorPhase {
    LISTING,
    DIFF,
    DOWNLOAD,
    TRANSFORM,
    EMBED,
    UPSERT,
    TIMEOUT,
    CANCELLED
}
