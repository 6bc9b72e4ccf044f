package com.naag.docsync.scheduler;

public enum TriggerResult {
    STARTED,
    ALREADY_RUNNING,
    INVALID_PIPELINE,
    /** The background executor refused the run, e.g. during shutdown. */
    UNAVAILABLE
}
