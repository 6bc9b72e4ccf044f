package com.naag.docsync.pipeline;

public enum RunState {
    IDLE,
    LISTING,
    DIFFING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
