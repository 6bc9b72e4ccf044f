package com.naag.docsync.sync;

import com.naag.docsync.source.RemoteFile;

/**
 * Outcome of comparing a remote file against the store.
 *
 * @param storedLastModified the stored timestamp, or null when nothing was stored
 */
public record SyncDecision(RemoteFile file, Action action, String storedLastModified) {

    public enum Action {
        PROCESS,
        SKIP
    }

    public boolean shouldProcess() {
        return action == Action.PROCESS;
    }
}
