package com.naag.docsync.pipeline;

import java.time.Instant;
import java.util.Optional;

/**
 * @param since only files modified after this instant are candidates; empty means today's files
 */
public record RunRequest(Optional<Instant> since, boolean dryRun) {

    public static RunRequest since(Instant since) {
        return new RunRequest(Optional.of(since), false);
    }

    public static RunRequest today() {
        return new RunRequest(Optional.empty(), false);
    }

    public RunRequest asDryRun() {
        return new RunRequest(since, true);
    }
}
