package com.naag.docsync.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Frozen outcome of one pipeline run. For a {@link RunState#COMPLETED} run every candidate is
 * accounted for exactly once: {@code totalCandidates == upserted + skipped + errors}.
 *
 * @param fatalError the listing error of a {@link RunState#FAILED} run, otherwise null
 */
public record RunSummary(
        String pipelineName,
        Instant startedAt,
        Instant completedAt,
        int totalCandidates,
        List<ItemOutcome.Upserted> upserted,
        List<ItemOutcome.Skipped> skipped,
        List<ItemOutcome.Failed> errors,
        RunState status,
        boolean dryRun,
        String fatalError
) {

    public RunSummary {
        upserted = List.copyOf(upserted);
        skipped = List.copyOf(skipped);
        errors = List.copyOf(errors);
    }

    public boolean isConsistent() {
        return totalCandidates == upserted.size() + skipped.size() + errors.size();
    }

    /**
     * Mutable accumulator used while a run is in progress. Not thread-safe; results from worker
     * threads are appended by the orchestrating thread.
     */
    static final class Builder {
        private final String pipelineName;
        private final Instant startedAt;
        private final boolean dryRun;
        private int totalCandidates;
        private final List<ItemOutcome.Upserted> upserted = new ArrayList<>();
        private final List<ItemOutcome.Skipped> skipped = new ArrayList<>();
        private final List<ItemOutcome.Failed> errors = new ArrayList<>();

        Builder(String pipelineName, Instant startedAt, boolean dryRun) {
            this.pipelineName = pipelineName;
            this.startedAt = startedAt;
            this.dryRun = dryRun;
        }

        void totalCandidates(int total) {
            this.totalCandidates = total;
        }

        void upserted(ItemOutcome.Upserted item) {
            upserted.add(item);
        }

        void skipped(ItemOutcome.Skipped item) {
            skipped.add(item);
        }

        void failed(ItemOutcome.Failed item) {
            errors.add(item);
        }

        RunSummary completed(Instant completedAt) {
            return new RunSummary(pipelineName, startedAt, completedAt, totalCandidates,
                    upserted, skipped, errors, RunState.COMPLETED, dryRun, null);
        }

        RunSummary failed(Instant completedAt, String fatalError) {
            return new RunSummary(pipelineName, startedAt, completedAt, 0,
                    List.of(), List.of(), List.of(), RunState.FAILED, dryRun, fatalError);
        }
    }
}
