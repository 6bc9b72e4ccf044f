package com.naag.docsync.scheduler;

import com.naag.docsync.pipeline.RunState;
import com.naag.docsync.pipeline.RunSummary;

import java.time.Instant;

/**
 * @param nextRunTime null when the pipeline is not scheduled
 * @param lastRun     null until the pipeline has run in this process
 */
public record PipelineStatus(
        String name,
        String collection,
        boolean running,
        RunState state,
        Instant nextRunTime,
        RunSummary lastRun
) {}
