package com.naag.docsync.scheduler;

import com.naag.docsync.domain.DomainDefinition;
import com.naag.docsync.metrics.IngestionMetrics;
import com.naag.docsync.pipeline.PipelineOrchestrator;
import com.naag.docsync.pipeline.PipelineRegistry;
import com.naag.docsync.pipeline.RunRequest;
import com.naag.docsync.pipeline.RunSummary;
import com.naag.docsync.service.RunHistoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs every configured pipeline on a fixed interval, staggered so pipelines do not start
 * together, and accepts manual triggers. A pipeline never runs twice at the same time: a
 * tick or trigger that finds its lock held is skipped.
 */
@Slf4j
public class IngestionScheduler {

    private final PipelineRegistry registry;
    private final TaskScheduler taskScheduler;
    private final Executor manualExecutor;
    private final RunHistoryService history;
    private final IngestionMetrics metrics;
    private final Clock clock;
    private final Duration interval;
    private final Duration stagger;

    private final Map<String, PipelineLock> locks = new LinkedHashMap<>();
    private final Map<String, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();
    private final Map<String, RunSummary> lastSummaries = new ConcurrentHashMap<>();
    private volatile boolean running;

    public IngestionScheduler(PipelineRegistry registry, TaskScheduler taskScheduler, Executor manualExecutor,
                              RunHistoryService history, IngestionMetrics metrics, Clock clock,
                              Duration interval, Duration stagger) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Scheduler interval must be positive");
        }
        this.registry = registry;
        this.taskScheduler = taskScheduler;
        this.manualExecutor = manualExecutor;
        this.history = history;
        this.metrics = metrics;
        this.clock = clock;
        this.interval = interval;
        this.stagger = stagger == null ? Duration.ZERO : stagger;
        for (String name : registry.names()) {
            locks.put(name, new PipelineLock(name));
        }
    }

    public record RunOutcome(TriggerResult result, RunSummary summary) {}

    public synchronized void start() {
        if (running) return;
        int index = 0;
        Instant now = clock.instant();
        for (String name : registry.names()) {
            Instant firstRun = now.plus(stagger.multipliedBy(index++));
            schedules.put(name, taskScheduler.scheduleAtFixedRate(() -> runScheduled(name), firstRun, interval));
            log.info("Scheduled pipeline {} every {} starting {}", name, interval, firstRun);
        }
        running = true;
    }

    public synchronized void stop() {
        if (!running) return;
        schedules.values().forEach(f -> f.cancel(true));
        schedules.clear();
        running = false;
        log.info("Ingestion scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Runs a pipeline on the calling thread.
     */
    public RunOutcome runNow(String name, boolean dryRun) {
        Optional<PipelineOrchestrator> orchestrator = registry.get(name);
        if (orchestrator.isEmpty()) {
            return new RunOutcome(TriggerResult.INVALID_PIPELINE, null);
        }
        PipelineLock lock = locks.get(name);
        if (!lock.tryAcquire()) {
            logLockedSkip(name);
            return new RunOutcome(TriggerResult.ALREADY_RUNNING, null);
        }
        try {
            return new RunOutcome(TriggerResult.STARTED, execute(orchestrator.get(), dryRun));
        } finally {
            lock.release();
        }
    }

    /**
     * Starts a pipeline in the background and returns immediately.
     */
    public TriggerResult trigger(String name, boolean dryRun) {
        Optional<PipelineOrchestrator> orchestrator = registry.get(name);
        if (orchestrator.isEmpty()) {
            return TriggerResult.INVALID_PIPELINE;
        }
        PipelineLock lock = locks.get(name);
        if (!lock.tryAcquire()) {
            logLockedSkip(name);
            return TriggerResult.ALREADY_RUNNING;
        }
        try {
            manualExecutor.execute(() -> {
                try {
                    execute(orchestrator.get(), dryRun);
                } catch (RuntimeException e) {
                    log.error("Manual run of {} failed: {}", name, e.getMessage(), e);
                } finally {
                    lock.release();
                }
            });
        } catch (RejectedExecutionException e) {
            lock.release();
            log.warn("Manual run of {} rejected: {}", name, e.getMessage());
            return TriggerResult.UNAVAILABLE;
        }
        log.info("Manual run of {} started (dryRun={})", name, dryRun);
        return TriggerResult.STARTED;
    }

    public SchedulerStatus status() {
        List<PipelineStatus> pipelines = new ArrayList<>();
        for (PipelineOrchestrator orchestrator : registry.all()) {
            String name = orchestrator.name();
            pipelines.add(new PipelineStatus(
                    name,
                    orchestrator.definition().collection(),
                    locks.get(name).isHeld(),
                    orchestrator.state(),
                    nextRunTime(name),
                    lastSummaries.get(name)));
        }
        return new SchedulerStatus(running, pipelines);
    }

    public Optional<RunSummary> lastSummary(String name) {
        return Optional.ofNullable(lastSummaries.get(name));
    }

    /**
     * Window a run lists files for: lookback before now, the whole history for a zero
     * lookback, today's files when no lookback is configured.
     */
    RunRequest requestFor(DomainDefinition definition, boolean dryRun) {
        Duration lookback = definition.lookback();
        RunRequest request;
        if (lookback == null) {
            request = RunRequest.today();
        } else if (lookback.isZero()) {
            request = RunRequest.since(Instant.EPOCH);
        } else {
            request = RunRequest.since(clock.instant().minus(lookback));
        }
        return dryRun ? request.asDryRun() : request;
    }

    private void runScheduled(String name) {
        try {
            RunOutcome outcome = runNow(name, false);
            log.debug("Scheduled tick for {}: {}", name, outcome.result());
        } catch (RuntimeException e) {
            // an escaping exception would cancel the fixed-rate task
            log.error("Scheduled run of {} failed: {}", name, e.getMessage(), e);
        }
    }

    private RunSummary execute(PipelineOrchestrator orchestrator, boolean dryRun) {
        RunSummary summary = orchestrator.run(requestFor(orchestrator.definition(), dryRun));
        lastSummaries.put(orchestrator.name(), summary);
        try {
            history.record(summary);
        } catch (RuntimeException e) {
            log.warn("Could not persist run summary of {}: {}", orchestrator.name(), e.getMessage());
        }
        metrics.recordRun(summary);
        return summary;
    }

    private void logLockedSkip(String name) {
        log.info("Pipeline {} is already running, skipping", name);
        metrics.recordLockedSkip(name);
    }

    private Instant nextRunTime(String name) {
        ScheduledFuture<?> future = schedules.get(name);
        if (future == null || future.isCancelled()) return null;
        return clock.instant().plusMillis(Math.max(0, future.getDelay(TimeUnit.MILLISECONDS)));
    }
}
