package com.naag.docsync.metrics;

import com.naag.docsync.pipeline.RunSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Ingestion and search metrics, exported through the actuator Prometheus endpoint.
 */
@Component
public class IngestionMetrics {

    private final MeterRegistry registry;

    private final Timer searchTimer;
    private final Counter searchCounter;
    private final Counter insufficientEvidenceCounter;
    private final Counter wideningCounter;

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.searchTimer = Timer.builder("docsync.search.duration")
                .description("Hybrid search duration including widening attempts")
                .tags("operation", "search")
                .register(registry);

        this.searchCounter = Counter.builder("docsync.search.total")
                .description("Number of hybrid searches")
                .tags("operation", "search")
                .register(registry);

        this.insufficientEvidenceCounter = Counter.builder("docsync.search.insufficient")
                .description("Searches whose best score stayed below the confidence threshold")
                .tags("operation", "search")
                .register(registry);

        this.wideningCounter = Counter.builder("docsync.search.widened")
                .description("Searches re-issued with an expanded query")
                .tags("operation", "search")
                .register(registry);
    }

    public void recordRun(RunSummary summary) {
        String pipeline = summary.pipelineName();
        Timer.builder("docsync.run.duration")
                .description("Duration of a pipeline run")
                .tags("pipeline", pipeline, "status", summary.status().name())
                .register(registry)
                .record(Duration.between(summary.startedAt(), summary.completedAt()));

        counter("docsync.files.upserted", "Files written to the vector store", pipeline).increment(summary.upserted().size());
        counter("docsync.files.skipped", "Files unchanged since the last run", pipeline).increment(summary.skipped().size());
        counter("docsync.files.errors", "Files that failed processing", pipeline).increment(summary.errors().size());
    }

    public void recordLockedSkip(String pipeline) {
        counter("docsync.run.skipped.locked", "Runs skipped because the pipeline was already running", pipeline).increment();
    }

    public void recordSearch(long durationMs, boolean confident, int attempts) {
        searchTimer.record(Duration.ofMillis(durationMs));
        searchCounter.increment();
        if (!confident) insufficientEvidenceCounter.increment();
        if (attempts > 1) wideningCounter.increment(attempts - 1);
    }

    private Counter counter(String name, String description, String pipeline) {
        return Counter.builder(name)
                .description(description)
                .tags("pipeline", pipeline)
                .register(registry);
    }
}
