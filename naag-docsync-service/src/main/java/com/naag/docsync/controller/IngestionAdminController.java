package com.naag.docsync.controller;

import com.naag.docsync.dto.RunLogEntry;
import com.naag.docsync.dto.RunLogPage;
import com.naag.docsync.dto.TriggerResponse;
import com.naag.docsync.entity.IngestionRun;
import com.naag.docsync.pipeline.RunState;
import com.naag.docsync.scheduler.IngestionScheduler;
import com.naag.docsync.scheduler.SchedulerStatus;
import com.naag.docsync.scheduler.TriggerResult;
import com.naag.docsync.service.RunHistoryService;
import com.naag.docsync.store.CollectionStats;
import com.naag.docsync.store.HybridVectorStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Ingestion Admin", description = "Pipeline status, manual runs and run history")
@CrossOrigin(origins = "*")
public class IngestionAdminController {

    private final IngestionScheduler scheduler;
    private final RunHistoryService runHistoryService;
    private final HybridVectorStore vectorStore;

    @GetMapping("/ingestion/status")
    @Operation(summary = "Scheduler state, next run and last run summary per pipeline")
    public ResponseEntity<SchedulerStatus> status() {
        return ResponseEntity.ok(scheduler.status());
    }

    @PostMapping("/ingestion/run/{pipeline}")
    @Operation(summary = "Start a pipeline run in the background")
    public ResponseEntity<TriggerResponse> trigger(
            @PathVariable String pipeline,
            @RequestParam(required = false, defaultValue = "false") boolean dryRun) {
        TriggerResult result = scheduler.trigger(pipeline, dryRun);
        log.info("Manual trigger of {} (dryRun={}): {}", pipeline, dryRun, result);

        HttpStatus status = switch (result) {
            case STARTED -> HttpStatus.ACCEPTED;
            case ALREADY_RUNNING -> HttpStatus.CONFLICT;
            case INVALID_PIPELINE -> HttpStatus.BAD_REQUEST;
            case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return ResponseEntity.status(status).body(TriggerResponse.of(pipeline, result));
    }

    @GetMapping("/ingestion/logs")
    @Operation(summary = "Persisted run summaries, newest first")
    public ResponseEntity<RunLogPage> logs(
            @RequestParam(required = false) String pipeline,
            @RequestParam(required = false) RunState status,
            @RequestParam(required = false, defaultValue = "0") int page,
            @RequestParam(required = false, defaultValue = "20") int size) {
        Page<IngestionRun> runs = runHistoryService.findRuns(pipeline, status, page, size);
        return ResponseEntity.ok(new RunLogPage(
                runs.getContent().stream().map(RunLogEntry::from).toList(),
                runs.getNumber(),
                runs.getSize(),
                runs.getTotalElements(),
                runs.getTotalPages()));
    }

    @GetMapping("/collections/{name}/stats")
    @Operation(summary = "Point count and status of a vector store collection")
    public ResponseEntity<CollectionStats> collectionStats(@PathVariable String name) {
        CollectionStats stats = vectorStore.stats(name);
        return stats.exists() ? ResponseEntity.ok(stats) : ResponseEntity.status(HttpStatus.NOT_FOUND).body(stats);
    }
}
