package com.naag.docsync.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.naag.docsync.entity.IngestionRun;
import com.naag.docsync.json.Json;
import com.naag.docsync.pipeline.RunState;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * One persisted run as returned by the logs endpoint.
 *
 * @param summary the full run summary with per-file outcomes, null if it could not be stored
 */
@Slf4j
public record RunLogEntry(
        Long id,
        String pipeline,
        RunState status,
        Instant startedAt,
        Instant completedAt,
        int totalCandidates,
        int upserted,
        int skipped,
        int errors,
        boolean dryRun,
        String fatalError,
        JsonNode summary
) {
    public static RunLogEntry from(IngestionRun run) {
        return new RunLogEntry(
                run.getId(),
                run.getPipelineName(),
                run.getStatus(),
                run.getStartedAt(),
                run.getCompletedAt(),
                run.getTotalCandidates(),
                run.getUpsertedCount(),
                run.getSkippedCount(),
                run.getErrorCount(),
                Boolean.TRUE.equals(run.getDryRun()),
                run.getFatalError(),
                parse(run.getSummaryJson()));
    }

    private static JsonNode parse(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return Json.MAPPER.readTree(json);
        } catch (Exception e) {
            log.warn("Stored run summary is not valid JSON: {}", e.getMessage());
            return null;
        }
    }
}
