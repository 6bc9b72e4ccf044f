package com.naag.docsync.service;

import com.naag.docsync.entity.IngestionRun;
import com.naag.docsync.json.Json;
import com.naag.docsync.pipeline.RunState;
import com.naag.docsync.pipeline.RunSummary;
import com.naag.docsync.repository.IngestionRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;


/**
 * Durable history of pipeline runs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RunHistoryService {

    static final int MAX_PAGE_SIZE = 200;

    private final IngestionRunRepository repository;

    @Transactional
    public IngestionRun record(RunSummary summary) {
        String json;
        try {
            json = Json.MAPPER.writeValueAsString(summary);
        } catch (Exception e) {
            log.warn("Could not serialize summary of {}: {}", summary.pipelineName(), e.getMessage());
            json = null;
        }

        IngestionRun run = IngestionRun.builder()
                .pipelineName(summary.pipelineName())
                .status(summary.status())
                .startedAt(summary.startedAt())
                .completedAt(summary.completedAt())
                .totalCandidates(summary.totalCandidates())
                .upsertedCount(summary.upserted().size())
                .skippedCount(summary.skipped().size())
                .errorCount(summary.errors().size())
                .dryRun(summary.dryRun())
                .fatalError(truncate(summary.fatalError(), 2000))
                .summaryJson(json)
                .build();

        IngestionRun saved = repository.save(run);
        log.debug("Recorded run #{} of {} ({})", saved.getId(), saved.getPipelineName(), saved.getStatus());
        return saved;
    }

    @Transactional(readOnly = true)
    public Page<IngestionRun> findRuns(String pipelineName, RunState status, int page, int size) {
        Pageable pageable = PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), MAX_PAGE_SIZE));
        boolean byPipeline = pipelineName != null && !pipelineName.isBlank();

        if (byPipeline && status != null) {
            return repository.findByPipelineNameAndStatusOrderByStartedAtDesc(pipelineName, status, pageable);
        }
        if (byPipeline) {
            return repository.findByPipelineNameOrderByStartedAtDesc(pipelineName, pageable);
        }
        if (status != null) {
            return repository.findByStatusOrderByStartedAtDesc(status, pageable);
        }
        return repository.findAllByOrderByStartedAtDesc(pageable);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
