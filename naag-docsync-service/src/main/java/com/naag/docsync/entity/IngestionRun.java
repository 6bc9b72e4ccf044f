package com.naag.docsync.entity;

import com.naag.docsync.pipeline.RunState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted run summary. Written once when a run finishes and never updated.
 */
@Entity
@Table(name = "ingestion_run", indexes = {
        @Index(name = "idx_ingestion_run_pipeline", columnList = "pipelineName"),
        @Index(name = "idx_ingestion_run_started", columnList = "startedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String pipelineName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunState status;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    private int totalCandidates;

    private int upsertedCount;

    private int skippedCount;

    private int errorCount;

    @Column(columnDefinition = "BOOLEAN DEFAULT FALSE")
    @Builder.Default
    private Boolean dryRun = false;

    @Column(length = 2000)
    private String fatalError;

    // Full summary with per-file entries, as JSON
    @Lob
    @Column(columnDefinition = "CLOB")
    private String summaryJson;
}
