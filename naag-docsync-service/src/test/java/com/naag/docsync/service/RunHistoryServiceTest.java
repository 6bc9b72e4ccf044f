package com.naag.docsync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.naag.docsync.entity.IngestionRun;
import com.naag.docsync.json.Json;
import com.naag.docsync.pipeline.ErrorPhase;
import com.naag.docsync.pipeline.ItemOutcome;
import com.naag.docsync.pipeline.RunState;
import com.naag.docsync.pipeline.RunSummary;
import com.naag.docsync.repository.IngestionRunRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunHistoryServiceTest {

    @Mock
    private IngestionRunRepository repository;

    @InjectMocks
    private RunHistoryService service;

    @Nested
    @DisplayName("record")
    class Record {

        @Test
        @DisplayName("Should persist counts and the full summary as JSON")
        void shouldPersistSummary() throws Exception {
            // Given
            RunSummary summary = new RunSummary("insw",
                    Instant.parse("2024-03-10T08:00:00Z"), Instant.parse("2024-03-10T08:02:00Z"), 3,
                    List.of(new ItemOutcome.Upserted("f1", "01012100.json", "2024-03-10T07:00:00Z", 1, false)),
                    List.of(new ItemOutcome.Skipped("f2", "01012900.json", "2024-01-01T00:00:00Z", "2024-01-01T00:00:00Z")),
                    List.of(new ItemOutcome.Failed("f3", "broken.json", ErrorPhase.TRANSFORM, "Unexpected token")),
                    RunState.COMPLETED, false, null);
            when(repository.save(any(IngestionRun.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            service.record(summary);

            // Then
            ArgumentCaptor<IngestionRun> saved = ArgumentCaptor.forClass(IngestionRun.class);
            verify(repository).save(saved.capture());
            IngestionRun run = saved.getValue();
            assertThat(run.getPipelineName()).isEqualTo("insw");
            assertThat(run.getStatus()).isEqualTo(RunState.COMPLETED);
            assertThat(run.getTotalCandidates()).isEqualTo(3);
            assertThat(run.getUpsertedCount()).isEqualTo(1);
            assertThat(run.getSkippedCount()).isEqualTo(1);
            assertThat(run.getErrorCount()).isEqualTo(1);

            JsonNode json = Json.MAPPER.readTree(run.getSummaryJson());
            assertThat(json.path("errors").get(0).path("phase").asText()).isEqualTo("TRANSFORM");
        }

        @Test
        @DisplayName("Should truncate an oversized fatal error")
        void shouldTruncateFatalError() {
            RunSummary failed = new RunSummary("sop", Instant.EPOCH, Instant.EPOCH, 0, List.of(), List.of(), List.of(),
                    RunState.FAILED, false, "x".repeat(5000));
            when(repository.save(any(IngestionRun.class))).thenAnswer(inv -> inv.getArgument(0));

            IngestionRun run = service.record(failed);

            assertThat(run.getFatalError()).hasSize(2000);
            assertThat(run.getStatus()).isEqualTo(RunState.FAILED);
        }
    }

    @Nested
    @DisplayName("findRuns")
    class FindRuns {

        @Test
        @DisplayName("Should pick the query matching the filters")
        void shouldFilterByPipelineAndStatus() {
            service.findRuns("sop", RunState.FAILED, 0, 20);
            verify(repository).findByPipelineNameAndStatusOrderByStartedAtDesc(eq("sop"), eq(RunState.FAILED), any(Pageable.class));

            service.findRuns("sop", null, 0, 20);
            verify(repository).findByPipelineNameOrderByStartedAtDesc(eq("sop"), any(Pageable.class));

            service.findRuns(" ", RunState.COMPLETED, 0, 20);
            verify(repository).findByStatusOrderByStartedAtDesc(eq(RunState.COMPLETED), any(Pageable.class));

            service.findRuns(null, null, 0, 20);
            verify(repository).findAllByOrderByStartedAtDesc(any(Pageable.class));
        }

        @Test
        @DisplayName("Should clamp page and size")
        void shouldClampPaging() {
            when(repository.findAllByOrderByStartedAtDesc(any(Pageable.class))).thenReturn(Page.empty());

            service.findRuns(null, null, -3, 10_000);

            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            verify(repository).findAllByOrderByStartedAtDesc(pageable.capture());
            assertThat(pageable.getValue().getPageNumber()).isZero();
            assertThat(pageable.getValue().getPageSize()).isEqualTo(RunHistoryService.MAX_PAGE_SIZE);
        }
    }
}
