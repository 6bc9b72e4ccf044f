package com.naag.docsync.scheduler;

import com.naag.docsync.domain.ContentDomain;
import com.naag.docsync.domain.DomainDefinition;
import com.naag.docsync.metrics.IngestionMetrics;
import com.naag.docsync.pipeline.PipelineOrchestrator;
import com.naag.docsync.pipeline.PipelineRegistry;
import com.naag.docsync.pipeline.RunRequest;
import com.naag.docsync.pipeline.RunState;
import com.naag.docsync.pipeline.RunSummary;
import com.naag.docsync.service.RunHistoryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IngestionSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-10T08:00:00Z");
    private static final Executor DIRECT = Runnable::run;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private RunHistoryService history;

    @Mock
    private PipelineOrchestrator sop;

    @Mock
    private PipelineOrchestrator insw;

    private SimpleMeterRegistry meterRegistry;
    private IngestionMetrics metrics;
    private Clock clock;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new IngestionMetrics(meterRegistry);
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        stubPipeline(sop, "sop", ContentDomain.PROCEDURE, "sop_documents", Duration.ofHours(2));
        stubPipeline(insw, "insw", ContentDomain.REGULATION, "insw_regulations", null);
    }

    private static void stubPipeline(PipelineOrchestrator orchestrator, String name, ContentDomain domain,
                                     String collection, Duration lookback) {
        DomainDefinition definition = new DomainDefinition(name, domain, "AI/" + name, collection,
                Set.of(".pdf"), 50, lookback, null, 1, null);
        when(orchestrator.name()).thenReturn(name);
        when(orchestrator.definition()).thenReturn(definition);
        when(orchestrator.state()).thenReturn(RunState.IDLE);
        when(orchestrator.run(any())).thenReturn(completed(name));
    }

    private static RunSummary completed(String name) {
        return new RunSummary(name, NOW, NOW.plusSeconds(3), 0, List.of(), List.of(), List.of(),
                RunState.COMPLETED, false, null);
    }

    private IngestionScheduler scheduler(Executor executor) {
        return new IngestionScheduler(new PipelineRegistry(List.of(sop, insw)), taskScheduler, executor,
                history, metrics, clock, Duration.ofMinutes(30), Duration.ofSeconds(90));
    }

    @Nested
    @DisplayName("Manual runs")
    class ManualRuns {

        @Test
        @DisplayName("Unknown pipeline names are rejected without running anything")
        void shouldRejectUnknownPipeline() {
            IngestionScheduler scheduler = scheduler(DIRECT);

            assertThat(scheduler.trigger("nope", false)).isEqualTo(TriggerResult.INVALID_PIPELINE);
            assertThat(scheduler.runNow("nope", false).result()).isEqualTo(TriggerResult.INVALID_PIPELINE);
            verify(sop, never()).run(any());
            verify(insw, never()).run(any());
        }

        @Test
        @DisplayName("A completed run is recorded in history, metrics and the last summary")
        void shouldRecordCompletedRun() {
            IngestionScheduler scheduler = scheduler(DIRECT);

            IngestionScheduler.RunOutcome outcome = scheduler.runNow("sop", false);

            assertThat(outcome.result()).isEqualTo(TriggerResult.STARTED);
            assertThat(outcome.summary().status()).isEqualTo(RunState.COMPLETED);
            assertThat(scheduler.lastSummary("sop")).contains(outcome.summary());
            verify(history).record(outcome.summary());
            assertThat(meterRegistry.find("docsync.run.duration").tag("pipeline", "sop").timer()).isNotNull();
        }

        @Test
        @DisplayName("A second request while the pipeline runs is skipped")
        void shouldSkipWhileRunning() {
            IngestionScheduler scheduler = scheduler(DIRECT);
            AtomicReference<IngestionScheduler.RunOutcome> nested = new AtomicReference<>();
            AtomicReference<TriggerResult> nestedTrigger = new AtomicReference<>();
            when(sop.run(any())).thenAnswer(invocation -> {
                nested.set(scheduler.runNow("sop", false));
                nestedTrigger.set(scheduler.trigger("sop", true));
                return completed("sop");
            });

            IngestionScheduler.RunOutcome outer = scheduler.runNow("sop", false);

            assertThat(outer.result()).isEqualTo(TriggerResult.STARTED);
            assertThat(nested.get().result()).isEqualTo(TriggerResult.ALREADY_RUNNING);
            assertThat(nested.get().summary()).isNull();
            assertThat(nestedTrigger.get()).isEqualTo(TriggerResult.ALREADY_RUNNING);
            assertThat(meterRegistry.find("docsync.run.skipped.locked").tag("pipeline", "sop").counter().count())
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("Locks are per pipeline")
        void shouldRunOtherPipelinesConcurrently() {
            IngestionScheduler scheduler = scheduler(DIRECT);
            AtomicReference<IngestionScheduler.RunOutcome> other = new AtomicReference<>();
            when(sop.run(any())).thenAnswer(invocation -> {
                other.set(scheduler.runNow("insw", false));
                return completed("sop");
            });

            scheduler.runNow("sop", false);

            assertThat(other.get().result()).isEqualTo(TriggerResult.STARTED);
        }

        @Test
        @DisplayName("The lock is released when a run throws")
        void shouldReleaseLockOnFailure() {
            IngestionScheduler scheduler = scheduler(DIRECT);
            when(sop.run(any())).thenThrow(new IllegalStateException("boom")).thenReturn(completed("sop"));

            assertThatThrownBy(() -> scheduler.runNow("sop", false)).isInstanceOf(IllegalStateException.class);

            assertThat(scheduler.status().pipelines().get(0).running()).isFalse();
            assertThat(scheduler.runNow("sop", false).result()).isEqualTo(TriggerResult.STARTED);
        }

        @Test
        @DisplayName("A history write failure does not fail the run")
        void shouldTolerateHistoryFailure() {
            IngestionScheduler scheduler = scheduler(DIRECT);
            when(history.record(any())).thenThrow(new IllegalStateException("db down"));

            IngestionScheduler.RunOutcome outcome = scheduler.runNow("insw", false);

            assertThat(outcome.result()).isEqualTo(TriggerResult.STARTED);
            assertThat(scheduler.lastSummary("insw")).isPresent();
        }

        @Test
        @DisplayName("A trigger the executor rejects reports unavailable and frees the lock")
        void shouldReportUnavailableWhenRejected() {
            IngestionScheduler scheduler = scheduler(task -> {
                throw new RejectedExecutionException("pool full");
            });

            assertThat(scheduler.trigger("sop", false)).isEqualTo(TriggerResult.UNAVAILABLE);

            assertThat(scheduler.status().pipelines().get(0).running()).isFalse();
            verify(sop, never()).run(any());
        }

        @Test
        @DisplayName("A triggered dry run passes the dry-run flag to the pipeline")
        void shouldPassDryRun() {
            IngestionScheduler scheduler = scheduler(DIRECT);

            assertThat(scheduler.trigger("insw", true)).isEqualTo(TriggerResult.STARTED);

            ArgumentCaptor<RunRequest> request = ArgumentCaptor.forClass(RunRequest.class);
            verify(insw).run(request.capture());
            assertThat(request.getValue().dryRun()).isTrue();
        }
    }

    @Nested
    @DisplayName("Run window")
    class RunWindow {

        @Test
        @DisplayName("No lookback restricts the run to today's files")
        void shouldUseTodayWithoutLookback() {
            RunRequest request = scheduler(DIRECT).requestFor(insw.definition(), false);

            assertThat(request.since()).isEmpty();
            assertThat(request.dryRun()).isFalse();
        }

        @Test
        @DisplayName("A positive lookback starts the window that long before now")
        void shouldSubtractLookback() {
            RunRequest request = scheduler(DIRECT).requestFor(sop.definition(), true);

            assertThat(request.since()).contains(NOW.minus(Duration.ofHours(2)));
            assertThat(request.dryRun()).isTrue();
        }

        @Test
        @DisplayName("A zero lookback lists the whole folder history")
        void shouldListEverythingForZeroLookback() {
            DomainDefinition full = new DomainDefinition("all", ContentDomain.CASE, "AI/Cases", "cases_qna",
                    Set.of(".xlsx"), 50, Duration.ZERO, null, 1, null);

            RunRequest request = scheduler(DIRECT).requestFor(full, false);

            assertThat(request.since()).contains(Instant.EPOCH);
        }
    }

    @Nested
    @DisplayName("Scheduling")
    class Scheduling {

        @Test
        @DisplayName("Start schedules every pipeline with a stagger between them")
        void shouldStaggerPipelines() {
            doReturn(mock(ScheduledFuture.class)).when(taskScheduler)
                    .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
            IngestionScheduler scheduler = scheduler(DIRECT);

            scheduler.start();
            scheduler.start();

            verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(NOW), eq(Duration.ofMinutes(30)));
            verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(NOW.plusSeconds(90)), eq(Duration.ofMinutes(30)));
            assertThat(scheduler.isRunning()).isTrue();
        }

        @Test
        @DisplayName("Stop cancels the scheduled ticks")
        void shouldCancelOnStop() {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            doReturn(future).when(taskScheduler)
                    .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
            IngestionScheduler scheduler = scheduler(DIRECT);
            scheduler.start();

            scheduler.stop();

            verify(future, times(2)).cancel(true);
            assertThat(scheduler.isRunning()).isFalse();
            assertThat(scheduler.status().pipelines()).allMatch(p -> p.nextRunTime() == null);
        }

        @Test
        @DisplayName("A scheduled tick that throws is contained")
        void shouldContainTickFailure() {
            ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
            doReturn(mock(ScheduledFuture.class)).when(taskScheduler)
                    .scheduleAtFixedRate(tick.capture(), any(Instant.class), any(Duration.class));
            when(sop.run(any())).thenThrow(new IllegalStateException("boom"));
            IngestionScheduler scheduler = scheduler(DIRECT);
            scheduler.start();

            tick.getAllValues().get(0).run();

            assertThat(scheduler.status().pipelines().get(0).running()).isFalse();
            assertThat(scheduler.lastSummary("sop")).isEmpty();
        }

        @Test
        @DisplayName("Status lists pipelines in configuration order")
        void shouldReportStatus() {
            IngestionScheduler scheduler = scheduler(DIRECT);
            scheduler.runNow("insw", false);

            SchedulerStatus status = scheduler.status();

            assertThat(status.running()).isFalse();
            assertThat(status.pipelines()).extracting(PipelineStatus::name).containsExactly("sop", "insw");
            assertThat(status.pipelines().get(0).lastRun()).isNull();
            assertThat(status.pipelines().get(1).lastRun()).isNotNull();
            assertThat(status.pipelines().get(1).collection()).isEqualTo("insw_regulations");
        }

        @Test
        @DisplayName("A non-positive interval is rejected")
        void shouldRejectZeroInterval() {
            PipelineRegistry registry = new PipelineRegistry(List.of(sop));

            assertThatThrownBy(() -> new IngestionScheduler(registry, taskScheduler, DIRECT, history, metrics,
                    clock, Duration.ZERO, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
