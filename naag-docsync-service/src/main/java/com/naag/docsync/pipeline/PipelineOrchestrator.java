package com.naag.docsync.pipeline;

import com.naag.docsync.domain.DomainDefinition;
import com.naag.docsync.domain.RecordDraft;
import com.naag.docsync.domain.RecordMapper;
import com.naag.docsync.embed.HybridEmbedder;
import com.naag.docsync.source.RemoteFile;
import com.naag.docsync.source.RemoteSourceClient;
import com.naag.docsync.store.HybridVectorStore;
import com.naag.docsync.store.IndexedRecord;
import com.naag.docsync.sync.SyncDecision;
import com.naag.docsync.sync.SyncEngine;
import com.naag.docsync.transform.ContentTransformer;
import com.naag.docsync.transform.ExtractedContent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Runs one domain's sync cycle: list, diff against the store, then download, transform,
 * embed and upsert each changed file in batches.
 *
 * <p>Only a listing failure fails the run. Everything that goes wrong for a single file is
 * recorded against that file with the phase it happened in, and the run moves on.
 */
@Slf4j
public class PipelineOrchestrator {

    static final String MDC_KEY = "pipeline";

    private final DomainDefinition definition;
    private final RecordMapper mapper;
    private final SyncEngine syncEngine;
    private final RemoteSourceClient source;
    private final ContentTransformer transformer;
    private final HybridEmbedder embedder;
    private final HybridVectorStore store;
    private final Clock clock;

    private static final long MIN_WAIT_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final AtomicInteger threadCounter = new AtomicInteger();

    public PipelineOrchestrator(DomainDefinition definition, RecordMapper mapper, SyncEngine syncEngine,
                                RemoteSourceClient source, ContentTransformer transformer,
                                HybridEmbedder embedder, HybridVectorStore store, Clock clock) {
        if (mapper.domain() != definition.domain()) {
            throw new IllegalArgumentException("Mapper for " + mapper.domain() + " cannot serve pipeline "
                    + definition.name() + " of domain " + definition.domain());
        }
        this.definition = definition;
        this.mapper = mapper;
        this.syncEngine = syncEngine;
        this.source = source;
        this.transformer = transformer;
        this.embedder = embedder;
        this.store = store;
        this.clock = clock;
    }

    public String name() {
        return definition.name();
    }

    public DomainDefinition definition() {
        return definition;
    }

    /** State of the current or most recent run. */
    public RunState state() {
        return state.get();
    }

    public RunSummary run(RunRequest request) {
        MDC.put(MDC_KEY, definition.name());
        try {
            return doRun(request);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private RunSummary doRun(RunRequest request) {
        RunSummary.Builder summary = new RunSummary.Builder(definition.name(), clock.instant(), request.dryRun());
        log.info("Run started: pipeline={} collection={} since={} dryRun={}", definition.name(),
                definition.collection(), request.since().map(Instant::toString).orElse("today"), request.dryRun());

        state.set(RunState.LISTING);
        List<RemoteFile> candidates;
        try {
            candidates = syncEngine.listChanged(definition, request.since());
        } catch (RuntimeException e) {
            log.error("Listing failed for {}: {}", definition.folderPath(), e.getMessage(), e);
            state.set(RunState.FAILED);
            return summary.failed(clock.instant(), "Listing failed: " + e.getMessage());
        }
        summary.totalCandidates(candidates.size());

        int batchSize = definition.batchSize();
        for (int from = 0; from < candidates.size(); from += batchSize) {
            List<RemoteFile> batch = candidates.subList(from, Math.min(from + batchSize, candidates.size()));
            if (Thread.currentThread().isInterrupted()) {
                cancelRemaining(candidates.subList(from, candidates.size()), summary);
                break;
            }
            log.debug("Batch {}-{} of {}", from + 1, from + batch.size(), candidates.size());

            state.set(RunState.DIFFING);
            List<RemoteFile> toProcess = diff(batch, summary);

            state.set(RunState.PROCESSING);
            boolean interrupted = processBatch(toProcess, summary, request.dryRun());
            if (interrupted) {
                cancelRemaining(candidates.subList(Math.min(from + batchSize, candidates.size()), candidates.size()), summary);
                break;
            }
        }

        RunSummary result = summary.completed(clock.instant());
        state.set(RunState.COMPLETED);
        log.info("Run completed: pipeline={} candidates={} upserted={} skipped={} errors={} took={}ms",
                definition.name(), result.totalCandidates(), result.upserted().size(), result.skipped().size(),
                result.errors().size(), Duration.between(result.startedAt(), result.completedAt()).toMillis());
        return result;
    }

    private List<RemoteFile> diff(List<RemoteFile> batch, RunSummary.Builder summary) {
        List<RemoteFile> toProcess = new ArrayList<>();
        for (RemoteFile file : batch) {
            try {
                SyncDecision decision = syncEngine.decide(definition, mapper, file);
                if (decision.shouldProcess()) {
                    toProcess.add(file);
                } else {
                    log.debug("Skipping {} (remote={}, stored={})", file.name(), file.lastModified(), decision.storedLastModified());
                    summary.skipped(new ItemOutcome.Skipped(file.id(), file.name(), file.lastModified(),
                            decision.storedLastModified()));
                }
            } catch (RuntimeException e) {
                log.warn("Change check failed for {}: {}", file.name(), e.getMessage());
                summary.failed(new ItemOutcome.Failed(file.id(), file.name(), ErrorPhase.DIFF, messageOf(e)));
            }
        }
        return toProcess;
    }

    /**
     * Runs the batch with at most {@code workers} files in flight, each on its own thread, and
     * appends the results in listing order. A file's deadline counts from the moment its thread
     * starts. A file past its deadline is abandoned: its slot is handed to the next file and it
     * may no longer write to the store. A file already writing when its deadline passes is
     * allowed to finish.
     *
     * @return true when the orchestrating thread was interrupted
     */
    private boolean processBatch(List<RemoteFile> files, RunSummary.Builder summary, boolean dryRun) {
        FileResult[] results = new FileResult[files.size()];
        BlockingQueue<FileTask> completions = new LinkedBlockingQueue<>();
        Deque<FileTask> pending = new ArrayDeque<>();
        for (int i = 0; i < files.size(); i++) {
            pending.add(new FileTask(i, files.get(i), dryRun, completions));
        }
        List<FileTask> active = new ArrayList<>();
        long timeoutNanos = definition.fileTimeout().toNanos();

        try {
            while (!pending.isEmpty() || !active.isEmpty()) {
                while (active.size() < definition.workers() && !pending.isEmpty()) {
                    FileTask task = pending.poll();
                    task.start(newWorkerThread(task));
                    active.add(task);
                }

                long waitNanos = active.stream().mapToLong(t -> t.remainingNanos(timeoutNanos)).min().orElse(0);
                FileTask done = completions.poll(Math.max(waitNanos, MIN_WAIT_NANOS), TimeUnit.NANOSECONDS);
                if (done != null && active.remove(done)) {
                    results[done.index] = done.result;
                }

                for (Iterator<FileTask> it = active.iterator(); it.hasNext(); ) {
                    FileTask task = it.next();
                    if (task.remainingNanos(timeoutNanos) <= 0 && task.abandon()) {
                        it.remove();
                        log.warn("Processing {} exceeded {}s, abandoning it", task.file.name(),
                                definition.fileTimeout().toSeconds());
                        results[task.index] = FileResult.failure(task.file, ErrorPhase.TIMEOUT,
                                "Timed out after " + definition.fileTimeout().toSeconds() + "s");
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run of {} interrupted, cancelling {} unfinished files in batch", definition.name(),
                    active.size() + pending.size());
            for (FileTask task : active) {
                if (task.abandon()) {
                    results[task.index] = FileResult.failure(task.file, ErrorPhase.CANCELLED, "Run interrupted");
                } else {
                    // already writing or finished; its outcome is real
                    results[task.index] = task.completion.join();
                }
            }
            for (FileTask task : pending) {
                results[task.index] = FileResult.failure(task.file, ErrorPhase.CANCELLED, "Run interrupted");
            }
            appendInOrder(results, summary);
            return true;
        }
        appendInOrder(results, summary);
        return false;
    }

    private static void appendInOrder(FileResult[] results, RunSummary.Builder summary) {
        for (FileResult result : results) {
            if (result.upserted() != null) {
                summary.upserted(result.upserted());
            } else {
                summary.failed(result.failed());
            }
        }
    }

    private Thread newWorkerThread(FileTask task) {
        Thread t = new Thread(task, "docsync-" + definition.name() + "-worker-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    }

    /**
     * @param mayWrite asked once, right before the store is touched; false means the file was
     *                 abandoned and must not be written
     */
    FileResult processFile(RemoteFile file, boolean dryRun, BooleanSupplier mayWrite) {
        byte[] bytes;
        try {
            bytes = source.getContent(file.id());
        } catch (RuntimeException e) {
            return FileResult.failure(file, ErrorPhase.DOWNLOAD, e);
        }

        List<RecordDraft> drafts;
        try {
            ExtractedContent content = transformer.transform(bytes, file, definition.ocrPolicy());
            drafts = mapper.map(file, content);
        } catch (RuntimeException e) {
            return FileResult.failure(file, ErrorPhase.TRANSFORM, e);
        }
        if (drafts.isEmpty()) {
            return FileResult.failure(file, ErrorPhase.TRANSFORM, "No records produced from " + file.name());
        }

        List<IndexedRecord> records = new ArrayList<>(drafts.size());
        try {
            for (RecordDraft draft : drafts) {
                records.add(new IndexedRecord(draft.id(), embedder.embedDocument(draft.searchText()),
                        embedder.sparse(draft.searchText()), draft.payload()));
            }
        } catch (RuntimeException e) {
            return FileResult.failure(file, ErrorPhase.EMBED, e);
        }

        if (!dryRun) {
            if (!mayWrite.getAsBoolean()) {
                return FileResult.failure(file, ErrorPhase.TIMEOUT, "Abandoned before writing " + file.name());
            }
            try {
                if (definition.domain().isMultiRecord()) {
                    // page or row counts may shrink between versions
                    store.deleteBySource(definition.collection(), file.id());
                }
                store.upsertAll(definition.collection(), records);
            } catch (RuntimeException e) {
                return FileResult.failure(file, ErrorPhase.UPSERT, e);
            }
        }

        log.info("{} {} ({} records, lastModified={})", dryRun ? "Would upsert" : "Upserted",
                file.name(), records.size(), file.lastModified());
        return new FileResult(new ItemOutcome.Upserted(file.id(), file.name(), file.lastModified(), records.size(), dryRun), null);
    }

    private void cancelRemaining(List<RemoteFile> remaining, RunSummary.Builder summary) {
        for (RemoteFile file : remaining) {
            summary.failed(new ItemOutcome.Failed(file.id(), file.name(), ErrorPhase.CANCELLED, "Run interrupted"));
        }
    }

    private static String messageOf(Throwable e) {
        if (e == null) return "unknown error";
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * One file on its own thread. The state moves RUNNING to WRITING (worker, before the
     * upsert) or RUNNING to ABANDONED (orchestrator, on deadline or interrupt), never both.
     */
    private final class FileTask implements Runnable {
        private static final int RUNNING = 0;
        private static final int WRITING = 1;
        private static final int FINISHED = 2;
        private static final int ABANDONED = 3;

        final int index;
        final RemoteFile file;
        final CompletableFuture<FileResult> completion = new CompletableFuture<>();
        private final boolean dryRun;
        private final BlockingQueue<FileTask> completions;
        private final AtomicInteger state = new AtomicInteger(RUNNING);
        private volatile long startedAt;
        private volatile Thread thread;
        volatile FileResult result;

        FileTask(int index, RemoteFile file, boolean dryRun, BlockingQueue<FileTask> completions) {
            this.index = index;
            this.file = file;
            this.dryRun = dryRun;
            this.completions = completions;
        }

        void start(Thread worker) {
            this.thread = worker;
            this.startedAt = System.nanoTime();
            worker.start();
        }

        long remainingNanos(long timeoutNanos) {
            return timeoutNanos - (System.nanoTime() - startedAt);
        }

        boolean abandon() {
            if (!state.compareAndSet(RUNNING, ABANDONED)) {
                return false;
            }
            thread.interrupt();
            return true;
        }

        @Override
        public void run() {
            MDC.put(MDC_KEY, definition.name());
            try {
                FileResult outcome;
                try {
                    outcome = processFile(file, dryRun, () -> state.compareAndSet(RUNNING, WRITING));
                } catch (RuntimeException e) {
                    log.warn("Unexpected failure processing {}: {}", file.name(), messageOf(e), e);
                    outcome = FileResult.failure(file, ErrorPhase.TRANSFORM, messageOf(e));
                }
                result = outcome;
                state.compareAndSet(RUNNING, FINISHED);
                state.compareAndSet(WRITING, FINISHED);
                completion.complete(outcome);
                completions.offer(this);
            } finally {
                MDC.remove(MDC_KEY);
            }
        }
    }

    record FileResult(ItemOutcome.Upserted upserted, ItemOutcome.Failed failed) {

        static FileResult failure(RemoteFile file, ErrorPhase phase, RuntimeException e) {
            log.warn("{} failed for {}: {}", phase, file.name(), messageOf(e));
            return failure(file, phase, messageOf(e));
        }

        static FileResult failure(RemoteFile file, ErrorPhase phase, String message) {
            return new FileResult(null, new ItemOutcome.Failed(file.id(), file.name(), phase, message));
        }
    }
}
