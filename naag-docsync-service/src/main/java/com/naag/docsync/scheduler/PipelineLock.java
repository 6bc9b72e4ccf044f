package com.naag.docsync.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-blocking, non-reentrant run guard for one pipeline.
 */
public final class PipelineLock {

    private final String pipelineName;
    private final AtomicBoolean held = new AtomicBoolean(false);

    public PipelineLock(String pipelineName) {
        this.pipelineName = pipelineName;
    }

    public boolean tryAcquire() {
        return held.compareAndSet(false, true);
    }

    public void release() {
        held.set(false);
    }

    public boolean isHeld() {
        return held.get();
    }

    public String getPipelineName() {
        return pipelineName;
    }
}
