package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.exception.QueryCancelledException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/** Sorgu başına cooperative iptal bayrağı, deadline ve atlanan actor sayacı; worker'lar arasında paylaşılır. */
public class QueryContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicLong skippedActors = new AtomicLong();
    private final long deadlineNanos;

    public QueryContext(Duration timeout) {
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
    }

    public static QueryContext withTimeout(Duration timeout) {
        return new QueryContext(timeout);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public long remainingNanos() {
        return deadlineNanos - System.nanoTime();
    }

    /** Her actor öncesi çağrılır; iptal, interrupt veya deadline aşımında QueryCancelledException. */
    public void checkCancelled() {
        if (cancelled.get()) {
            throw new QueryCancelledException("Query was cancelled");
        }
        if (Thread.currentThread().isInterrupted()) {
            cancelled.set(true);
            throw new QueryCancelledException("Query worker was interrupted");
        }
        if (remainingNanos() <= 0) {
            cancelled.set(true);
            throw new QueryCancelledException("Query exceeded its deadline");
        }
    }

    public void recordSkippedActor() {
        skippedActors.incrementAndGet();
    }

    public long getSkippedActors() {
        return skippedActors.get();
    }
}
