package com.realtime.ingest.retry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 重试子系统计数器
 */
public class RetryMetrics {

    private final AtomicLong submitted = new AtomicLong(0);
    private final AtomicLong completed = new AtomicLong(0);
    private final AtomicLong retried = new AtomicLong(0);
    private final AtomicLong deadLettered = new AtomicLong(0);
    private final AtomicLong deadLetterWriteFailures = new AtomicLong(0);
    private final AtomicLong workerErrors = new AtomicLong(0);

    void recordSubmitted() {
        submitted.incrementAndGet();
    }

    void recordCompleted() {
        completed.incrementAndGet();
    }

    void recordRetried() {
        retried.incrementAndGet();
    }

    void recordDeadLettered() {
        deadLettered.incrementAndGet();
    }

    void recordDeadLetterWriteFailure() {
        deadLetterWriteFailures.incrementAndGet();
    }

    void recordWorkerError() {
        workerErrors.incrementAndGet();
    }

    public long getSubmitted() {
        return submitted.get();
    }

    public long getCompleted() {
        return completed.get();
    }

    public long getRetried() {
        return retried.get();
    }

    public long getDeadLettered() {
        return deadLettered.get();
    }

    public long getDeadLetterWriteFailures() {
        return deadLetterWriteFailures.get();
    }

    public long getWorkerErrors() {
        return workerErrors.get();
    }
}
