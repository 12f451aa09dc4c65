package com.realtime.ingest.retry;

import com.realtime.ingest.error.DeadLetterStore;
import com.realtime.ingest.model.FailedOperation;
import com.realtime.ingest.model.OperationState;
import com.realtime.ingest.store.PrimaryStoreAdapter;
import com.realtime.ingest.store.SaveResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * 重试工作线程
 * 单线程循环：从队列取出失败操作，调用主存储写入，失败时退避后重新入队，
 * 重试耗尽后写入死信存储
 *
 * <p>退避等待在本线程上执行，等待期间后续操作都无法处理。
 * 任何单次循环中的异常都会被记录并吞掉，循环继续运行。
 */
@Slf4j
public class RetryWorker implements Runnable {

    /**
     * 最后一次退避等待的指数为 maxRetries - 1，不能超过退避策略的上限
     */
    static final int MAX_RETRIES = ExponentialBackoffPolicy.MAX_EXPONENT + 1;

    private final IntakeQueue intakeQueue;
    private final PrimaryStoreAdapter primaryStore;
    private final DeadLetterStore deadLetterStore;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final int maxRetries;
    private final Duration pollTimeout;
    private final RetryMetrics metrics;

    private volatile boolean running = false;

    public RetryWorker(IntakeQueue intakeQueue,
                       PrimaryStoreAdapter primaryStore,
                       DeadLetterStore deadLetterStore,
                       BackoffPolicy backoffPolicy,
                       Sleeper sleeper,
                       int maxRetries,
                       Duration pollTimeout,
                       RetryMetrics metrics) {
        if (intakeQueue == null || primaryStore == null || deadLetterStore == null) {
            throw new IllegalArgumentException("Queue, primary store and dead letter store cannot be null");
        }
        if (maxRetries < 1 || maxRetries > MAX_RETRIES) {
            throw new IllegalArgumentException("Max retries must be between 1 and " + MAX_RETRIES);
        }
        this.intakeQueue = intakeQueue;
        this.primaryStore = primaryStore;
        this.deadLetterStore = deadLetterStore;
        this.backoffPolicy = backoffPolicy != null ? backoffPolicy : BackoffPolicy.exponential();
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.maxRetries = maxRetries;
        this.pollTimeout = pollTimeout != null ? pollTimeout : Duration.ofSeconds(1);
        this.metrics = metrics != null ? metrics : new RetryMetrics();
    }

    /**
     * 标记为运行状态，必须在线程启动前调用
     */
    void markRunning() {
        running = true;
    }

    /**
     * 请求停止，循环在当前迭代结束后退出
     */
    void requestStop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void run() {
        log.info("Retry worker started (maxRetries={}, pollTimeout={})", maxRetries, pollTimeout);
        while (running) {
            try {
                Optional<FailedOperation> next = intakeQueue.dequeueWithTimeout(pollTimeout);
                if (next.isEmpty()) {
                    continue;
                }
                process(next.get());
            } catch (InterruptedException e) {
                if (!running) {
                    break;
                }
                log.debug("Retry worker interrupted while running, continuing");
            } catch (Exception e) {
                metrics.recordWorkerError();
                log.error("Error in retry worker", e);
            }
        }
        log.info("Retry worker stopped ({} operations left in queue)", intakeQueue.queueDepth());
    }

    /**
     * 处理一个失败操作
     *
     * @param operation 失败操作
     * @return 处理后的状态
     * @throws InterruptedException 如果退避等待被中断（操作已重新入队）
     * @throws IllegalArgumentException 如果退避策略拒绝当前重试次数（操作已重新入队）
     */
    OperationState process(FailedOperation operation) throws InterruptedException {
        SaveResult result = attemptSave(operation);

        if (result.isSuccess()) {
            metrics.recordCompleted();
            log.info("Successfully retried: {}", operation.describe());
            return OperationState.COMPLETED;
        }

        int retryCount = operation.incrementRetryCount();
        if (retryCount < maxRetries) {
            metrics.recordRetried();
            try {
                Duration backoff = backoffPolicy.delay(retryCount);
                log.warn("Retry {}/{} for {} failed ({}), retrying in {} ms",
                        retryCount, maxRetries, operation.describe(), result.getReason(), backoff.toMillis());
                sleeper.sleep(backoff);
            } finally {
                // 退避计算失败或等待被中断时也要放回队列
                intakeQueue.enqueue(operation);
            }
            return OperationState.RETRYING;
        }

        log.error("Max retries exceeded for {} - saving to dead letter file", operation.describe());
        try {
            deadLetterStore.append(operation);
            metrics.recordDeadLettered();
            return OperationState.DEAD_LETTERED;
        } catch (IOException e) {
            metrics.recordDeadLetterWriteFailure();
            log.error("Failed to write to dead letter file, operation lost: {}", operation, e);
            return OperationState.DEAD_LETTER_FAILED;
        }
    }

    private SaveResult attemptSave(FailedOperation operation) {
        try {
            SaveResult result = primaryStore.save(operation);
            return result != null ? result : SaveResult.failure("Primary store returned no result");
        } catch (RuntimeException e) {
            log.warn("Primary store threw while saving {}", operation.describe(), e);
            return SaveResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
