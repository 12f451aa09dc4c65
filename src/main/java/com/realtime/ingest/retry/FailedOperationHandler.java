package com.realtime.ingest.retry;

import com.realtime.ingest.config.RetryConfig;
import com.realtime.ingest.error.DeadLetterStore;
import com.realtime.ingest.error.JsonLinesDeadLetterStore;
import com.realtime.ingest.model.FailedOperation;
import com.realtime.ingest.model.RecoveryResult;
import com.realtime.ingest.model.RetryStatistics;
import com.realtime.ingest.store.PrimaryStoreAdapter;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * 失败写入处理器
 * 重试子系统对外的入口：接收失败写入、启动时回放死信、管理重试工作线程的生命周期
 *
 * <p>预期调用顺序：构造 → {@link #recoverOnStartup()} → {@link #start()} →
 * {@link #submitFailure(Map)}（任意线程、任意次数）→ {@link #stop(Duration)}。
 *
 * <p>停止时仍在队列中的操作不会写入死信文件，进程退出后丢失。
 */
public class FailedOperationHandler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FailedOperationHandler.class);

    private static final String WORKER_THREAD_NAME = "retry-worker";

    private final IntakeQueue intakeQueue;
    private final RetryWorker retryWorker;
    private final RecoveryManager recoveryManager;
    private final RetryMetrics metrics;
    private final Clock clock;
    private final Duration defaultStopTimeout;

    private volatile Thread workerThread;
    private boolean recoveryDone = false;
    private boolean started = false;

    /**
     * 构造函数
     *
     * @param primaryStore 主存储适配器
     * @param deadLetterStore 死信存储
     * @param maxRetries 最大重试次数
     * @param backoffPolicy 退避策略，null时使用2^n秒
     * @param sleeper 退避等待实现，null时使用Thread.sleep
     * @param pollTimeout 出队等待时间，null时为1秒
     * @param stopTimeout {@link #close()} 使用的停止超时，null时为5秒
     * @param clock 时钟，null时使用UTC系统时钟
     */
    @Builder
    public FailedOperationHandler(PrimaryStoreAdapter primaryStore,
                                  DeadLetterStore deadLetterStore,
                                  int maxRetries,
                                  BackoffPolicy backoffPolicy,
                                  Sleeper sleeper,
                                  Duration pollTimeout,
                                  Duration stopTimeout,
                                  Clock clock) {
        if (primaryStore == null) {
            throw new IllegalArgumentException("Primary store cannot be null");
        }
        if (deadLetterStore == null) {
            throw new IllegalArgumentException("Dead letter store cannot be null");
        }
        this.intakeQueue = new IntakeQueue();
        this.metrics = new RetryMetrics();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.defaultStopTimeout = stopTimeout != null ? stopTimeout : Duration.ofSeconds(5);
        this.retryWorker = new RetryWorker(intakeQueue, primaryStore, deadLetterStore,
                backoffPolicy, sleeper, maxRetries, pollTimeout, metrics);
        this.recoveryManager = new RecoveryManager(deadLetterStore, primaryStore, intakeQueue);
    }

    /**
     * 根据配置创建处理器
     */
    public static FailedOperationHandler fromConfig(RetryConfig config, PrimaryStoreAdapter primaryStore) {
        if (config == null) {
            throw new IllegalArgumentException("Retry config cannot be null");
        }
        config.validate();
        return FailedOperationHandler.builder()
                .primaryStore(primaryStore)
                .deadLetterStore(new JsonLinesDeadLetterStore(config.getDeadLetterPath()))
                .maxRetries(config.getMaxRetries())
                .backoffPolicy(BackoffPolicy.exponential())
                .pollTimeout(Duration.ofMillis(config.getPollTimeoutMs()))
                .stopTimeout(Duration.ofSeconds(config.getStopTimeoutSeconds()))
                .build();
    }

    /**
     * 提交一次失败写入，不阻塞，不向调用方抛出异常
     *
     * @param payload 原始写入负载
     */
    public void submitFailure(Map<String, Object> payload) {
        if (payload == null) {
            logger.error("Ignoring null payload submitted for retry");
            return;
        }
        try {
            FailedOperation operation = FailedOperation.of(payload, clock);
            intakeQueue.enqueue(operation);
            metrics.recordSubmitted();
            logger.warn("Measurement queued for retry: {}", operation.describe());
        } catch (RuntimeException e) {
            logger.error("Failed to queue payload for retry: {}", payload, e);
        }
    }

    /**
     * 启动时回放死信文件，必须在 {@link #start()} 之前调用且只调用一次
     *
     * @return 恢复结果
     * @throws IllegalStateException 如果工作线程已启动或已执行过恢复
     */
    public synchronized RecoveryResult recoverOnStartup() {
        if (started) {
            throw new IllegalStateException("Recovery must run before the retry worker is started");
        }
        if (recoveryDone) {
            throw new IllegalStateException("Recovery has already run");
        }
        recoveryDone = true;
        return recoveryManager.recover();
    }

    /**
     * 启动重试工作线程
     */
    public synchronized void start() {
        if (workerThread != null && workerThread.isAlive()) {
            logger.warn("Retry worker is already running");
            return;
        }
        if (!recoveryDone) {
            logger.warn("Starting retry worker without a recovery pass");
        }
        started = true;
        retryWorker.markRunning();
        workerThread = new Thread(retryWorker, WORKER_THREAD_NAME);
        workerThread.setDaemon(true);
        workerThread.start();
        logger.info("Retry worker started");
    }

    /**
     * 停止重试工作线程
     * 在工作线程退出或超时后返回，不会无限等待
     *
     * @param timeout 最长等待时间
     * @return 工作线程是否已在超时前退出
     */
    public synchronized boolean stop(Duration timeout) {
        if (workerThread == null) {
            logger.warn("Retry worker is not running");
            return true;
        }

        retryWorker.requestStop();
        try {
            // join(0)表示无限等待，至少等待1毫秒
            workerThread.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for retry worker to stop");
        }

        boolean stopped = !workerThread.isAlive();
        if (stopped) {
            workerThread = null;
        } else {
            // 唤醒正在退避等待的工作线程，不再等待其退出
            workerThread.interrupt();
            logger.warn("Retry worker did not stop within {} ms", timeout.toMillis());
        }

        int remaining = intakeQueue.queueDepth();
        if (remaining > 0) {
            logger.warn("{} operations still in retry queue at shutdown will be lost", remaining);
        }
        logger.info("Retry worker stop requested (stopped={})", stopped);
        return stopped;
    }

    public boolean isRunning() {
        Thread thread = workerThread;
        return thread != null && thread.isAlive() && retryWorker.isRunning();
    }

    /**
     * 当前重试队列长度
     */
    public int queueDepth() {
        return intakeQueue.queueDepth();
    }

    /**
     * 指标快照
     */
    public RetryStatistics getStatistics() {
        return RetryStatistics.builder()
                .running(isRunning())
                .queueDepth(queueDepth())
                .submitted(metrics.getSubmitted())
                .completed(metrics.getCompleted())
                .retried(metrics.getRetried())
                .deadLettered(metrics.getDeadLettered())
                .deadLetterWriteFailures(metrics.getDeadLetterWriteFailures())
                .workerErrors(metrics.getWorkerErrors())
                .build();
    }

    IntakeQueue getIntakeQueue() {
        return intakeQueue;
    }

    @Override
    public void close() {
        stop(defaultStopTimeout);
    }
}
