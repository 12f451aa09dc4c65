package com.realtime.ingest.retry;

import com.realtime.ingest.model.FailedOperation;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 重试队列
 * 无界FIFO，支持多个生产者并发入队，由唯一的重试工作线程出队
 */
public class IntakeQueue {

    private final BlockingQueue<FailedOperation> queue = new LinkedBlockingQueue<>();

    /**
     * 入队，不阻塞
     *
     * @param operation 失败操作
     */
    public void enqueue(FailedOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation cannot be null");
        }
        // 无界队列，offer总是成功
        queue.offer(operation);
    }

    /**
     * 出队，最多等待指定时间
     *
     * @param timeout 等待时间
     * @return 队首操作，超时返回空
     * @throws InterruptedException 如果等待时被中断
     */
    public Optional<FailedOperation> dequeueWithTimeout(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * 当前队列长度（瞬时值）
     */
    public int queueDepth() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
