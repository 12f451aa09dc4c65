package com.realtime.ingest.retry;

import java.time.Duration;

/**
 * 指数退避策略
 * delay(n) = unit * 2^n，第n次失败之后、第n+1次尝试之前等待
 *
 * <p>等待在唯一的工作线程上执行，等待期间其他操作都无法推进。
 * maxRetries = k 时，一个持续失败的操作最多占用工作线程 Σ2^i (i=1..k-1) 个单位时间，
 * 例如 k=3 时为 2+4=6 秒。
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    /**
     * 最大指数，避免溢出
     */
    static final int MAX_EXPONENT = 30;

    private final Duration unit;

    public ExponentialBackoffPolicy() {
        this(Duration.ofSeconds(1));
    }

    /**
     * @param unit 时间单位（默认1秒）
     */
    public ExponentialBackoffPolicy(Duration unit) {
        if (unit == null || unit.isNegative()) {
            throw new IllegalArgumentException("Backoff unit must be non-negative");
        }
        this.unit = unit;
    }

    @Override
    public Duration delay(int retryCount) {
        if (retryCount < 0 || retryCount > MAX_EXPONENT) {
            throw new IllegalArgumentException("Retry count must be between 0 and " + MAX_EXPONENT);
        }
        return unit.multipliedBy(1L << retryCount);
    }

    /**
     * 单个持续失败的操作在进入死信前占用工作线程的总等待时间
     *
     * @param maxRetries 最大重试次数
     * @return 累计等待时间
     */
    public Duration worstCaseStall(int maxRetries) {
        Duration total = Duration.ZERO;
        for (int i = 1; i < maxRetries; i++) {
            total = total.plus(delay(i));
        }
        return total;
    }
}
