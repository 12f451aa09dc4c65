package com.realtime.ingest.retry;

import java.time.Duration;

/**
 * 退避策略
 * 根据已失败次数计算下一次重试前的等待时间
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * 计算等待时间
     *
     * @param retryCount 已失败次数（从1开始）
     * @return 等待时间
     */
    Duration delay(int retryCount);

    /**
     * 默认策略：2^n 秒
     */
    static BackoffPolicy exponential() {
        return new ExponentialBackoffPolicy();
    }

    /**
     * 不等待（测试用）
     */
    static BackoffPolicy none() {
        return retryCount -> Duration.ZERO;
    }
}
