package com.realtime.ingest.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 重试配置
 * 用于配置失败写入的重试次数、死信文件位置和工作线程参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryConfig {

    /**
     * 达到该次数后写入死信文件，默认3
     */
    @JsonProperty("maxRetries")
    @Builder.Default
    private int maxRetries = 3;

    /**
     * 死信文件路径（JSON Lines）
     */
    @JsonProperty("deadLetterPath")
    @Builder.Default
    private String deadLetterPath = "failed_measurements.jsonl";

    /**
     * 工作线程从队列取数据的等待时间（毫秒），默认1秒
     */
    @JsonProperty("pollTimeoutMs")
    @Builder.Default
    private long pollTimeoutMs = 1000L;

    /**
     * 停止工作线程时的最长等待时间（秒），默认5秒
     */
    @JsonProperty("stopTimeoutSeconds")
    @Builder.Default
    private int stopTimeoutSeconds = 5;

    /**
     * 验证配置的有效性
     * @throws IllegalArgumentException 如果配置无效
     */
    public void validate() {
        if (maxRetries < 1 || maxRetries > 30) {
            throw new IllegalArgumentException("Retry maxRetries must be between 1 and 30");
        }
        if (deadLetterPath == null || deadLetterPath.trim().isEmpty()) {
            throw new IllegalArgumentException("Retry deadLetterPath is required");
        }
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException("Retry pollTimeoutMs must be positive");
        }
        if (stopTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Retry stopTimeoutSeconds must be positive");
        }
    }
}
