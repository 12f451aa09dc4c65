package com.realtime.ingest.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 异常检测配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyConfig {

    /**
     * 每个标签保留的历史读数数量
     */
    @JsonProperty("windowSize")
    @Builder.Default
    private int windowSize = 50;

    /**
     * 标准差倍数阈值
     */
    @JsonProperty("stdThreshold")
    @Builder.Default
    private double stdThreshold = 3.0;

    /**
     * 开始统计检测所需的最少样本数
     */
    @JsonProperty("minSamples")
    @Builder.Default
    private int minSamples = 10;

    /**
     * 验证配置的有效性
     * @throws IllegalArgumentException 如果配置无效
     */
    public void validate() {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Anomaly windowSize must be positive");
        }
        if (stdThreshold <= 0) {
            throw new IllegalArgumentException("Anomaly stdThreshold must be positive");
        }
        if (minSamples < 2 || minSamples > windowSize) {
            throw new IllegalArgumentException("Anomaly minSamples must be between 2 and windowSize");
        }
    }
}
