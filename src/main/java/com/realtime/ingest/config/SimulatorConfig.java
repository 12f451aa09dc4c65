package com.realtime.ingest.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 模拟数据生成器配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulatorConfig {

    @JsonProperty("enabled")
    @Builder.Default
    private boolean enabled = false;

    /**
     * 生成间隔（毫秒），默认1秒
     */
    @JsonProperty("intervalMs")
    @Builder.Default
    private long intervalMs = 1000L;

    public void validate() {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Simulator intervalMs must be positive");
        }
    }
}
