package com.realtime.ingest.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 采集服务配置
 * 包含所有子系统的配置信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestConfig {

    /**
     * 重试配置
     */
    @JsonProperty("retry")
    private RetryConfig retry;

    /**
     * 数据库配置
     */
    @JsonProperty("database")
    private DatabaseConfig database;

    /**
     * HTTP服务配置
     */
    @JsonProperty("server")
    @Builder.Default
    private ServerConfig server = new ServerConfig();

    /**
     * 异常检测配置
     */
    @JsonProperty("anomaly")
    @Builder.Default
    private AnomalyConfig anomaly = new AnomalyConfig();

    /**
     * 模拟器配置
     */
    @JsonProperty("simulator")
    @Builder.Default
    private SimulatorConfig simulator = new SimulatorConfig();

    /**
     * 验证配置的有效性
     * @throws IllegalArgumentException 如果配置无效
     */
    public void validate() {
        if (retry == null) {
            throw new IllegalArgumentException("Retry configuration is required");
        }
        if (database == null) {
            throw new IllegalArgumentException("Database configuration is required");
        }

        retry.validate();
        database.validate();

        if (server != null) {
            server.validate();
        }
        if (anomaly != null) {
            anomaly.validate();
        }
        if (simulator != null) {
            simulator.validate();
        }
    }
}
