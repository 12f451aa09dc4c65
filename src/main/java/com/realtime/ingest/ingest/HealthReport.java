package com.realtime.ingest.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 健康检查结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    /**
     * healthy 或 degraded
     */
    @JsonProperty("status")
    private String status;

    /**
     * healthy 或 "unhealthy: 原因"
     */
    @JsonProperty("database")
    private String database;

    @JsonProperty("retry_queue_size")
    private int retryQueueSize;

    @JsonProperty("retry_worker_running")
    private boolean retryWorkerRunning;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
