package com.realtime.ingest.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.realtime.ingest.model.RetryStatistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 采集统计
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionStatistics {

    @JsonProperty("total_tags")
    private int totalTags;

    @JsonProperty("total_measurements")
    private long totalMeasurements;

    @JsonProperty("total_anomalies")
    private long totalAnomalies;

    /**
     * 异常率（百分比，保留两位小数）
     */
    @JsonProperty("anomaly_rate")
    private double anomalyRate;

    @JsonProperty("retry_queue_size")
    private int retryQueueSize;

    /**
     * pending 或 clear
     */
    @JsonProperty("retry_queue_status")
    private String retryQueueStatus;

    @JsonProperty("retry")
    private RetryStatistics retry;
}
