package com.realtime.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 重试子系统指标快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryStatistics {

    @JsonProperty("running")
    private boolean running;

    @JsonProperty("queueDepth")
    private int queueDepth;

    @JsonProperty("submitted")
    private long submitted;

    @JsonProperty("completed")
    private long completed;

    @JsonProperty("retried")
    private long retried;

    @JsonProperty("deadLettered")
    private long deadLettered;

    @JsonProperty("deadLetterWriteFailures")
    private long deadLetterWriteFailures;

    @JsonProperty("workerErrors")
    private long workerErrors;
}
