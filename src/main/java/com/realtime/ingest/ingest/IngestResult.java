package com.realtime.ingest.ingest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条读数的采集结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestResult {

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("status")
    private IngestStatus status;

    /**
     * 写入成功时的主键
     */
    @JsonProperty("id")
    private Long id;

    @JsonProperty("is_anomaly")
    private Boolean anomaly;

    @JsonProperty("message")
    private String message;

    @JsonProperty("error")
    private String error;

    public static IngestResult stored(String tag, long id, boolean anomaly) {
        return IngestResult.builder()
                .tag(tag)
                .status(IngestStatus.STORED)
                .id(id)
                .anomaly(anomaly)
                .build();
    }

    public static IngestResult queued(String tag, boolean anomaly, String error) {
        return IngestResult.builder()
                .tag(tag)
                .status(IngestStatus.QUEUED_FOR_RETRY)
                .anomaly(anomaly)
                .message("Database temporarily unavailable. Measurement queued for retry.")
                .error(error)
                .build();
    }

    public static IngestResult rejected(String tag, String error) {
        return IngestResult.builder()
                .tag(tag)
                .status(IngestStatus.ERROR)
                .error(error)
                .build();
    }
}
