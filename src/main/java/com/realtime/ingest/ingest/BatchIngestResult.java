package com.realtime.ingest.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 批量采集结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestResult {

    @JsonProperty("status")
    @Builder.Default
    private String status = "success";

    @JsonProperty("processed")
    private int processed;

    @JsonProperty("results")
    private List<IngestResult> results;

    @JsonIgnore
    public long countByStatus(IngestStatus status) {
        return results.stream().filter(result -> result.getStatus() == status).count();
    }
}
