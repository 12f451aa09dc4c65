package com.realtime.ingest.ingest;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 单条读数的采集结果状态
 */
public enum IngestStatus {
    STORED("success"),
    QUEUED_FOR_RETRY("queued_for_retry"),
    ERROR("error");

    private final String wireName;

    IngestStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
