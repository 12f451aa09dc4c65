package com.realtime.ingest.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 采集请求中的单条读数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementInput {

    /**
     * ISO-8601时间戳
     */
    @JsonProperty("timestamp")
    private String timestamp;

    /**
     * 标签名（fermenter_temp, fermenter_ph, agitator_rpm）
     */
    @JsonProperty("tag")
    private String tag;

    @JsonProperty("value")
    private Double value;
}
