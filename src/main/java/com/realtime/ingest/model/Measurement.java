package com.realtime.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.realtime.ingest.util.Timestamps;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 传感器测量值数据模型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Measurement {

    /**
     * 数据库生成的主键，未持久化时为null
     */
    @JsonProperty("id")
    private Long id;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("value")
    private double value;

    @JsonProperty("is_anomaly")
    private boolean anomaly;

    /**
     * 转换为重试负载（timestamp/tag/value/is_anomaly）
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Timestamps.format(timestamp));
        payload.put("tag", tag);
        payload.put("value", value);
        payload.put("is_anomaly", anomaly);
        return payload;
    }

    /**
     * 从重试负载还原测量值
     *
     * @throws IllegalArgumentException 如果负载缺少必需字段或字段类型不正确
     */
    public static Measurement fromPayload(Map<String, Object> payload) {
        Object timestamp = payload.get("timestamp");
        Object tag = payload.get("tag");
        Object value = payload.get("value");
        if (timestamp == null || tag == null || !(value instanceof Number)) {
            throw new IllegalArgumentException("Payload is not a measurement: " + payload);
        }
        Object anomaly = payload.get("is_anomaly");
        return Measurement.builder()
                .timestamp(Timestamps.parse(timestamp.toString()))
                .tag(tag.toString())
                .value(((Number) value).doubleValue())
                .anomaly(Boolean.TRUE.equals(anomaly))
                .build();
    }
}
