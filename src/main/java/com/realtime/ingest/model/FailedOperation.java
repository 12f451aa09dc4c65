package com.realtime.ingest.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.realtime.ingest.util.Timestamps;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 写入失败的操作
 * 包含原始负载、重试次数和首次失败时间
 *
 * <p>序列化为扁平JSON对象：负载字段与 {@code retry_count}、{@code first_failed_at} 位于同一层级。
 * {@code firstFailedAt} 在创建后不可修改；{@code retryCount} 仅由重试工作线程和恢复管理器修改。
 */
@ToString
@EqualsAndHashCode
public class FailedOperation {

    public static final String RETRY_COUNT_FIELD = "retry_count";
    public static final String FIRST_FAILED_AT_FIELD = "first_failed_at";

    private static final Set<String> RESERVED_FIELDS = Set.of(RETRY_COUNT_FIELD, FIRST_FAILED_AT_FIELD);

    private final Map<String, Object> payload;
    private final Instant firstFailedAt;
    private int retryCount;

    /**
     * 构造函数
     *
     * @param payload 操作负载
     * @param retryCount 重试次数
     * @param firstFailedAt 首次失败时间
     */
    public FailedOperation(Map<String, Object> payload, int retryCount, Instant firstFailedAt) {
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count must be non-negative");
        }
        if (firstFailedAt == null) {
            throw new IllegalArgumentException("First failed timestamp cannot be null");
        }
        this.payload = new LinkedHashMap<>();
        payload.forEach(this::putPayloadField);
        this.retryCount = retryCount;
        this.firstFailedAt = firstFailedAt;
    }

    @JsonCreator
    FailedOperation(
            @JsonProperty(RETRY_COUNT_FIELD) Integer retryCount,
            @JsonProperty(FIRST_FAILED_AT_FIELD) String firstFailedAt) {
        if (retryCount == null) {
            throw new IllegalArgumentException("Missing field: " + RETRY_COUNT_FIELD);
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count must be non-negative");
        }
        if (firstFailedAt == null) {
            throw new IllegalArgumentException("Missing field: " + FIRST_FAILED_AT_FIELD);
        }
        this.payload = new LinkedHashMap<>();
        this.retryCount = retryCount;
        this.firstFailedAt = Timestamps.parse(firstFailedAt);
    }

    /**
     * 创建新的失败操作，重试次数为0，首次失败时间为当前时间
     */
    public static FailedOperation of(Map<String, Object> payload, Clock clock) {
        return new FailedOperation(payload, 0, clock.instant());
    }

    public static FailedOperation of(Map<String, Object> payload) {
        return of(payload, Clock.systemUTC());
    }

    /**
     * 获取负载（只读视图）
     */
    @JsonAnyGetter
    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    @JsonAnySetter
    void putPayloadField(String name, Object value) {
        // 保留字段由本对象维护，不属于负载
        if (!RESERVED_FIELDS.contains(name)) {
            payload.put(name, value);
        }
    }

    @JsonProperty(RETRY_COUNT_FIELD)
    public int getRetryCount() {
        return retryCount;
    }

    @JsonIgnore
    public Instant getFirstFailedAt() {
        return firstFailedAt;
    }

    @JsonProperty(FIRST_FAILED_AT_FIELD)
    String getFirstFailedAtText() {
        return Timestamps.format(firstFailedAt);
    }

    /**
     * 重试次数加1
     *
     * @return 新的重试次数
     */
    public int incrementRetryCount() {
        return ++retryCount;
    }

    /**
     * 重试次数归零（仅在死信恢复时使用）
     */
    public void resetRetryCount() {
        retryCount = 0;
    }

    /**
     * 日志用的简短描述
     */
    @JsonIgnore
    public String describe() {
        Object tag = payload.get("tag");
        Object value = payload.get("value");
        if (tag == null) {
            return payload.toString();
        }
        return tag + " = " + value;
    }
}
