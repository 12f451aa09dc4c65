package com.realtime.ingest.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * 时间戳解析工具类
 * 支持ISO-8601格式：带Z、带时区偏移或不带时区（按UTC处理）
 */
public final class Timestamps {

    private Timestamps() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 解析ISO-8601时间戳
     *
     * @param text 时间戳文本
     * @return 时间点
     * @throws DateTimeParseException 如果格式无效
     */
    public static Instant parse(String text) {
        if (text == null) {
            throw new DateTimeParseException("Timestamp cannot be null", "", 0);
        }
        String value = text.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return parseWithOffset(value);
        }
    }

    private static Instant parseWithOffset(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            // 不带时区的时间戳按UTC处理
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }

    /**
     * 格式化为ISO-8601字符串（UTC）
     */
    public static String format(Instant instant) {
        return instant.toString();
    }
}
