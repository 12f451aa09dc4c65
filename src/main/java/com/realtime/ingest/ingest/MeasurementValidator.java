package com.realtime.ingest.ingest;

import com.realtime.ingest.model.Measurement;
import com.realtime.ingest.model.SensorTag;
import com.realtime.ingest.util.Timestamps;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * 读数校验器
 * 校验标签、取值范围和时间戳格式
 */
public class MeasurementValidator {

    /**
     * 校验并转换为测量值（尚未做异常检测）
     *
     * @param input 请求读数
     * @return 测量值
     * @throws ValidationException 如果校验失败
     */
    public Measurement validate(MeasurementInput input) {
        if (input == null) {
            throw new ValidationException("Measurement cannot be null");
        }

        SensorTag tag = SensorTag.fromName(input.getTag())
                .orElseThrow(() -> new ValidationException(
                        "Invalid tag. Must be one of: " + SensorTag.names()));

        if (input.getValue() == null || input.getValue().isNaN() || input.getValue().isInfinite()) {
            throw new ValidationException("Value is required and must be a finite number");
        }
        double value = input.getValue();
        if (!tag.isWithinValidRange(value)) {
            throw new ValidationException(String.format("%s must be between %.1f and %.1f %s",
                    tag.getTagName(), tag.getValidMin(), tag.getValidMax(), tag.getUnit()));
        }

        return Measurement.builder()
                .timestamp(parseTimestamp(input.getTimestamp(), "Invalid timestamp format. Use ISO format."))
                .tag(tag.getTagName())
                .value(value)
                .anomaly(false)
                .build();
    }

    /**
     * 解析查询参数中的时间戳，空值返回null
     *
     * @param text 时间戳文本
     * @param name 参数名（用于错误信息）
     */
    public Instant parseOptionalTimestamp(String text, String name) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return parseTimestamp(text, "Invalid '" + name + "' timestamp format");
    }

    private Instant parseTimestamp(String text, String message) {
        if (text == null || text.isBlank()) {
            throw new ValidationException(message);
        }
        try {
            return Timestamps.parse(text);
        } catch (DateTimeParseException e) {
            throw new ValidationException(message);
        }
    }
}
