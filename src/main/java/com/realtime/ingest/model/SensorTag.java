package com.realtime.ingest.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 发酵罐传感器标签
 * 定义每个标签的合法取值范围（用于请求校验）和告警阈值（用于异常检测）
 */
public enum SensorTag {

    FERMENTER_TEMP("fermenter_temp", "Fermenter temperature", "Celsius", 30.0, 50.0, 35.0, 45.0),
    FERMENTER_PH("fermenter_ph", "Fermenter pH level", "pH", 5.0, 9.0, 6.0, 8.0),
    AGITATOR_RPM("agitator_rpm", "Agitator rotation speed", "RPM", 200.0, 700.0, 250.0, 650.0);

    private final String tagName;
    private final String description;
    private final String unit;
    private final double validMin;
    private final double validMax;
    private final double alarmMin;
    private final double alarmMax;

    SensorTag(String tagName, String description, String unit,
              double validMin, double validMax, double alarmMin, double alarmMax) {
        this.tagName = tagName;
        this.description = description;
        this.unit = unit;
        this.validMin = validMin;
        this.validMax = validMax;
        this.alarmMin = alarmMin;
        this.alarmMax = alarmMax;
    }

    /**
     * 根据标签名查找
     */
    public static Optional<SensorTag> fromName(String tagName) {
        return Arrays.stream(values())
                .filter(tag -> tag.tagName.equals(tagName))
                .findFirst();
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(SensorTag::getTagName).collect(Collectors.toList());
    }

    public String getTagName() {
        return tagName;
    }

    public String getDescription() {
        return description;
    }

    public String getUnit() {
        return unit;
    }

    public double getValidMin() {
        return validMin;
    }

    public double getValidMax() {
        return validMax;
    }

    public double getAlarmMin() {
        return alarmMin;
    }

    public double getAlarmMax() {
        return alarmMax;
    }

    public boolean isWithinValidRange(double value) {
        return value >= validMin && value <= validMax;
    }

    public boolean isOutsideAlarmRange(double value) {
        return value < alarmMin || value > alarmMax;
    }
}
