package com.realtime.ingest.simulator;

import com.realtime.ingest.model.SensorTag;

/**
 * 模拟标签的取值特征
 */
public enum TagProfile {
    FERMENTER_TEMP(SensorTag.FERMENTER_TEMP, 37.5, 1.5, 35.0, 40.0, 0.05),
    FERMENTER_PH(SensorTag.FERMENTER_PH, 7.0, 0.3, 6.5, 7.5, 0.04),
    AGITATOR_RPM(SensorTag.AGITATOR_RPM, 450.0, 50.0, 300.0, 600.0, 0.03);

    private final SensorTag tag;
    private final double baseValue;
    private final double variation;
    private final double minValue;
    private final double maxValue;
    private final double anomalyProbability;

    TagProfile(SensorTag tag, double baseValue, double variation,
               double minValue, double maxValue, double anomalyProbability) {
        this.tag = tag;
        this.baseValue = baseValue;
        this.variation = variation;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.anomalyProbability = anomalyProbability;
    }

    public SensorTag getTag() {
        return tag;
    }

    public double getBaseValue() {
        return baseValue;
    }

    public double getVariation() {
        return variation;
    }

    public double getMinValue() {
        return minValue;
    }

    public double getMaxValue() {
        return maxValue;
    }

    public double getAnomalyProbability() {
        return anomalyProbability;
    }

    /**
     * 生成值的下界，允许低于正常范围一个波动幅度
     */
    public double lowerBound() {
        return minValue - variation;
    }

    public double upperBound() {
        return maxValue + variation;
    }
}
