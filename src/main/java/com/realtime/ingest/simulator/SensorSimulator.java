package com.realtime.ingest.simulator;

import com.realtime.ingest.ingest.MeasurementInput;
import com.realtime.ingest.util.Timestamps;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 发酵罐传感器数据模拟器
 * 基准值叠加正弦波动和高斯噪声，按概率注入尖峰或跌落
 *
 * <p>非线程安全，由单个调度线程使用。
 */
public class SensorSimulator {

    private final Random random;
    private final Clock clock;
    private long timeStep = 0;

    public SensorSimulator() {
        this(new Random(), Clock.systemUTC());
    }

    public SensorSimulator(Random random, Clock clock) {
        if (random == null || clock == null) {
            throw new IllegalArgumentException("Random and clock cannot be null");
        }
        this.random = random;
        this.clock = clock;
    }

    /**
     * 模拟标签的元数据
     */
    public List<Map<String, Object>> getTagsMetadata() {
        List<Map<String, Object>> metadata = new ArrayList<>();
        for (TagProfile profile : TagProfile.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", profile.getTag().getTagName());
            entry.put("description", profile.getTag().getDescription());
            entry.put("unit", profile.getTag().getUnit());
            entry.put("min_value", profile.getMinValue());
            entry.put("max_value", profile.getMaxValue());
            metadata.add(entry);
        }
        return metadata;
    }

    /**
     * 为指定标签生成一条读数
     */
    public MeasurementInput generateReading(TagProfile profile) {
        double variation = profile.getVariation();
        double sine = Math.sin(timeStep * 0.1) * variation * 0.5;
        double noise = random.nextGaussian() * variation * 0.2;
        double value = profile.getBaseValue() + sine + noise;

        if (random.nextDouble() < profile.getAnomalyProbability()) {
            if (random.nextDouble() < 0.5) {
                value += variation * uniform(3, 5);
            } else {
                value -= variation * uniform(2, 4);
            }
        }

        value = Math.max(profile.lowerBound(), Math.min(profile.upperBound(), value));

        return MeasurementInput.builder()
                .timestamp(Timestamps.format(clock.instant()))
                .tag(profile.getTag().getTagName())
                .value(Math.round(value * 100.0) / 100.0)
                .build();
    }

    /**
     * 推进一个时间步并为所有标签生成读数
     */
    public List<MeasurementInput> generateBatch() {
        timeStep++;
        List<MeasurementInput> batch = new ArrayList<>();
        for (TagProfile profile : TagProfile.values()) {
            batch.add(generateReading(profile));
        }
        return batch;
    }

    public long getTimeStep() {
        return timeStep;
    }

    private double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }
}
