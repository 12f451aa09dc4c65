package com.realtime.ingest.detection;

import com.realtime.ingest.config.AnomalyConfig;
import com.realtime.ingest.model.SensorTag;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 异常检测器
 * 两种规则：标签阈值规则，以及滚动窗口均值 ± stdThreshold 倍标准差
 */
public class AnomalyDetector {

    private static final double MIN_STD = 1e-6;

    private final int windowSize;
    private final double stdThreshold;
    private final int minSamples;
    private final Map<String, Deque<Double>> history = new HashMap<>();

    public AnomalyDetector(AnomalyConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Anomaly config cannot be null");
        }
        config.validate();
        this.windowSize = config.getWindowSize();
        this.stdThreshold = config.getStdThreshold();
        this.minSamples = config.getMinSamples();
    }

    /**
     * 判断读数是否异常，并把读数加入历史（无论是否异常）
     *
     * @param tag 标签
     * @param value 读数
     * @return 是否异常
     */
    public synchronized boolean analyzeReading(String tag, double value) {
        boolean anomaly = detectAnomaly(tag, value);
        addReading(tag, value);
        return anomaly;
    }

    /**
     * 判断读数是否异常，不修改历史
     */
    public synchronized boolean detectAnomaly(String tag, double value) {
        Optional<SensorTag> sensorTag = SensorTag.fromName(tag);
        if (sensorTag.isPresent() && sensorTag.get().isOutsideAlarmRange(value)) {
            return true;
        }

        Deque<Double> values = history.get(tag);
        if (values == null || values.size() < minSamples) {
            return false;
        }

        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.size();

        double variance = 0.0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(variance / values.size());

        if (std < MIN_STD) {
            return false;
        }

        double lowerBound = mean - stdThreshold * std;
        double upperBound = mean + stdThreshold * std;
        return value < lowerBound || value > upperBound;
    }

    synchronized void addReading(String tag, double value) {
        Deque<Double> values = history.computeIfAbsent(tag, key -> new ArrayDeque<>(windowSize));
        if (values.size() == windowSize) {
            values.removeFirst();
        }
        values.addLast(value);
    }

    synchronized int historySize(String tag) {
        Deque<Double> values = history.get(tag);
        return values == null ? 0 : values.size();
    }
}
