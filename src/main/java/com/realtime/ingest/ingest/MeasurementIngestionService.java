package com.realtime.ingest.ingest;

import com.realtime.ingest.detection.AnomalyDetector;
import com.realtime.ingest.model.Measurement;
import com.realtime.ingest.model.SensorTag;
import com.realtime.ingest.retry.FailedOperationHandler;
import com.realtime.ingest.store.MeasurementRepository;
import com.realtime.ingest.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 读数采集服务
 * 校验、异常检测、同步写入主存储；写入失败时交给重试子系统
 */
public class MeasurementIngestionService {
    private static final Logger logger = LoggerFactory.getLogger(MeasurementIngestionService.class);

    private final MeasurementValidator validator;
    private final AnomalyDetector detector;
    private final MeasurementRepository repository;
    private final FailedOperationHandler failureHandler;
    private final Clock clock;

    public MeasurementIngestionService(MeasurementValidator validator,
                                       AnomalyDetector detector,
                                       MeasurementRepository repository,
                                       FailedOperationHandler failureHandler) {
        this(validator, detector, repository, failureHandler, Clock.systemUTC());
    }

    public MeasurementIngestionService(MeasurementValidator validator,
                                       AnomalyDetector detector,
                                       MeasurementRepository repository,
                                       FailedOperationHandler failureHandler,
                                       Clock clock) {
        if (validator == null || detector == null) {
            throw new IllegalArgumentException("Validator and detector cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("Repository cannot be null");
        }
        if (failureHandler == null) {
            throw new IllegalArgumentException("Failure handler cannot be null");
        }
        this.validator = validator;
        this.detector = detector;
        this.repository = repository;
        this.failureHandler = failureHandler;
        this.clock = clock;
    }

    /**
     * 采集单条读数
     *
     * @param input 请求读数
     * @return 采集结果，写入失败时为 queued_for_retry
     * @throws ValidationException 如果读数无效
     */
    public IngestResult ingest(MeasurementInput input) {
        Measurement measurement = validator.validate(input);
        measurement.setAnomaly(detector.analyzeReading(measurement.getTag(), measurement.getValue()));
        return store(measurement);
    }

    /**
     * 批量采集，单条失败不影响其他读数
     *
     * @param inputs 请求读数列表
     * @return 批量结果，顺序与输入一致
     */
    public BatchIngestResult ingestBatch(List<MeasurementInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new ValidationException("Batch must contain at least one measurement");
        }
        List<IngestResult> results = new ArrayList<>(inputs.size());
        for (MeasurementInput input : inputs) {
            try {
                results.add(ingest(input));
            } catch (ValidationException e) {
                String tag = input != null ? input.getTag() : null;
                logger.warn("Rejected measurement in batch (tag={}): {}", tag, e.getMessage());
                results.add(IngestResult.rejected(tag, e.getMessage()));
            }
        }
        logger.info("Processed batch of {} measurements", results.size());
        return BatchIngestResult.builder()
                .processed(results.size())
                .results(results)
                .build();
    }

    private IngestResult store(Measurement measurement) {
        try {
            long id = repository.insert(measurement);
            if (measurement.isAnomaly()) {
                logger.warn("Anomaly detected: {} = {}", measurement.getTag(), measurement.getValue());
            }
            return IngestResult.stored(measurement.getTag(), id, measurement.isAnomaly());
        } catch (SQLException | RuntimeException e) {
            logger.error("Failed to store measurement {} = {}, queueing for retry",
                    measurement.getTag(), measurement.getValue(), e);
            failureHandler.submitFailure(measurement.toPayload());
            return IngestResult.queued(measurement.getTag(), measurement.isAnomaly(), e.getMessage());
        }
    }

    /**
     * 查询读数
     *
     * @param tag 标签
     * @param from 起始时间文本，可为空
     * @param to 结束时间文本，可为空
     * @param anomaliesOnly 是否只返回异常值
     * @throws ValidationException 如果标签或时间参数无效
     * @throws SQLException 如果查询失败
     */
    public List<Measurement> query(String tag, String from, String to, boolean anomaliesOnly) throws SQLException {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("Query parameter 'tag' is required");
        }
        Instant start = validator.parseOptionalTimestamp(from, "from");
        Instant end = validator.parseOptionalTimestamp(to, "to");
        return repository.findByTag(tag, start, end, anomaliesOnly, MeasurementRepository.MAX_RESULTS);
    }

    /**
     * 已有数据的标签，数据库为空时返回已知标签
     */
    public List<String> tags() throws SQLException {
        List<String> tags = repository.findDistinctTags();
        return tags.isEmpty() ? SensorTag.names() : tags;
    }

    public IngestionStatistics statistics() throws SQLException {
        long total = repository.count();
        long anomalies = repository.countAnomalies();
        double rate = total > 0 ? Math.round(anomalies * 10000.0 / total) / 100.0 : 0.0;
        int queueSize = failureHandler.queueDepth();
        return IngestionStatistics.builder()
                .totalTags(repository.findDistinctTags().size())
                .totalMeasurements(total)
                .totalAnomalies(anomalies)
                .anomalyRate(rate)
                .retryQueueSize(queueSize)
                .retryQueueStatus(queueSize > 0 ? "pending" : "clear")
                .retry(failureHandler.getStatistics())
                .build();
    }

    /**
     * 健康检查，数据库不可用时为 degraded
     */
    public HealthReport health() {
        String database;
        try {
            repository.ping();
            database = HealthReport.HEALTHY;
        } catch (SQLException | RuntimeException e) {
            logger.warn("Database health check failed: {}", e.getMessage());
            database = "unhealthy: " + e.getMessage();
        }
        return HealthReport.builder()
                .status(HealthReport.HEALTHY.equals(database) ? HealthReport.HEALTHY : HealthReport.DEGRADED)
                .database(database)
                .retryQueueSize(failureHandler.queueDepth())
                .retryWorkerRunning(failureHandler.isRunning())
                .timestamp(Timestamps.format(clock.instant()))
                .build();
    }
}
