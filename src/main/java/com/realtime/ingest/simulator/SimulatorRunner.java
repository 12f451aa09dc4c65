package com.realtime.ingest.simulator;

import com.realtime.ingest.config.SimulatorConfig;
import com.realtime.ingest.ingest.BatchIngestResult;
import com.realtime.ingest.ingest.IngestStatus;
import com.realtime.ingest.ingest.MeasurementIngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 模拟数据调度器
 * 按固定间隔将模拟读数批量送入采集服务
 */
public class SimulatorRunner {
    private static final Logger logger = LoggerFactory.getLogger(SimulatorRunner.class);

    private final SimulatorConfig config;
    private final SensorSimulator simulator;
    private final MeasurementIngestionService service;
    private ScheduledExecutorService scheduler;

    public SimulatorRunner(SimulatorConfig config, SensorSimulator simulator, MeasurementIngestionService service) {
        if (config == null || simulator == null || service == null) {
            throw new IllegalArgumentException("Simulator config, simulator and service cannot be null");
        }
        this.config = config;
        this.simulator = simulator;
        this.service = service;
    }

    public synchronized void start() {
        if (scheduler != null) {
            logger.warn("Simulator is already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sensor-simulator");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tick, 0, config.getIntervalMs(), TimeUnit.MILLISECONDS);
        logger.info("Simulator started with interval {} ms", config.getIntervalMs());
    }

    /**
     * 生成并采集一批读数，异常只记录日志，保证调度不中断
     */
    void tick() {
        try {
            BatchIngestResult result = service.ingestBatch(simulator.generateBatch());
            long queued = result.countByStatus(IngestStatus.QUEUED_FOR_RETRY);
            if (queued > 0) {
                logger.warn("Simulator batch: {} of {} readings queued for retry", queued, result.getProcessed());
            } else {
                logger.debug("Simulator batch ingested: {} readings", result.getProcessed());
            }
        } catch (RuntimeException e) {
            logger.error("Simulator batch failed", e);
        }
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Simulator did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        logger.info("Simulator stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }
}
