package com.realtime.ingest;

import com.realtime.ingest.config.IngestConfig;
import com.realtime.ingest.detection.AnomalyDetector;
import com.realtime.ingest.ingest.MeasurementIngestionService;
import com.realtime.ingest.ingest.MeasurementValidator;
import com.realtime.ingest.model.RecoveryResult;
import com.realtime.ingest.retry.FailedOperationHandler;
import com.realtime.ingest.server.IngestionHttpServer;
import com.realtime.ingest.simulator.SensorSimulator;
import com.realtime.ingest.simulator.SimulatorRunner;
import com.realtime.ingest.store.JdbcMeasurementStore;
import com.realtime.ingest.util.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 传感器采集服务入口
 *
 * 启动顺序：加载配置 → 初始化表结构 → 回放死信文件 → 启动重试线程 → 启动HTTP服务（和模拟器）
 * 关闭钩子按相反顺序停止
 */
public class SensorIngestionApp {
    private static final Logger logger = LoggerFactory.getLogger(SensorIngestionApp.class);

    private final IngestConfig config;
    private final FailedOperationHandler failureHandler;
    private final IngestionHttpServer httpServer;
    private final SimulatorRunner simulatorRunner;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    SensorIngestionApp(IngestConfig config) throws Exception {
        this.config = config;

        JdbcMeasurementStore store = new JdbcMeasurementStore(config.getDatabase());
        store.initializeSchema();

        this.failureHandler = FailedOperationHandler.fromConfig(config.getRetry(), store);
        MeasurementIngestionService service = new MeasurementIngestionService(
                new MeasurementValidator(),
                new AnomalyDetector(config.getAnomaly()),
                store,
                failureHandler);

        this.httpServer = config.getServer().isEnabled()
                ? new IngestionHttpServer(config.getServer(), service)
                : null;
        this.simulatorRunner = config.getSimulator().isEnabled()
                ? new SimulatorRunner(config.getSimulator(), new SensorSimulator(), service)
                : null;
    }

    void start() throws Exception {
        RecoveryResult recovery = failureHandler.recoverOnStartup();
        logger.info("Startup recovery finished: {}", recovery);

        failureHandler.start();

        if (httpServer != null) {
            httpServer.start();
        } else {
            logger.info("HTTP server is disabled");
        }
        if (simulatorRunner != null) {
            simulatorRunner.start();
        }
    }

    void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down sensor ingestion service...");
        if (simulatorRunner != null) {
            simulatorRunner.stop();
        }
        if (httpServer != null && httpServer.isRunning()) {
            httpServer.stop();
        }
        Duration timeout = Duration.ofSeconds(config.getRetry().getStopTimeoutSeconds());
        if (!failureHandler.stop(timeout)) {
            logger.warn("Retry worker still running after {} seconds", timeout.getSeconds());
        }
        logger.info("Sensor ingestion service stopped");
        terminated.countDown();
    }

    /**
     * 阻塞直到关闭完成，工作线程均为守护线程
     */
    void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public static void main(String[] args) throws Exception {
        logger.info("Starting sensor ingestion service...");

        String configPath = args.length > 0 ? args[0] : "application.yml";
        IngestConfig config = ConfigLoader.loadConfig(configPath);

        SensorIngestionApp app = new SensorIngestionApp(config);
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown-hook"));

        try {
            app.start();
        } catch (Exception e) {
            logger.error("Failed to start sensor ingestion service", e);
            app.shutdown();
            System.exit(1);
        }
        logger.info("Sensor ingestion service started");
        app.awaitTermination();
    }
}
