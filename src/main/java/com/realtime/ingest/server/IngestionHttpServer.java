package com.realtime.ingest.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.realtime.ingest.config.ServerConfig;
import com.realtime.ingest.ingest.MeasurementIngestionService;
import com.realtime.ingest.ingest.MeasurementInput;
import com.realtime.ingest.ingest.ValidationException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 采集HTTP服务
 * 提供读数采集、查询、统计和健康检查端点
 *
 * 端点:
 * - POST /ingest - 采集单条读数（201）
 * - POST /ingest/batch - 批量采集（201）
 * - GET /data?tag=&from=&to= - 查询读数
 * - GET /anomalies?tag=&from=&to= - 查询异常读数
 * - GET /tags - 标签列表
 * - GET /stats - 统计信息
 * - GET /health - 健康检查
 */
public class IngestionHttpServer {
    private static final Logger logger = LoggerFactory.getLogger(IngestionHttpServer.class);

    private static final int BACKLOG = 0; // 使用系统默认值
    private static final int STOP_DELAY_SECONDS = 2;

    private final ServerConfig config;
    private final MeasurementIngestionService service;
    private final ObjectMapper objectMapper;
    private HttpServer server;
    private ExecutorService executor;
    private volatile boolean running = false;

    public IngestionHttpServer(ServerConfig config, MeasurementIngestionService service) {
        if (config == null) {
            throw new IllegalArgumentException("ServerConfig cannot be null");
        }
        if (service == null) {
            throw new IllegalArgumentException("MeasurementIngestionService cannot be null");
        }
        this.config = config;
        this.service = service;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * 启动HTTP服务
     * @throws IOException 如果端口绑定失败
     */
    public synchronized void start() throws IOException {
        if (running) {
            logger.warn("IngestionHttpServer is already running");
            return;
        }

        try {
            server = HttpServer.create(new InetSocketAddress(config.getHost(), config.getPort()), BACKLOG);
        } catch (IOException e) {
            logger.error("Failed to start IngestionHttpServer on {}:{}", config.getHost(), config.getPort(), e);
            throw e;
        }

        server.createContext("/", new RootHandler());
        server.createContext("/ingest", new IngestHandler());
        server.createContext("/ingest/batch", new BatchIngestHandler());
        server.createContext("/data", new QueryHandler(false));
        server.createContext("/anomalies", new QueryHandler(true));
        server.createContext("/tags", new TagsHandler());
        server.createContext("/stats", new StatsHandler());
        server.createContext("/health", new HealthHandler());

        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(config.getThreads(), r -> {
            Thread t = new Thread(r, "Ingest-Handler-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running = true;

        logger.info("IngestionHttpServer started on {}:{}", config.getHost(), getPort());
    }

    /**
     * 停止HTTP服务
     */
    public synchronized void stop() {
        if (!running) {
            logger.warn("IngestionHttpServer is not running");
            return;
        }
        server.stop(STOP_DELAY_SECONDS);
        server = null;
        executor.shutdown();
        executor = null;
        running = false;
        logger.info("IngestionHttpServer stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 实际监听端口，配置为0时由系统分配
     *
     * @throws IllegalStateException 如果服务未启动
     */
    public synchronized int getPort() {
        if (server == null) {
            throw new IllegalStateException("IngestionHttpServer is not running");
        }
        return server.getAddress().getPort();
    }

    /**
     * 端点处理器基类
     * 统一处理请求方法校验和错误响应
     */
    private abstract class JsonHandler implements HttpHandler {
        private final String method;

        JsonHandler(String method) {
            this.method = method;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!method.equals(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }
                handleRequest(exchange);
            } catch (ValidationException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (JsonProcessingException e) {
                logger.debug("Malformed request body: {}", e.getOriginalMessage());
                sendError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage());
            } catch (Exception e) {
                logger.error("Error handling {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                sendError(exchange, 500, "Internal Server Error");
            } finally {
                exchange.close();
            }
        }

        abstract void handleRequest(HttpExchange exchange) throws Exception;
    }

    private class RootHandler extends JsonHandler {
        RootHandler() {
            super("GET");
        }

        @Override
        void handleRequest(HttpExchange exchange) throws IOException {
            if (!"/".equals(exchange.getRequestURI().getPath())) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            Map<String, Object> endpoints = new LinkedHashMap<>();
            endpoints.put("ingest", "/ingest");
            endpoints.put("batch", "/ingest/batch");
            endpoints.put("tags", "/tags");
            endpoints.put("data", "/data");
            endpoints.put("anomalies", "/anomalies");
            endpoints.put("stats", "/stats");
            endpoints.put("health", "/health");

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("message", "Fermenter Monitoring API");
            response.put("version", "1.0.0");
            response.put("endpoints", endpoints);
            sendJsonResponse(exchange, 200, response);
        }
    }

    private class IngestHandler extends JsonHandler {
        IngestHandler() {
            super("POST");
        }

        @Override
        void handleRequest(HttpExchange exchange) throws IOException {
            MeasurementInput input = readBody(exchange, new TypeReference<MeasurementInput>() { });
            sendJsonResponse(exchange, 201, service.ingest(input));
        }
    }

    private class BatchIngestHandler extends JsonHandler {
        BatchIngestHandler() {
            super("POST");
        }

        @Override
        void handleRequest(HttpExchange exchange) throws IOException {
            List<MeasurementInput> inputs = readBody(exchange, new TypeReference<List<MeasurementInput>>() { });
            sendJsonResponse(exchange, 201, service.ingestBatch(inputs));
        }
    }

    /**
     * 读数查询处理器，/data 和 /anomalies 共用
     */
    private class QueryHandler extends JsonHandler {
        private final boolean anomaliesOnly;

        QueryHandler(boolean anomaliesOnly) {
            super("GET");
            this.anomaliesOnly = anomaliesOnly;
        }

        @Override
        void handleRequest(HttpExchange exchange) throws Exception {
            Map<String, String> params = parseQuery(exchange.getRequestURI().getRawQuery());
            sendJsonResponse(exchange, 200,
                    service.query(params.get("tag"), params.get("from"), params.get("to"), anomaliesOnly));
        }
    }

    private class TagsHandler extends JsonHandler {
        TagsHandler() {
            super("GET");
        }

        @Override
        void handleRequest(HttpExchange exchange) throws Exception {
            sendJsonResponse(exchange, 200, Map.of("tags", service.tags()));
        }
    }

    private class StatsHandler extends JsonHandler {
        StatsHandler() {
            super("GET");
        }

        @Override
        void handleRequest(HttpExchange exchange) throws Exception {
            sendJsonResponse(exchange, 200, service.statistics());
        }
    }

    private class HealthHandler extends JsonHandler {
        HealthHandler() {
            super("GET");
        }

        @Override
        void handleRequest(HttpExchange exchange) throws IOException {
            sendJsonResponse(exchange, 200, service.health());
        }
    }

    private <T> T readBody(HttpExchange exchange, TypeReference<T> type) throws IOException {
        try (InputStream body = exchange.getRequestBody()) {
            byte[] bytes = body.readAllBytes();
            if (bytes.length == 0) {
                throw new ValidationException("Request body is required");
            }
            return objectMapper.readValue(bytes, type);
        }
    }

    /**
     * 解析查询字符串，重复参数取最后一个
     */
    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int idx = pair.indexOf('=');
            String key = idx >= 0 ? pair.substring(0, idx) : pair;
            String value = idx >= 0 ? pair.substring(idx + 1) : "";
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private void sendJsonResponse(HttpExchange exchange, int statusCode, Object data) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(data);

        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.sendResponseHeaders(statusCode, bytes.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJsonResponse(exchange, statusCode, Map.of("detail", message));
    }
}
