package com.realtime.ingest.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.realtime.ingest.config.IngestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Map;

/**
 * 配置加载器
 * 负责从YAML文件加载配置，并支持环境变量覆盖
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * 从默认配置文件加载配置
     * @return 采集服务配置对象
     * @throws IOException 如果加载失败
     */
    public static IngestConfig loadConfig() throws IOException {
        return loadConfig("application.yml");
    }

    /**
     * 从指定配置文件加载配置
     * @param configPath 配置文件路径
     * @return 采集服务配置对象
     * @throws IOException 如果加载失败
     */
    public static IngestConfig loadConfig(String configPath) throws IOException {
        return loadConfig(configPath, System.getenv());
    }

    /**
     * 从指定配置文件加载配置，使用给定的环境变量进行覆盖
     */
    static IngestConfig loadConfig(String configPath, Map<String, String> env) throws IOException {
        logger.info("Loading configuration from: {}", configPath);

        IngestConfig config;

        // 尝试从文件系统加载
        File configFile = new File(configPath);
        if (configFile.exists()) {
            logger.info("Loading configuration from file system: {}", configFile.getAbsolutePath());
            config = yamlMapper.readValue(configFile, IngestConfig.class);
        } else {
            // 从classpath加载
            logger.info("Loading configuration from classpath: {}", configPath);
            try (InputStream inputStream = ConfigLoader.class.getClassLoader().getResourceAsStream(configPath)) {
                if (inputStream == null) {
                    throw new IOException("Configuration file not found: " + configPath);
                }
                config = yamlMapper.readValue(inputStream, IngestConfig.class);
            }
        }
        if (config == null) {
            throw new IOException("Configuration file is empty: " + configPath);
        }

        applyEnvironmentOverrides(config, env);

        config.validate();

        logger.info("Configuration loaded and validated successfully");
        return config;
    }

    /**
     * 应用环境变量覆盖配置
     * 环境变量格式: INGEST_<SECTION>_<KEY>
     * 例如: INGEST_RETRY_MAXRETRIES, INGEST_DATABASE_URL
     */
    private static void applyEnvironmentOverrides(IngestConfig config, Map<String, String> env) {
        if (config.getRetry() != null) {
            overrideFromEnv(config.getRetry(), "INGEST_RETRY_", env);
        }
        if (config.getDatabase() != null) {
            overrideFromEnv(config.getDatabase(), "INGEST_DATABASE_", env);
        }
        if (config.getServer() != null) {
            overrideFromEnv(config.getServer(), "INGEST_SERVER_", env);
        }
        if (config.getAnomaly() != null) {
            overrideFromEnv(config.getAnomaly(), "INGEST_ANOMALY_", env);
        }
        if (config.getSimulator() != null) {
            overrideFromEnv(config.getSimulator(), "INGEST_SIMULATOR_", env);
        }
    }

    /**
     * 从环境变量覆盖对象字段
     */
    private static void overrideFromEnv(Object obj, String prefix, Map<String, String> env) {
        Class<?> clazz = obj.getClass();
        for (Field field : clazz.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            String envKey = prefix + field.getName().toUpperCase();
            String envValue = env.get(envKey);

            if (envValue != null) {
                try {
                    field.setAccessible(true);
                    Object convertedValue = convertValue(envValue, field.getType());
                    field.set(obj, convertedValue);
                    logger.info("Override config from environment: {} = {}", envKey,
                               field.getName().toLowerCase().contains("password") ? "***" : envValue);
                } catch (Exception e) {
                    logger.warn("Failed to override config from environment: {}", envKey, e);
                }
            }
        }
    }

    /**
     * 转换环境变量值为目标类型
     */
    private static Object convertValue(String value, Class<?> targetType) {
        if (targetType == String.class) {
            return value;
        } else if (targetType == int.class || targetType == Integer.class) {
            return Integer.parseInt(value.trim());
        } else if (targetType == long.class || targetType == Long.class) {
            return Long.parseLong(value.trim());
        } else if (targetType == double.class || targetType == Double.class) {
            return Double.parseDouble(value.trim());
        } else if (targetType == boolean.class || targetType == Boolean.class) {
            return Boolean.parseBoolean(value.trim());
        } else {
            throw new IllegalArgumentException("Unsupported type: " + targetType);
        }
    }
}
