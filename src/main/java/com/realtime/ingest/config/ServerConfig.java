package com.realtime.ingest.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * HTTP服务配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServerConfig {

    /**
     * 是否启动HTTP服务
     */
    @JsonProperty("enabled")
    @Builder.Default
    private boolean enabled = true;

    /**
     * 监听地址
     */
    @JsonProperty("host")
    @Builder.Default
    private String host = "0.0.0.0";

    /**
     * 监听端口，0表示由系统分配
     */
    @JsonProperty("port")
    @Builder.Default
    private int port = 8000;

    /**
     * 请求处理线程数
     */
    @JsonProperty("threads")
    @Builder.Default
    private int threads = 4;

    /**
     * 验证配置的有效性
     * @throws IllegalArgumentException 如果配置无效
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("Server host is required");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Server port must be between 0 and 65535");
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("Server threads must be positive");
        }
    }
}
