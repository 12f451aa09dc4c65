package com.realtime.ingest.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 数据库配置
 * 用于配置测量值主存储的JDBC连接参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseConfig {

    /**
     * JDBC URL
     */
    @JsonProperty("url")
    @Builder.Default
    private String url = "jdbc:h2:./data/sensor_data";

    /**
     * 数据库用户名
     */
    @JsonProperty("username")
    @Builder.Default
    private String username = "sa";

    /**
     * 数据库密码
     */
    @JsonProperty("password")
    @Builder.Default
    private String password = "";

    /**
     * 验证配置的有效性
     * @throws IllegalArgumentException 如果配置无效
     */
    public void validate() {
        if (url == null || url.trim().isEmpty()) {
            throw new IllegalArgumentException("Database url is required");
        }
        if (!url.startsWith("jdbc:")) {
            throw new IllegalArgumentException("Database url must start with 'jdbc:'");
        }
        if (username == null || username.trim().isEmpty()) {
            throw new IllegalArgumentException("Database username is required");
        }
        if (password == null) {
            throw new IllegalArgumentException("Database password is required");
        }
    }
}
