package com.realtime.ingest.store;

import com.realtime.ingest.config.DatabaseConfig;
import com.realtime.ingest.model.FailedOperation;
import com.realtime.ingest.model.Measurement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于JDBC的测量值存储
 * 每次调用使用独立连接，因此重试线程的写入与原始请求的会话互不影响
 */
public class JdbcMeasurementStore implements MeasurementRepository, PrimaryStoreAdapter {
    private static final Logger logger = LoggerFactory.getLogger(JdbcMeasurementStore.class);

    private static final String CREATE_TABLE_SQL =
            "CREATE TABLE IF NOT EXISTS measurements ("
            + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " recorded_at TIMESTAMP NOT NULL,"
            + " tag VARCHAR(100) NOT NULL,"
            + " reading_value DOUBLE PRECISION NOT NULL,"
            + " is_anomaly BOOLEAN DEFAULT FALSE NOT NULL)";
    private static final String CREATE_INDEX_SQL =
            "CREATE INDEX IF NOT EXISTS idx_measurements_tag_time ON measurements (tag, recorded_at)";
    private static final String INSERT_SQL =
            "INSERT INTO measurements (recorded_at, tag, reading_value, is_anomaly) VALUES (?, ?, ?, ?)";

    private final DatabaseConfig databaseConfig;

    /**
     * 构造函数
     * @param databaseConfig 数据库配置
     */
    public JdbcMeasurementStore(DatabaseConfig databaseConfig) {
        if (databaseConfig == null) {
            throw new IllegalArgumentException("Database config cannot be null");
        }
        databaseConfig.validate();
        this.databaseConfig = databaseConfig;
    }

    /**
     * 创建新的数据库连接
     */
    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(
                databaseConfig.getUrl(), databaseConfig.getUsername(), databaseConfig.getPassword());
    }

    /**
     * 初始化表结构（表不存在时创建）
     * @throws SQLException 如果创建失败
     */
    public void initializeSchema() throws SQLException {
        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_INDEX_SQL);
            logger.info("Table 'measurements' is ready");
        }
    }

    @Override
    public long insert(Measurement measurement) throws SQLException {
        try (Connection conn = getConnection();
             PreparedStatement pstmt = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            pstmt.setTimestamp(1, Timestamp.from(measurement.getTimestamp()));
            pstmt.setString(2, measurement.getTag());
            pstmt.setDouble(3, measurement.getValue());
            pstmt.setBoolean(4, measurement.isAnomaly());
            pstmt.executeUpdate();

            try (ResultSet keys = pstmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated key returned for measurement insert");
                }
                long id = keys.getLong(1);
                measurement.setId(id);
                return id;
            }
        }
    }

    /**
     * 重试路径的写入：把失败操作的负载还原为测量值并写入
     */
    @Override
    public SaveResult save(FailedOperation operation) {
        try {
            Measurement measurement = Measurement.fromPayload(operation.getPayload());
            insert(measurement);
            return SaveResult.success();
        } catch (SQLException | RuntimeException e) {
            logger.warn("Retry save failed for {}: {}", operation.describe(), e.getMessage());
            return SaveResult.failure(e.getMessage(), e);
        }
    }

    @Override
    public List<Measurement> findByTag(String tag, Instant from, Instant to, boolean anomaliesOnly, int limit)
            throws SQLException {
        StringBuilder sql = new StringBuilder(
                "SELECT id, recorded_at, tag, reading_value, is_anomaly FROM measurements WHERE tag = ?");
        if (anomaliesOnly) {
            sql.append(" AND is_anomaly = TRUE");
        }
        if (from != null) {
            sql.append(" AND recorded_at >= ?");
        }
        if (to != null) {
            sql.append(" AND recorded_at <= ?");
        }
        sql.append(" ORDER BY recorded_at DESC, id DESC FETCH FIRST ? ROWS ONLY");

        try (Connection conn = getConnection();
             PreparedStatement pstmt = conn.prepareStatement(sql.toString())) {
            int index = 1;
            pstmt.setString(index++, tag);
            if (from != null) {
                pstmt.setTimestamp(index++, Timestamp.from(from));
            }
            if (to != null) {
                pstmt.setTimestamp(index++, Timestamp.from(to));
            }
            pstmt.setInt(index, Math.min(limit, MAX_RESULTS));

            List<Measurement> results = new ArrayList<>();
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    results.add(Measurement.builder()
                            .id(rs.getLong("id"))
                            .timestamp(rs.getTimestamp("recorded_at").toInstant())
                            .tag(rs.getString("tag"))
                            .value(rs.getDouble("reading_value"))
                            .anomaly(rs.getBoolean("is_anomaly"))
                            .build());
                }
            }
            return results;
        }
    }

    @Override
    public List<String> findDistinctTags() throws SQLException {
        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT DISTINCT tag FROM measurements ORDER BY tag")) {
            List<String> tags = new ArrayList<>();
            while (rs.next()) {
                tags.add(rs.getString(1));
            }
            return tags;
        }
    }

    @Override
    public long count() throws SQLException {
        return queryForLong("SELECT COUNT(*) FROM measurements");
    }

    @Override
    public long countAnomalies() throws SQLException {
        return queryForLong("SELECT COUNT(*) FROM measurements WHERE is_anomaly = TRUE");
    }

    @Override
    public void ping() throws SQLException {
        queryForLong("SELECT 1");
    }

    private long queryForLong(String sql) throws SQLException {
        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }
}
