package com.realtime.ingest.store;

import com.realtime.ingest.model.Measurement;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * 测量值仓库接口
 * 用于同步写入路径和查询
 */
public interface MeasurementRepository {

    /**
     * 查询结果上限
     */
    int MAX_RESULTS = 1000;

    /**
     * 写入测量值
     *
     * @param measurement 测量值
     * @return 生成的主键
     * @throws SQLException 如果写入失败
     */
    long insert(Measurement measurement) throws SQLException;

    /**
     * 按标签和时间范围查询，按时间倒序
     *
     * @param tag 标签
     * @param from 起始时间（包含），可为null
     * @param to 结束时间（包含），可为null
     * @param anomaliesOnly 是否只返回异常值
     * @param limit 最大返回数量
     */
    List<Measurement> findByTag(String tag, Instant from, Instant to, boolean anomaliesOnly, int limit)
            throws SQLException;

    List<String> findDistinctTags() throws SQLException;

    long count() throws SQLException;

    long countAnomalies() throws SQLException;

    /**
     * 检查数据库连通性
     *
     * @throws SQLException 如果数据库不可用
     */
    void ping() throws SQLException;
}
