package com.realtime.ingest.store;

import com.realtime.ingest.model.FailedOperation;

/**
 * 主存储适配器
 * 由采集服务提供的"尝试持久化"能力，供重试工作线程和恢复管理器调用
 *
 * <p>实现必须能容忍同一逻辑负载被多次写入（至少一次语义），
 * 且不能依赖原始请求的事务或会话。调用本身的超时由实现负责。
 */
@FunctionalInterface
public interface PrimaryStoreAdapter {

    /**
     * 尝试持久化操作负载
     *
     * @param operation 失败操作
     * @return 写入结果，失败时不抛出异常
     */
    SaveResult save(FailedOperation operation);
}
