package com.realtime.ingest.model;

/**
 * 失败操作在重试子系统中的状态
 * 每次尝试的结果：COMPLETED，或 RETRYING（已放回队列），重试耗尽后为 DEAD_LETTERED
 */
public enum OperationState {
    RETRYING,
    COMPLETED,
    DEAD_LETTERED,
    /**
     * 写入死信文件失败，操作已丢失（仅日志和指标可见）
     */
    DEAD_LETTER_FAILED
}
