package com.realtime.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 死信恢复结果统计
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryResult {

    /**
     * 立即重新写入成功的记录数
     */
    private int recovered;

    /**
     * 重新写入失败、已放回重试队列的记录数
     */
    private int pending;

    /**
     * 无法解析而被跳过的行数
     */
    private int malformed;

    /**
     * 死信文件是否已删除
     */
    private boolean fileDeleted;

    /**
     * 备份文件路径（部分恢复时）
     */
    private String backupPath;

    public static RecoveryResult empty() {
        return new RecoveryResult();
    }

    /**
     * 所有记录都已处理完毕
     */
    public boolean isFullyRecovered() {
        return pending == 0 && malformed == 0;
    }

    @Override
    public String toString() {
        return String.format("RecoveryResult{recovered=%d, pending=%d, malformed=%d, fileDeleted=%s, backupPath=%s}",
                recovered, pending, malformed, fileDeleted, backupPath);
    }
}
