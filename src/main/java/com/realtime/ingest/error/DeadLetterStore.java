package com.realtime.ingest.error;

import com.realtime.ingest.model.FailedOperation;

import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * 死信存储接口
 * 只追加的持久化日志，保存重试耗尽的失败操作，并在启动时提供回放读取
 */
public interface DeadLetterStore {

    /**
     * 追加一条死信记录，返回前确保已刷盘
     *
     * @param operation 失败操作
     * @throws IOException 如果写入失败
     */
    void append(FailedOperation operation) throws IOException;

    /**
     * 逐行读取所有记录
     * 返回的流是惰性的、有限的，每次调用都从头读取；调用方负责关闭。
     * 无法解析的行以 {@link DeadLetterEntry#isMalformed()} 表示，不会中断读取。
     *
     * @return 记录流，文件不存在时为空流
     * @throws IOException 如果打开文件失败
     */
    Stream<DeadLetterEntry> readAll() throws IOException;

    /**
     * 死信文件是否存在
     */
    boolean exists();

    /**
     * 删除死信文件
     *
     * @throws IOException 如果删除失败
     */
    void delete() throws IOException;

    /**
     * 将死信文件移动到同目录下的备份路径，不覆盖已有备份
     *
     * @return 备份文件路径
     * @throws IOException 如果移动失败
     */
    Path renameToBackup() throws IOException;

    /**
     * 非空行数
     *
     * @throws IOException 如果读取失败
     */
    long count() throws IOException;

    /**
     * 死信文件路径
     */
    Path getPath();
}
