package com.realtime.ingest.retry;

import com.realtime.ingest.error.DeadLetterEntry;
import com.realtime.ingest.error.DeadLetterStore;
import com.realtime.ingest.model.FailedOperation;
import com.realtime.ingest.model.RecoveryResult;
import com.realtime.ingest.store.PrimaryStoreAdapter;
import com.realtime.ingest.store.SaveResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * 死信恢复管理器
 * 启动时回放死信文件：逐条重置重试次数并立即写入主存储，失败的放回重试队列
 *
 * <p>放回队列的操作只存在于内存中，直到工作线程再次处理它们。
 * 在此期间进程崩溃会丢失这些操作，而它们原本已经持久化在死信文件里（已知缺口）。
 */
@Slf4j
public class RecoveryManager {

    private final DeadLetterStore deadLetterStore;
    private final PrimaryStoreAdapter primaryStore;
    private final IntakeQueue intakeQueue;

    public RecoveryManager(DeadLetterStore deadLetterStore, PrimaryStoreAdapter primaryStore, IntakeQueue intakeQueue) {
        if (deadLetterStore == null || primaryStore == null || intakeQueue == null) {
            throw new IllegalArgumentException("Dead letter store, primary store and queue cannot be null");
        }
        this.deadLetterStore = deadLetterStore;
        this.primaryStore = primaryStore;
        this.intakeQueue = intakeQueue;
    }

    /**
     * 执行一次恢复
     *
     * @return 恢复结果统计
     */
    public RecoveryResult recover() {
        if (!deadLetterStore.exists()) {
            log.debug("No dead letter file at {}, nothing to recover", deadLetterStore.getPath());
            return RecoveryResult.empty();
        }

        RecoveryResult result = new RecoveryResult();
        boolean readFailed = false;

        try {
            log.info("Recovering {} failed measurements from {}", deadLetterStore.count(), deadLetterStore.getPath());
        } catch (IOException e) {
            log.warn("Could not count dead letter records in {}", deadLetterStore.getPath(), e);
        }

        try (Stream<DeadLetterEntry> entries = deadLetterStore.readAll()) {
            Iterator<DeadLetterEntry> iterator = entries.iterator();
            while (iterator.hasNext()) {
                DeadLetterEntry entry = iterator.next();
                if (entry.isMalformed()) {
                    result.setMalformed(result.getMalformed() + 1);
                    continue;
                }
                FailedOperation operation = entry.getOperation().orElseThrow();
                operation.resetRetryCount();

                if (attemptSave(operation).isSuccess()) {
                    result.setRecovered(result.getRecovered() + 1);
                } else {
                    intakeQueue.enqueue(operation);
                    result.setPending(result.getPending() + 1);
                }
            }
        } catch (IOException | UncheckedIOException e) {
            // 剩余行无法确定是否已处理，保留文件
            readFailed = true;
            log.error("Failed to read dead letter file {}", deadLetterStore.getPath(), e);
        }

        finish(result, readFailed);
        log.info("Recovery finished: {}", result);
        return result;
    }

    private void finish(RecoveryResult result, boolean readFailed) {
        try {
            if (result.isFullyRecovered() && !readFailed) {
                deadLetterStore.delete();
                result.setFileDeleted(true);
                log.info("Recovered {} measurements and cleared dead letter file", result.getRecovered());
            } else {
                Path backup = deadLetterStore.renameToBackup();
                result.setBackupPath(backup.toString());
                log.warn("Recovered {} measurements, {} still pending, {} malformed; original file backed up to {}",
                        result.getRecovered(), result.getPending(), result.getMalformed(), backup);
            }
        } catch (IOException e) {
            log.error("Failed to clean up dead letter file {}", deadLetterStore.getPath(), e);
        }
    }

    private SaveResult attemptSave(FailedOperation operation) {
        try {
            SaveResult result = primaryStore.save(operation);
            return result != null ? result : SaveResult.failure("Primary store returned no result");
        } catch (RuntimeException e) {
            log.warn("Primary store threw while recovering {}", operation.describe(), e);
            return SaveResult.failure(e.getMessage(), e);
        }
    }
}
