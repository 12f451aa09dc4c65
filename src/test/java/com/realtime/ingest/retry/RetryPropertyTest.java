package com.realtime.ingest.retry;

import com.realtime.ingest.error.DeadLetterEntry;
import com.realtime.ingest.error.JsonLinesDeadLetterStore;
import com.realtime.ingest.model.FailedOperation;
import com.realtime.ingest.model.OperationState;
import com.realtime.ingest.model.RecoveryResult;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 重试子系统基于属性的测试
 */
class RetryPropertyTest {

    /**
     * 对于任意失败次数f和最大重试次数k：
     * f < k 时操作最终写入成功，共尝试f+1次；否则尝试k次后进入死信，死信记录的retry_count为k。
     * 第n次失败后的等待时间为2^n秒。
     */
    @Property(tries = 50)
    void retryAttemptsAndBackoffFollowBudget(
            @ForAll @IntRange(min = 0, max = 8) int failures,
            @ForAll @IntRange(min = 1, max = 6) int maxRetries) throws Exception {
        Path tempDir = Files.createTempDirectory("retry-prop-");
        try {
            IntakeQueue queue = new IntakeQueue();
            JsonLinesDeadLetterStore dlq = new JsonLinesDeadLetterStore(tempDir.resolve("dlq.jsonl").toString());
            ScriptedPrimaryStore store = ScriptedPrimaryStore.failingFirst(failures);
            List<Duration> sleeps = new ArrayList<>();
            RetryWorker worker = new RetryWorker(queue, store, dlq, BackoffPolicy.exponential(), sleeps::add,
                    maxRetries, Duration.ofMillis(10), new RetryMetrics());

            queue.enqueue(FailedOperation.of(Map.of("tag", "fermenter_temp", "value", 38.5)));
            OperationState state = OperationState.RETRYING;
            while (state == OperationState.RETRYING) {
                state = worker.process(queue.dequeueWithTimeout(Duration.ofMillis(10)).orElseThrow());
            }

            int expectedSleeps;
            if (failures < maxRetries) {
                assertEquals(OperationState.COMPLETED, state);
                assertEquals(failures + 1, store.getAttempts());
                assertFalse(dlq.exists());
                expectedSleeps = failures;
            } else {
                assertEquals(OperationState.DEAD_LETTERED, state);
                assertEquals(maxRetries, store.getAttempts());
                try (Stream<DeadLetterEntry> entries = dlq.readAll()) {
                    FailedOperation dead = entries.findFirst().orElseThrow().getOperation().orElseThrow();
                    assertEquals(maxRetries, dead.getRetryCount());
                }
                expectedSleeps = maxRetries - 1;
            }

            assertEquals(expectedSleeps, sleeps.size());
            for (int i = 0; i < sleeps.size(); i++) {
                assertEquals(Duration.ofSeconds(1L << (i + 1)), sleeps.get(i));
            }
            assertTrue(queue.isEmpty());
        } finally {
            deleteRecursively(tempDir);
        }
    }

    /**
     * 对于任意死信记录集合和任意成功/失败划分：
     * recovered + pending 等于记录总数，队列长度等于pending，
     * 当且仅当pending为0时删除文件，否则原文件完整保留为备份
     */
    @Property(tries = 30)
    void recoveryPartitionsRecords(@ForAll("outcomes") List<Boolean> outcomes) throws Exception {
        Path tempDir = Files.createTempDirectory("recovery-prop-");
        try {
            Path file = tempDir.resolve("failed_measurements.jsonl");
            JsonLinesDeadLetterStore dlq = new JsonLinesDeadLetterStore(file.toString());
            for (int i = 0; i < outcomes.size(); i++) {
                dlq.append(new FailedOperation(Map.of("tag", "fermenter_ph", "seq", i), 3,
                        Instant.parse("2024-01-15T10:30:00Z")));
            }

            IntakeQueue queue = new IntakeQueue();
            ScriptedPrimaryStore store = new ScriptedPrimaryStore(
                    op -> outcomes.get(((Number) op.getPayload().get("seq")).intValue()));
            RecoveryResult result = new RecoveryManager(dlq, store, queue).recover();

            long successes = outcomes.stream().filter(Boolean::booleanValue).count();
            assertEquals(successes, result.getRecovered());
            assertEquals(outcomes.size() - successes, result.getPending());
            assertEquals(result.getPending(), queue.queueDepth());
            assertFalse(Files.exists(file));

            if (result.getPending() == 0) {
                assertTrue(result.isFileDeleted());
                assertNull(result.getBackupPath());
            } else {
                assertFalse(result.isFileDeleted());
                assertEquals(outcomes.size(), Files.readAllLines(Path.of(result.getBackupPath())).size());
            }
        } finally {
            deleteRecursively(tempDir);
        }
    }

    @Provide
    Arbitrary<List<Boolean>> outcomes() {
        return Arbitraries.of(true, false).list().ofMinSize(1).ofMaxSize(20);
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        }
    }
}
