package com.realtime.ingest.retry;

import com.realtime.ingest.error.JsonLinesDeadLetterStore;
import com.realtime.ingest.model.FailedOperation;
import com.realtime.ingest.model.RecoveryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 死信恢复管理器测试
 */
class RecoveryManagerTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-15T10:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path deadLetterFile;
    private JsonLinesDeadLetterStore deadLetterStore;
    private IntakeQueue queue;

    @BeforeEach
    void setUp() {
        deadLetterFile = tempDir.resolve("failed_measurements.jsonl");
        deadLetterStore = new JsonLinesDeadLetterStore(deadLetterFile, FIXED_CLOCK);
        queue = new IntakeQueue();
    }

    private void writeDeadLetters(int count, int retryCount) throws IOException {
        for (int i = 0; i < count; i++) {
            FailedOperation op = new FailedOperation(
                    Map.of("timestamp", "2024-01-15T10:00:0" + (i % 10) + "Z",
                            "tag", "fermenter_temp",
                            "value", 37.0 + i),
                    retryCount,
                    FIXED_CLOCK.instant());
            deadLetterStore.append(op);
        }
    }

    private List<FailedOperation> drainQueue() throws InterruptedException {
        List<FailedOperation> drained = new ArrayList<>();
        Optional<FailedOperation> next;
        while ((next = queue.dequeueWithTimeout(Duration.ofMillis(10))).isPresent()) {
            drained.add(next.get());
        }
        return drained;
    }

    @Test
    void testNoFileIsNoOp() {
        ScriptedPrimaryStore store = ScriptedPrimaryStore.alwaysSucceeding();
        RecoveryManager manager = new RecoveryManager(deadLetterStore, store, queue);

        RecoveryResult result = manager.recover();

        assertEquals(0, result.getRecovered());
        assertEquals(0, result.getPending());
        assertFalse(result.isFileDeleted());
        assertNull(result.getBackupPath());
        assertEquals(0, store.getAttempts());
        assertTrue(queue.isEmpty());
    }

    @Test
    void testFullRecoveryDeletesFile() throws Exception {
        writeDeadLetters(5, 3);
        ScriptedPrimaryStore store = ScriptedPrimaryStore.alwaysSucceeding();
        RecoveryManager manager = new RecoveryManager(deadLetterStore, store, queue);

        RecoveryResult result = manager.recover();

        assertEquals(5, result.getRecovered());
        assertEquals(0, result.getPending());
        assertTrue(result.isFileDeleted());
        assertTrue(result.isFullyRecovered());
        assertFalse(Files.exists(deadLetterFile));
        assertFalse(Files.exists(tempDir.resolve("failed_measurements.jsonl.backup")));
        assertEquals(5, store.getSaved().size());
        // 恢复时重试次数归零
        store.getSaved().forEach(op -> assertEquals(0, op.getRetryCount()));
        assertTrue(queue.isEmpty());
    }

    @Test
    void testPartialRecoveryBacksUpAndRequeues() throws Exception {
        writeDeadLetters(4, 3);
        // 偶数值的读数写入失败
        ScriptedPrimaryStore store = new ScriptedPrimaryStore(
                op -> ((Number) op.getPayload().get("value")).intValue() % 2 == 1);
        RecoveryManager manager = new RecoveryManager(deadLetterStore, store, queue);

        RecoveryResult result = manager.recover();

        assertEquals(2, result.getRecovered());
        assertEquals(2, result.getPending());
        assertFalse(result.isFileDeleted());
        assertFalse(Files.exists(deadLetterFile));
        Path backup = tempDir.resolve("failed_measurements.jsonl.backup");
        assertEquals(backup.toString(), result.getBackupPath());
        assertEquals(4, Files.readAllLines(backup).size());

        List<FailedOperation> pending = drainQueue();
        assertEquals(2, pending.size());
        pending.forEach(op -> assertEquals(0, op.getRetryCount()));
    }

    @Test
    void testTotalFailureKeepsEverythingQueued() throws Exception {
        writeDeadLetters(3, 3);
        RecoveryManager manager = new RecoveryManager(deadLetterStore, ScriptedPrimaryStore.alwaysFailing(), queue);

        RecoveryResult result = manager.recover();

        assertEquals(0, result.getRecovered());
        assertEquals(3, result.getPending());
        assertNotNull(result.getBackupPath());
        assertEquals(3, queue.queueDepth());
    }

    @Test
    void testMalformedLinesAreSkippedAndBlockDeletion() throws Exception {
        writeDeadLetters(2, 3);
        Files.writeString(deadLetterFile, "this is not json\n", StandardCharsets.UTF_8,
                java.nio.file.StandardOpenOption.APPEND);
        writeDeadLetters(1, 3);
        ScriptedPrimaryStore store = ScriptedPrimaryStore.alwaysSucceeding();
        RecoveryManager manager = new RecoveryManager(deadLetterStore, store, queue);

        RecoveryResult result = manager.recover();

        assertEquals(3, result.getRecovered());
        assertEquals(1, result.getMalformed());
        assertFalse(result.isFileDeleted());
        assertNotNull(result.getBackupPath());
        assertTrue(Files.readString(Path.of(result.getBackupPath())).contains("this is not json"));
    }

    @Test
    void testCountFailureDoesNotBlockRecovery() throws Exception {
        writeDeadLetters(2, 3);
        JsonLinesDeadLetterStore unreadableCount = spy(deadLetterStore);
        doThrow(new IOException("permission denied")).when(unreadableCount).count();
        ScriptedPrimaryStore store = ScriptedPrimaryStore.alwaysSucceeding();
        RecoveryManager manager = new RecoveryManager(unreadableCount, store, queue);

        RecoveryResult result = manager.recover();

        verify(unreadableCount).count();
        assertEquals(2, result.getRecovered());
        assertTrue(result.isFileDeleted());
        assertFalse(Files.exists(deadLetterFile));
    }

    @Test
    void testTruncatedTrailingLineIsSkipped() throws Exception {
        writeDeadLetters(2, 3);
        // 模拟崩溃时写了一半的末尾行
        Files.writeString(deadLetterFile, "{\"tag\": \"fermenter_ph\", \"val", StandardCharsets.UTF_8,
                java.nio.file.StandardOpenOption.APPEND);
        ScriptedPrimaryStore store = ScriptedPrimaryStore.alwaysSucceeding();
        RecoveryManager manager = new RecoveryManager(deadLetterStore, store, queue);

        RecoveryResult result = manager.recover();

        assertEquals(2, result.getRecovered());
        assertEquals(1, result.getMalformed());
        assertEquals(2, store.getAttempts());
    }

    @Test
    void testLegacyRecordWithNaiveTimestamp() throws Exception {
        Files.writeString(deadLetterFile,
                "{\"timestamp\": \"2024-01-15T10:00:00\", \"tag\": \"agitator_rpm\", \"value\": 455.5, "
                        + "\"is_anomaly\": false, \"retry_count\": 3, \"first_failed_at\": \"2024-01-15T10:00:01.123456\"}\n",
                StandardCharsets.UTF_8);
        ScriptedPrimaryStore store = ScriptedPrimaryStore.alwaysSucceeding();
        RecoveryManager manager = new RecoveryManager(deadLetterStore, store, queue);

        RecoveryResult result = manager.recover();

        assertEquals(1, result.getRecovered());
        FailedOperation saved = store.getSaved().get(0);
        assertEquals(455.5, saved.getPayload().get("value"));
        assertEquals(Instant.parse("2024-01-15T10:00:01.123456Z"), saved.getFirstFailedAt());
        assertFalse(saved.getPayload().containsKey("retry_count"));
    }

    @Test
    void testExistingBackupIsNotOverwritten() throws Exception {
        Path existingBackup = tempDir.resolve("failed_measurements.jsonl.backup");
        Files.writeString(existingBackup, "older backup\n", StandardCharsets.UTF_8);
        writeDeadLetters(1, 3);
        RecoveryManager manager = new RecoveryManager(deadLetterStore, ScriptedPrimaryStore.alwaysFailing(), queue);

        RecoveryResult result = manager.recover();

        assertEquals("older backup\n", Files.readString(existingBackup));
        assertNotEquals(existingBackup.toString(), result.getBackupPath());
        assertEquals(tempDir.resolve("failed_measurements.jsonl.backup.20240115T103000").toString(),
                result.getBackupPath());
        assertTrue(Files.exists(Path.of(result.getBackupPath())));
    }
}
