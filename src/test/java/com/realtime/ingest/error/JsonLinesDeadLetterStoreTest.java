package com.realtime.ingest.error;

import com.realtime.ingest.model.FailedOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON Lines死信存储单元测试
 */
class JsonLinesDeadLetterStoreTest {

    private static final Instant FAILED_AT = Instant.parse("2024-01-15T10:30:00Z");
    private static final Clock FIXED_CLOCK = Clock.fixed(FAILED_AT, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path file;
    private JsonLinesDeadLetterStore store;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("failed_measurements.jsonl");
        store = new JsonLinesDeadLetterStore(file, FIXED_CLOCK);
    }

    private static FailedOperation operation(String tag, double value) {
        return new FailedOperation(Map.of("timestamp", "2024-01-15T10:29:58Z", "tag", tag, "value", value),
                3, FAILED_AT);
    }

    private List<DeadLetterEntry> readEntries() throws IOException {
        try (Stream<DeadLetterEntry> entries = store.readAll()) {
            return entries.collect(Collectors.toList());
        }
    }

    @Test
    void testAppendWritesOneFlatJsonObjectPerLine() throws IOException {
        store.append(operation("fermenter_temp", 41.2));
        store.append(operation("fermenter_ph", 6.8));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("{"));
        assertTrue(lines.get(0).contains("\"tag\":\"fermenter_temp\""));
        assertTrue(lines.get(0).contains("\"retry_count\":3"));
        assertTrue(lines.get(0).contains("\"first_failed_at\":\"2024-01-15T10:30:00Z\""));
        assertFalse(lines.get(0).contains("payload"));
        assertEquals(2, store.count());
    }

    @Test
    void testReadAllReturnsEntriesInFileOrder() throws IOException {
        store.append(operation("fermenter_temp", 41.2));
        store.append(operation("agitator_rpm", 660.0));

        List<DeadLetterEntry> entries = readEntries();

        assertEquals(2, entries.size());
        FailedOperation first = entries.get(0).getOperation().orElseThrow();
        assertEquals("fermenter_temp", first.getPayload().get("tag"));
        assertEquals(3, first.getRetryCount());
        assertEquals(FAILED_AT, first.getFirstFailedAt());
        assertEquals(2, entries.get(1).getLineNumber());
    }

    @Test
    void testAppendCreatesParentDirectories() throws IOException {
        Path nested = tempDir.resolve("a/b/dead.jsonl");
        JsonLinesDeadLetterStore nestedStore = new JsonLinesDeadLetterStore(nested, FIXED_CLOCK);

        nestedStore.append(operation("fermenter_temp", 37.0));

        assertTrue(Files.exists(nested));
    }

    @Test
    void testAppendNullRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.append(null));
    }

    @Test
    void testMalformedAndBlankLinesAreReported() throws IOException {
        Files.writeString(file, "\n{broken\nnull\n[1,2]\n{\"tag\":\"fermenter_ph\"}\n", StandardCharsets.UTF_8);
        store.append(operation("fermenter_ph", 7.0));

        List<DeadLetterEntry> entries = readEntries();

        // 空行跳过；缺少retry_count的对象也视为无法解析
        assertEquals(5, entries.size());
        assertEquals(4, entries.stream().filter(DeadLetterEntry::isMalformed).count());
        assertFalse(entries.get(4).isMalformed());
        assertEquals(6, entries.get(4).getLineNumber());
        assertNotNull(entries.get(0).getError());
    }

    @Test
    void testAppendAfterPartialLineStartsNewLine() throws IOException {
        store.append(operation("fermenter_temp", 41.0));
        Files.writeString(file, "{\"tag\":\"ferm", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        store.append(operation("fermenter_ph", 6.1));

        List<DeadLetterEntry> entries = readEntries();
        assertEquals(3, entries.size());
        assertFalse(entries.get(0).isMalformed());
        assertTrue(entries.get(1).isMalformed());
        assertEquals("fermenter_ph", entries.get(2).getOperation().orElseThrow().getPayload().get("tag"));
    }

    @Test
    void testInvalidUtf8DoesNotBreakReading() throws IOException {
        store.append(operation("fermenter_temp", 41.0));
        Files.write(file, new byte[]{(byte) 0xC3, '\n'}, StandardOpenOption.APPEND);

        List<DeadLetterEntry> entries = readEntries();

        assertEquals(2, entries.size());
        assertTrue(entries.get(1).isMalformed());
        assertEquals(2, store.count());
    }

    @Test
    void testReadAllWithoutFileIsEmpty() throws IOException {
        assertFalse(store.exists());
        assertTrue(readEntries().isEmpty());
        assertEquals(0, store.count());
    }

    @Test
    void testDelete() throws IOException {
        store.append(operation("fermenter_temp", 41.0));
        store.delete();
        assertFalse(store.exists());
        // 文件不存在时删除不报错
        assertDoesNotThrow(() -> store.delete());
    }

    @Test
    void testRenameToBackupUsesPlainSuffixFirst() throws IOException {
        store.append(operation("fermenter_temp", 41.0));

        Path backup = store.renameToBackup();

        assertEquals(tempDir.resolve("failed_measurements.jsonl.backup"), backup);
        assertFalse(Files.exists(file));
        assertEquals(1, Files.readAllLines(backup).size());
    }

    @Test
    void testRenameToBackupNeverOverwrites() throws IOException {
        Files.writeString(tempDir.resolve("failed_measurements.jsonl.backup"), "first\n");
        Files.writeString(tempDir.resolve("failed_measurements.jsonl.backup.20240115T103000"), "second\n");
        store.append(operation("fermenter_temp", 41.0));

        Path backup = store.renameToBackup();

        assertEquals(tempDir.resolve("failed_measurements.jsonl.backup.20240115T103000-1"), backup);
        assertEquals("first\n", Files.readString(tempDir.resolve("failed_measurements.jsonl.backup")));
        assertEquals("second\n", Files.readString(tempDir.resolve("failed_measurements.jsonl.backup.20240115T103000")));
    }

    @Test
    @Timeout(10)
    void testConcurrentAppendsKeepLinesIntact() throws Exception {
        int threads = 4;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < perThread; i++) {
                        store.append(operation("agitator_rpm", 400.0 + i));
                    }
                } catch (IOException e) {
                    fail(e);
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        executor.shutdown();

        List<DeadLetterEntry> entries = readEntries();
        assertEquals(threads * perThread, entries.size());
        assertTrue(entries.stream().noneMatch(DeadLetterEntry::isMalformed));
    }
}
