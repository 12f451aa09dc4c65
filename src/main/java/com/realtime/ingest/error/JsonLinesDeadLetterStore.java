package com.realtime.ingest.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.realtime.ingest.model.FailedOperation;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * 基于文件系统的死信存储实现
 * 每条记录序列化为一行JSON（JSON Lines），追加写入同一个文件
 *
 * <p>崩溃时写了一半的末尾行在读取时按无法解析的行跳过；
 * 之后的追加会先补一个换行符，保证新记录独占一行。
 */
@Slf4j
public class JsonLinesDeadLetterStore implements DeadLetterStore {

    static final String BACKUP_SUFFIX = ".backup";
    private static final DateTimeFormatter BACKUP_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);
    private static final byte NEWLINE = '\n';

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 构造函数
     *
     * @param path 死信文件路径
     */
    public JsonLinesDeadLetterStore(String path) {
        this(Paths.get(path), Clock.systemUTC());
    }

    public JsonLinesDeadLetterStore(Path path, Clock clock) {
        if (path == null) {
            throw new IllegalArgumentException("Dead letter path cannot be null");
        }
        this.path = path;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        // 必须保持单行输出
        this.objectMapper.disable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized void append(FailedOperation operation) throws IOException {
        if (operation == null) {
            throw new IllegalArgumentException("Operation cannot be null");
        }

        byte[] line = (objectMapper.writeValueAsString(operation) + "\n").getBytes(StandardCharsets.UTF_8);

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            log.info("Created dead letter directory: {}", parent);
        }

        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            ByteBuffer buffer;
            if (size > 0 && !endsWithNewline(channel, size)) {
                log.warn("Dead letter file {} ends with a partial line, starting a new line", path);
                buffer = ByteBuffer.allocate(line.length + 1);
                buffer.put(NEWLINE);
            } else {
                buffer = ByteBuffer.allocate(line.length);
            }
            buffer.put(line);
            buffer.flip();

            long position = size;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
            channel.force(true);
        }
        log.info("Saved to dead letter file {}: {} (retry_count={})",
                path, operation.describe(), operation.getRetryCount());
    }

    private boolean endsWithNewline(FileChannel channel, long size) throws IOException {
        ByteBuffer last = ByteBuffer.allocate(1);
        channel.read(last, size - 1);
        return last.get(0) == NEWLINE;
    }

    @Override
    public Stream<DeadLetterEntry> readAll() throws IOException {
        if (!Files.exists(path)) {
            return Stream.empty();
        }

        BufferedReader reader = openReader();
        AtomicLong lineNumber = new AtomicLong();

        return reader.lines()
                .map(line -> new NumberedLine(lineNumber.incrementAndGet(), line))
                .filter(numbered -> !numbered.text.isBlank())
                .map(this::parseLine)
                .onClose(() -> {
                    try {
                        reader.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    private DeadLetterEntry parseLine(NumberedLine line) {
        try {
            FailedOperation operation = objectMapper.readValue(line.text, FailedOperation.class);
            if (operation == null) {
                log.warn("Skipping malformed dead letter line {} in {}: not a JSON object", line.number, path);
                return DeadLetterEntry.malformed(line.number, "not a JSON object");
            }
            return DeadLetterEntry.parsed(line.number, operation);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed dead letter line {} in {}: {}",
                    line.number, path, e.getOriginalMessage());
            return DeadLetterEntry.malformed(line.number, e.getOriginalMessage());
        }
    }

    @Override
    public boolean exists() {
        return Files.exists(path);
    }

    @Override
    public synchronized void delete() throws IOException {
        if (Files.deleteIfExists(path)) {
            log.info("Deleted dead letter file: {}", path);
        }
    }

    @Override
    public synchronized Path renameToBackup() throws IOException {
        Path backup = resolveBackupPath();
        // 不使用REPLACE_EXISTING：目标已存在时宁可失败也不覆盖
        Files.move(path, backup);
        log.info("Dead letter file backed up to: {}", backup);
        return backup;
    }

    /**
     * 计算备份路径：优先 {@code <file>.backup}，已存在时使用带时间戳的名称
     */
    Path resolveBackupPath() {
        String fileName = path.getFileName().toString();
        Path backup = path.resolveSibling(fileName + BACKUP_SUFFIX);
        if (!Files.exists(backup)) {
            return backup;
        }

        String stamped = fileName + BACKUP_SUFFIX + "." + BACKUP_TIMESTAMP.format(clock.instant());
        backup = path.resolveSibling(stamped);
        int counter = 1;
        while (Files.exists(backup)) {
            backup = path.resolveSibling(stamped + "-" + counter++);
        }
        return backup;
    }

    @Override
    public long count() throws IOException {
        if (!Files.exists(path)) {
            return 0;
        }
        try (BufferedReader reader = openReader()) {
            return reader.lines().filter(line -> !line.isBlank()).count();
        }
    }

    /**
     * InputStreamReader会替换非法UTF-8字节，截断的多字节字符只影响所在行的解析
     */
    private BufferedReader openReader() throws IOException {
        return new BufferedReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8));
    }

    @Override
    public Path getPath() {
        return path;
    }

    private static final class NumberedLine {
        private final long number;
        private final String text;

        private NumberedLine(long number, String text) {
            this.number = number;
            this.text = text;
        }
    }
}
