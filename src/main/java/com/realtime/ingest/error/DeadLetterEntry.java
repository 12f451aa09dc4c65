package com.realtime.ingest.error;

import com.realtime.ingest.model.FailedOperation;

import java.util.Optional;

/**
 * 死信文件中的一行
 * 要么是解析成功的失败操作，要么是无法解析的行及其错误信息
 */
public final class DeadLetterEntry {

    private final long lineNumber;
    private final FailedOperation operation;
    private final String error;

    private DeadLetterEntry(long lineNumber, FailedOperation operation, String error) {
        this.lineNumber = lineNumber;
        this.operation = operation;
        this.error = error;
    }

    static DeadLetterEntry parsed(long lineNumber, FailedOperation operation) {
        return new DeadLetterEntry(lineNumber, operation, null);
    }

    static DeadLetterEntry malformed(long lineNumber, String error) {
        return new DeadLetterEntry(lineNumber, null, error);
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public Optional<FailedOperation> getOperation() {
        return Optional.ofNullable(operation);
    }

    public boolean isMalformed() {
        return operation == null;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isMalformed()
                ? "DeadLetterEntry{line=" + lineNumber + ", malformed: " + error + "}"
                : "DeadLetterEntry{line=" + lineNumber + ", " + operation.describe() + "}";
    }
}
