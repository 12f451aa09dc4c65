package com.realtime.ingest.store;

import java.util.Optional;

/**
 * 主存储写入结果
 * 写入失败以返回值表示，而不是抛出异常
 */
public final class SaveResult {

    private static final SaveResult SUCCESS = new SaveResult(true, null, null);

    private final boolean success;
    private final String reason;
    private final Throwable cause;

    private SaveResult(boolean success, String reason, Throwable cause) {
        this.success = success;
        this.reason = reason;
        this.cause = cause;
    }

    public static SaveResult success() {
        return SUCCESS;
    }

    public static SaveResult failure(String reason) {
        return new SaveResult(false, reason, null);
    }

    public static SaveResult failure(String reason, Throwable cause) {
        return new SaveResult(false, reason, cause);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * 失败原因，成功时为null
     */
    public String getReason() {
        return reason;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return success ? "SaveResult{success}" : "SaveResult{failure: " + reason + "}";
    }
}
