package com.realtime.ingest.ingest;

/**
 * 请求校验失败
 */
public class ValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }
}
