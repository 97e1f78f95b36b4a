package com.company.dashboards.exception;

import lombok.Getter;

/**
 * Failure reported by the query engine, classified so the guardrail can map it to a
 * stable error kind.
 */
@Getter
public class EngineException extends RuntimeException {

    public enum Reason {
        BYTES_LIMIT_EXCEEDED,
        INVALID_QUERY,
        TIMEOUT,
        INTERRUPTED,
        BACKEND_ERROR
    }

    private final Reason reason;
    private final Long bytesAttempted;

    public EngineException(Reason reason, String message) {
        this(reason, message, null, null);
    }

    public EngineException(Reason reason, String message, Throwable cause) {
        this(reason, message, null, cause);
    }

    public EngineException(Reason reason, String message, Long bytesAttempted, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.bytesAttempted = bytesAttempted;
    }
}
