package com.company.dashboards.guardrail;

public enum GuardrailErrorKind {
    DANGEROUS_SQL("DANGEROUS_SQL", false),
    QUERY_VALIDATION_FAILED("QUERY_VALIDATION_FAILED", false),
    BYTES_LIMIT_EXCEEDED("BYTES_LIMIT_EXCEEDED", false),
    ENGINE_EXECUTION_ERROR("ENGINE_EXECUTION_ERROR", true);

    private final String errorCode;
    private final boolean retryable;

    GuardrailErrorKind(String errorCode, boolean retryable) {
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may retry with backoff. The executor itself never retries.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
