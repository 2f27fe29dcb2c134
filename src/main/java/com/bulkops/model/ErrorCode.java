package com.bulkops.model;

/**
 * Classification of backend and orchestration failures.
 */
public enum ErrorCode {
    RATE_LIMITED(true),
    TRANSIENT_UNAVAILABLE(true),
    VALIDATION_FAILED(false),
    DUPLICATE_VALUE(false),
    INVALID_REFERENCE(false),
    NOT_FOUND(false),
    RETRY_EXHAUSTED(false),
    TIMED_OUT(false),
    JOB_FAILED(false),
    ABORTED(false),
    LIMIT_CONFIGURATION(false),
    SCHEMA_MISMATCH(false),
    UNEXPECTED(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
