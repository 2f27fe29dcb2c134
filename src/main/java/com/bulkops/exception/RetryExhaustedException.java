package com.bulkops.exception;

import com.bulkops.model.ErrorCode;

/**
 * A retryable failure persisted after all retries.
 */
public class RetryExhaustedException extends BulkOperationException {

    private final int attempts;
    private final ErrorCode lastErrorCode;

    public RetryExhaustedException(String operationName, int attempts, ErrorCode lastErrorCode, Throwable cause) {
        super(ErrorCode.RETRY_EXHAUSTED,
                "Operation '" + operationName + "' failed after " + attempts + " attempts (" + lastErrorCode + ")",
                cause);
        this.attempts = attempts;
        this.lastErrorCode = lastErrorCode;
    }

    public int getAttempts() {
        return attempts;
    }

    public ErrorCode getLastErrorCode() {
        return lastErrorCode;
    }
}
