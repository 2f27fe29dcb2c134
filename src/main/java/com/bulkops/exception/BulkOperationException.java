package com.bulkops.exception;

import com.bulkops.model.ErrorCode;

/**
 * Base exception for orchestration errors. Carries the {@link ErrorCode} reported to callers.
 */
public class BulkOperationException extends RuntimeException {

    private final ErrorCode errorCode;

    public BulkOperationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BulkOperationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
