package com.bulkops.exception;

import com.bulkops.model.ErrorCode;

/**
 * Thrown by backend integrations when a call fails as a whole (not per row).
 * Retryable when its code is.
 */
public class BackendCallException extends BulkOperationException {

    public BackendCallException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BackendCallException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public boolean isRetryable() {
        return getErrorCode().isRetryable();
    }
}
