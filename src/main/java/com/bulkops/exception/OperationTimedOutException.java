package com.bulkops.exception;

import com.bulkops.model.ErrorCode;

/**
 * A local wait passed its deadline. Backend state is unknown and must be re-queried.
 */
public class OperationTimedOutException extends BulkOperationException {

    public OperationTimedOutException(String message) {
        super(ErrorCode.TIMED_OUT, message);
    }
}
