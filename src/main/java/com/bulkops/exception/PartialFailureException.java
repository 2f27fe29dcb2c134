package com.bulkops.exception;

import com.bulkops.model.BatchResult;
import com.bulkops.model.ErrorCode;

/**
 * A batch completed with a mix of successful and failed rows. Not fatal; raised only
 * by callers that ask for strict results via {@link #throwIfPartial(BatchResult)}.
 */
public class PartialFailureException extends BulkOperationException {

    private final transient BatchResult batchResult;

    public PartialFailureException(BatchResult batchResult) {
        super(ErrorCode.VALIDATION_FAILED, "Batch " + batchResult.sequence() + " completed with "
                + batchResult.failureCount() + " failed of " + batchResult.rows().size() + " rows");
        this.batchResult = batchResult;
    }

    public BatchResult getBatchResult() {
        return batchResult;
    }

    public static void throwIfPartial(BatchResult result) {
        if (result.isPartialFailure()) {
            throw new PartialFailureException(result);
        }
    }
}
