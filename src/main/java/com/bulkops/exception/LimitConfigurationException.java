package com.bulkops.exception;

import com.bulkops.model.ErrorCode;

/**
 * Batching cannot satisfy the configured quota.
 */
public class LimitConfigurationException extends BulkOperationException {

    private final int recordIndex;

    public LimitConfigurationException(String message) {
        this(message, -1);
    }

    public LimitConfigurationException(String message, int recordIndex) {
        super(ErrorCode.LIMIT_CONFIGURATION, message);
        this.recordIndex = recordIndex;
    }

    /**
     * @return plan index of the unsplittable record, or -1 for invalid limits
     */
    public int getRecordIndex() {
        return recordIndex;
    }
}
