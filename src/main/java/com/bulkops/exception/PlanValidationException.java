package com.bulkops.exception;

import com.bulkops.model.ErrorCode;

/**
 * A plan failed schema checks. Fatal: the operation is not attempted.
 */
public class PlanValidationException extends BulkOperationException {

    private final String fieldName;
    private final int recordIndex;

    public PlanValidationException(String message) {
        this(message, null, -1);
    }

    public PlanValidationException(String message, String fieldName, int recordIndex) {
        this(ErrorCode.VALIDATION_FAILED, message, fieldName, recordIndex);
    }

    protected PlanValidationException(ErrorCode code, String message, String fieldName, int recordIndex) {
        super(code, message);
        this.fieldName = fieldName;
        this.recordIndex = recordIndex;
    }

    /**
     * @return offending field, or null when the failure is not field specific
     */
    public String getFieldName() {
        return fieldName;
    }

    /**
     * @return index of the first offending record, or -1
     */
    public int getRecordIndex() {
        return recordIndex;
    }
}
