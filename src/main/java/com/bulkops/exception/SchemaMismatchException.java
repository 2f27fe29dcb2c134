package com.bulkops.exception;

import com.bulkops.model.ErrorCode;

/**
 * Missing external id or relationship target.
 */
public class SchemaMismatchException extends PlanValidationException {

    public SchemaMismatchException(String message, String fieldName) {
        super(ErrorCode.SCHEMA_MISMATCH, message, fieldName, -1);
    }
}
