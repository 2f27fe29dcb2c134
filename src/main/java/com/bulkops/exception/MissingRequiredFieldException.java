package com.bulkops.exception;

/**
 * A record lacks a field the schema (or the operation) requires.
 */
public class MissingRequiredFieldException extends PlanValidationException {

    public MissingRequiredFieldException(String objectName, String fieldName, int recordIndex) {
        super("Required field " + fieldName + " missing on " + objectName + " record " + recordIndex,
                fieldName, recordIndex);
    }
}
