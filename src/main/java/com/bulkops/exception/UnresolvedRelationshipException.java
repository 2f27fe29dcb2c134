package com.bulkops.exception;

import com.bulkops.model.ErrorCode;

/**
 * A generated record needs a parent that has not been created.
 */
public class UnresolvedRelationshipException extends BulkOperationException {

    private final String fieldName;
    private final String relatedObject;

    public UnresolvedRelationshipException(String objectName, String fieldName, String relatedObject) {
        super(ErrorCode.INVALID_REFERENCE, "No " + relatedObject + " parent available for required field "
                + objectName + "." + fieldName);
        this.fieldName = fieldName;
        this.relatedObject = relatedObject;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getRelatedObject() {
        return relatedObject;
    }
}
