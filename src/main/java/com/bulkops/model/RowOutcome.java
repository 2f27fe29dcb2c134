package com.bulkops.model;

/**
 * Per-record result of an executed batch.
 *
 * @param index        index of the record within the plan
 * @param recordId     backend identifier, null when the row failed before an id existed
 * @param success      whether the backend committed the row
 * @param action       what was committed, NONE for failures
 * @param errorCode    failure classification, null on success
 * @param errorMessage backend or orchestration message, null on success
 */
public record RowOutcome(
    int index,
    String recordId,
    boolean success,
    CommitAction action,
    ErrorCode errorCode,
    String errorMessage
) {
    public static RowOutcome committed(int index, String recordId, CommitAction action) {
        return new RowOutcome(index, recordId, true, action, null, null);
    }

    public static RowOutcome failed(int index, ErrorCode code, String message) {
        return new RowOutcome(index, null, false, CommitAction.NONE, code, message);
    }

    public RowOutcome withIndex(int planIndex) {
        return new RowOutcome(planIndex, recordId, success, action, errorCode, errorMessage);
    }

    public boolean isRetryable() {
        return !success && errorCode != null && errorCode.isRetryable();
    }
}
