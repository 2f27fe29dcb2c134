package com.bulkops.model;

/**
 * Failed row as reported to the caller, enough to retry that row alone.
 */
public record FailedRow(int index, ErrorCode errorCode, String message) {

    public static FailedRow of(RowOutcome outcome) {
        return new FailedRow(outcome.index(), outcome.errorCode(), outcome.errorMessage());
    }
}
