package com.bulkops.model;

import java.time.Instant;

/**
 * One committed row, appended when the backend acknowledged the commit.
 *
 * @param sequence      position in the trace log, assigned on append
 * @param objectName    object the row belongs to
 * @param operationKind operation that produced the commit
 * @param action        what the backend did
 * @param recordId      backend identifier
 * @param timestamp     acknowledgement time
 * @param operationId   operation the row was committed under, null outside an operation
 */
public record RecordTrace(
    long sequence,
    String objectName,
    OperationKind operationKind,
    CommitAction action,
    String recordId,
    Instant timestamp,
    String operationId
) {
    public RecordTrace(long sequence, String objectName, OperationKind operationKind, CommitAction action,
                       String recordId, Instant timestamp) {
        this(sequence, objectName, operationKind, action, recordId, timestamp, null);
    }

    public RecordTrace withSequence(long assigned) {
        return new RecordTrace(assigned, objectName, operationKind, action, recordId, timestamp, operationId);
    }
}
