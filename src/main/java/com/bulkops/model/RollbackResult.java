package com.bulkops.model;

import java.util.List;

/**
 * Outcome of a successful rollback.
 *
 * @param marker      the marker rolled back to
 * @param compensated traces undone by this call
 * @param skipped     traces already undone earlier or absent on the backend
 * @param viaSavepoint true when the backend savepoint primitive was used
 */
public record RollbackResult(RollbackMarker marker, List<RecordTrace> compensated, List<RecordTrace> skipped,
                             boolean viaSavepoint) {
    public RollbackResult {
        compensated = List.copyOf(compensated);
        skipped = List.copyOf(skipped);
    }
}
