package com.bulkops.model;

import java.util.Objects;

/**
 * Opaque point in the trace log. Everything recorded after {@code sequence} under the
 * marker's operation is in scope of a rollback to this marker.
 *
 * @param sequence    last trace sequence at the time of the snapshot
 * @param savepointId backend savepoint taken at the same time, null if unsupported
 * @param operationId operation the marker belongs to; null covers every operation
 */
public record RollbackMarker(long sequence, String savepointId, String operationId) {

    public static final RollbackMarker ORIGIN = new RollbackMarker(0L, null, null);

    public RollbackMarker(long sequence, String savepointId) {
        this(sequence, savepointId, null);
    }

    public boolean hasSavepoint() {
        return savepointId != null;
    }

    /**
     * True when the trace was recorded after this marker by the marker's operation.
     */
    public boolean covers(RecordTrace trace) {
        return trace.sequence() > sequence
                && (operationId == null || Objects.equals(operationId, trace.operationId()));
    }

    public RollbackMarker withoutSavepoint() {
        return savepointId == null ? this : new RollbackMarker(sequence, null, operationId);
    }
}
