package com.bulkops.service.tracking;

import com.bulkops.backend.BackendExecutor;
import com.bulkops.config.OperationContext;
import com.bulkops.exception.BulkOperationException;
import com.bulkops.model.CommitAction;
import com.bulkops.model.OperationKind;
import com.bulkops.model.RecordTrace;
import com.bulkops.model.RollbackMarker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only log of every row the backend acknowledged as committed.
 *
 * Traces are appended in acknowledgement order, which is the order rollback reverses.
 * Each trace carries the operation it was committed under, so concurrent operations
 * sharing this log only ever see, clean up and roll back their own rows.
 * All access is serialized on this instance: one writer at a time.
 */
@Component
@Slf4j
public class RecordTracker {

    private final BackendExecutor backend;
    private final Clock clock;

    private final List<RecordTrace> traces = new ArrayList<>();
    private final Set<Long> compensated = new HashSet<>();
    private final Set<String> activeOperations = new HashSet<>();
    private final Set<String> heldSavepoints = new LinkedHashSet<>();

    public RecordTracker(BackendExecutor backend, Clock clock) {
        this.backend = backend;
        this.clock = clock;
    }

    /**
     * Append a committed row.
     *
     * @return the stored trace, with its sequence assigned
     */
    public synchronized RecordTrace record(RecordTrace trace) {
        if (trace.recordId() == null || trace.action() == CommitAction.NONE) {
            throw new IllegalArgumentException("Only committed rows with an id can be traced: " + trace);
        }
        RecordTrace stored = trace.withSequence(traces.size() + 1L);
        traces.add(stored);
        return stored;
    }

    /**
     * Append a committed row under the operation in the current logging context.
     */
    public RecordTrace record(String objectName, OperationKind kind, CommitAction action, String recordId) {
        return record(OperationContext.currentOperation(), objectName, kind, action, recordId);
    }

    public RecordTrace record(String operationId, String objectName, OperationKind kind, CommitAction action,
                              String recordId) {
        return record(new RecordTrace(0, objectName, kind, action, recordId, clock.instant(), operationId));
    }

    /**
     * Mark the current end of the log for the operation in the current logging context.
     */
    public RollbackMarker snapshot() {
        return snapshot(OperationContext.currentOperation());
    }

    /**
     * Mark the current end of the log for one operation. Also takes a backend savepoint when the
     * backend offers one. The savepoint and the marker sequence are taken under the same lock as
     * {@link #record}, so no commit can fall between them. The operation stays active until
     * {@link #release} is called.
     *
     * @param operationId owner of the marker, null for a marker over every operation
     */
    public synchronized RollbackMarker snapshot(String operationId) {
        String savepointId = null;
        if (backend.supportsSavepoints()) {
            try {
                savepointId = backend.setSavepoint();
                heldSavepoints.add(savepointId);
            } catch (BulkOperationException e) {
                log.warn("Savepoint could not be set, rollback will use compensating calls: {}", e.getMessage());
            }
        }
        if (operationId != null) {
            activeOperations.add(operationId);
        }
        RollbackMarker marker = new RollbackMarker(traces.size(), savepointId, operationId);
        log.debug("Snapshot at trace {} for operation {} (savepoint: {})", marker.sequence(), operationId, savepointId);
        return marker;
    }

    /**
     * End the marker's operation and release its savepoint on the backend. Idempotent.
     *
     * @return the marker without its savepoint
     */
    public synchronized RollbackMarker release(RollbackMarker marker) {
        if (marker.operationId() != null) {
            activeOperations.remove(marker.operationId());
        }
        if (marker.hasSavepoint() && heldSavepoints.remove(marker.savepointId())) {
            try {
                backend.releaseSavepoint(marker.savepointId());
            } catch (BulkOperationException e) {
                log.warn("Savepoint {} could not be released: {}", marker.savepointId(), e.getMessage());
            }
        }
        return marker.withoutSavepoint();
    }

    /**
     * Traces in scope of the marker, oldest first: recorded after it, and by its operation when
     * the marker names one. A null marker means the whole log.
     */
    public synchronized List<RecordTrace> tracesSince(RollbackMarker marker) {
        RollbackMarker scope = marker == null ? RollbackMarker.ORIGIN : marker;
        if (scope.sequence() >= traces.size()) {
            return List.of();
        }
        return traces.subList((int) Math.max(0, scope.sequence()), traces.size()).stream()
                .filter(scope::covers)
                .toList();
    }

    public synchronized List<RecordTrace> traces() {
        return List.copyOf(traces);
    }

    public synchronized int size() {
        return traces.size();
    }

    public synchronized int heldSavepointCount() {
        return heldSavepoints.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // COMPENSATION BOOKKEEPING (used by RollbackManager)
    // ═══════════════════════════════════════════════════════════════

    synchronized boolean isCompensated(RecordTrace trace) {
        return compensated.contains(trace.sequence());
    }

    synchronized void markCompensated(RecordTrace trace) {
        compensated.add(trace.sequence());
    }

    /**
     * Restore the marker's savepoint, provided everything the savepoint would undo is in the marker's
     * scope: the savepoint is still held, no other operation is active, and every uncompensated trace
     * after the marker belongs to it. Traces the savepoint undid are marked compensated.
     *
     * @return the undone traces, empty when the savepoint cannot be used
     * @throws BulkOperationException when the backend fails to restore the savepoint
     */
    synchronized Optional<List<RecordTrace>> restoreSavepoint(RollbackMarker marker) {
        if (!marker.hasSavepoint() || !heldSavepoints.contains(marker.savepointId())) {
            return Optional.empty();
        }
        boolean othersActive = activeOperations.stream().anyMatch(op -> !op.equals(marker.operationId()));
        List<RecordTrace> after = traces.subList((int) marker.sequence(), traces.size()).stream()
                .filter(t -> !compensated.contains(t.sequence()))
                .toList();
        boolean foreignTraces = after.stream().anyMatch(t -> !marker.covers(t));
        if (othersActive || foreignTraces) {
            log.info("Savepoint {} also covers other operations' rows, using compensating calls instead",
                    marker.savepointId());
            return Optional.empty();
        }
        backend.rollbackToSavepoint(marker.savepointId());
        after.forEach(t -> compensated.add(t.sequence()));
        return Optional.of(after);
    }
}
