package com.bulkops.service.tracking;

import com.bulkops.backend.BackendExecutor;
import com.bulkops.config.AppMetrics;
import com.bulkops.exception.BulkOperationException;
import com.bulkops.exception.RollbackException;
import com.bulkops.model.ErrorCode;
import com.bulkops.model.ObjectSchema;
import com.bulkops.model.OperationKind;
import com.bulkops.model.RecordTrace;
import com.bulkops.model.RollbackMarker;
import com.bulkops.model.RollbackResult;
import com.bulkops.model.RowOutcome;
import com.bulkops.service.execution.Deadline;
import com.bulkops.service.execution.RateLimiter;
import com.bulkops.service.execution.RetryBudget;
import com.bulkops.service.execution.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Undoes committed rows recorded after a marker.
 *
 * Uses the backend savepoint when the marker carries one and nothing outside the marker's
 * operation was committed since it was taken.
 * Otherwise issues one compensating call per trace, newest first:
 * CREATED → delete, DELETED → restore from recycle bin, UPDATED → restore before-image.
 * Each trace is compensated at most once; a record already gone counts as undone.
 * Best effort: every trace is attempted, failures are collected into a {@link RollbackException}.
 */
@Service
@Slf4j
public class RollbackManager {

    private final BackendExecutor backend;
    private final RecordTracker tracker;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final AppMetrics metrics;

    @Value("${app.execution.default-wait:PT10M}")
    private Duration defaultTimeout = Duration.ofMinutes(10);

    public RollbackManager(BackendExecutor backend, RecordTracker tracker, RetryPolicy retryPolicy,
                           RateLimiter rateLimiter, AppMetrics metrics) {
        this.backend = backend;
        this.tracker = tracker;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
    }

    /**
     * Roll back everything in scope of {@code marker} within the configured default wait;
     * null rolls back the whole log.
     *
     * @throws RollbackException if any trace could not be undone
     */
    public RollbackResult rollback(RollbackMarker marker) {
        return rollback(marker, defaultTimeout);
    }

    /**
     * Roll back everything in scope of {@code marker}. Every wait for a call slot and every retry
     * backoff is bounded by {@code timeout}; traces not undone in time are reported as TIMED_OUT.
     *
     * @throws RollbackException if any trace could not be undone
     */
    public RollbackResult rollback(RollbackMarker marker, Duration timeout) {
        RollbackMarker scope = marker == null ? RollbackMarker.ORIGIN : marker;
        Deadline deadline = Deadline.after(timeout);
        List<RecordTrace> inScope = new ArrayList<>(tracker.tracesSince(scope));
        inScope.sort(Comparator.comparingLong(RecordTrace::sequence).reversed());

        List<RecordTrace> pending = new ArrayList<>();
        List<RecordTrace> skipped = new ArrayList<>();
        for (RecordTrace trace : inScope) {
            (tracker.isCompensated(trace) ? skipped : pending).add(trace);
        }
        if (pending.isEmpty()) {
            log.info("Rollback to trace {}: nothing left to undo ({} already compensated)",
                    scope.sequence(), skipped.size());
            return new RollbackResult(scope, List.of(), skipped, false);
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("ROLLBACK to trace {} (operation {}): {} trace(s) to undo",
                scope.sequence(), scope.operationId() == null ? "all" : scope.operationId(), pending.size());
        log.info("═══════════════════════════════════════════════════════════════");

        if (scope.hasSavepoint() && backend.supportsSavepoints()) {
            try {
                Optional<List<RecordTrace>> undone = tracker.restoreSavepoint(scope);
                if (undone.isPresent()) {
                    metrics.incrementCompensations(undone.get().size());
                    log.info("Rolled back {} trace(s) via savepoint {}", undone.get().size(), scope.savepointId());
                    return new RollbackResult(scope, pending, skipped, true);
                }
            } catch (BulkOperationException e) {
                log.warn("Savepoint rollback failed, falling back to compensating calls: {}", e.getMessage());
            }
        }

        List<RecordTrace> compensated = new ArrayList<>();
        Map<RecordTrace, String> failures = new LinkedHashMap<>();
        for (RecordTrace trace : pending) {
            if (deadline.isExpired()) {
                failures.put(trace, ErrorCode.TIMED_OUT + ": rollback deadline passed before this trace was undone");
                continue;
            }
            try {
                RowOutcome outcome = compensate(trace, deadline);
                if (outcome.success()) {
                    tracker.markCompensated(trace);
                    compensated.add(trace);
                } else if (outcome.errorCode() == ErrorCode.NOT_FOUND) {
                    tracker.markCompensated(trace);
                    skipped.add(trace);
                } else {
                    failures.put(trace, outcome.errorCode() + ": " + outcome.errorMessage());
                }
            } catch (BulkOperationException e) {
                failures.put(trace, e.getErrorCode() + ": " + e.getMessage());
            }
        }
        metrics.incrementCompensations(compensated.size());

        if (!failures.isEmpty()) {
            log.error("Rollback left {} trace(s) in place ({} compensated)", failures.size(), compensated.size());
            failures.forEach((trace, reason) -> log.error("  trace {} {} {} {}: {}",
                    trace.sequence(), trace.action(), trace.objectName(), trace.recordId(), reason));
            throw new RollbackException(failures, compensated);
        }
        log.info("Rollback complete: {} compensated, {} already undone", compensated.size(), skipped.size());
        return new RollbackResult(scope, compensated, skipped, false);
    }

    private RowOutcome compensate(RecordTrace trace, Deadline deadline) {
        return retryPolicy.callRow("rollback " + trace.objectName(), (int) trace.sequence(), new RetryBudget(),
                deadline, () -> {
                    try (RateLimiter.Permit ignored = rateLimiter.acquire(deadline)) {
                        return switch (trace.action()) {
                            case CREATED, RESTORED -> backend.runSingle(OperationKind.DELETE, trace.objectName(),
                                    null, Map.of(ObjectSchema.ID_FIELD, trace.recordId()));
                            case DELETED, UPDATED -> backend.restore(trace);
                            case NONE -> throw new IllegalStateException("Trace without commit: " + trace);
                        };
                    }
                });
    }
}
