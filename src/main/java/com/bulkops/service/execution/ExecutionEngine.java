package com.bulkops.service.execution;

import com.bulkops.backend.BackendExecutor;
import com.bulkops.config.AppMetrics;
import com.bulkops.config.OperationContext;
import com.bulkops.exception.BackendCallException;
import com.bulkops.exception.OperationTimedOutException;
import com.bulkops.exception.PartialFailureException;
import com.bulkops.exception.RetryExhaustedException;
import com.bulkops.model.Batch;
import com.bulkops.model.BatchResult;
import com.bulkops.model.CommitAction;
import com.bulkops.model.ErrorCode;
import com.bulkops.model.ExecutionMode;
import com.bulkops.model.JobHandle;
import com.bulkops.model.JobPollResult;
import com.bulkops.model.JobState;
import com.bulkops.model.OperationKind;
import com.bulkops.model.OperationPlan;
import com.bulkops.model.RowOutcome;
import com.bulkops.service.tracking.RecordTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

/**
 * Executes one batch against the backend and merges per-row outcomes.
 *
 * SYNCHRONOUS: one backend call per record, at most {@code rowConcurrency} in flight,
 * outcomes placed by plan index regardless of completion order.
 * BULK: the batch is submitted as one job and handed to the {@link JobPoller};
 * rows the job reports as rate limited or transiently unavailable are resubmitted
 * as follow-up jobs until retries run out.
 *
 * Every committed row is recorded with the {@link RecordTracker} as soon as its
 * acknowledgement arrives. A failing row never aborts its siblings.
 */
@Service
@Slf4j
public class ExecutionEngine {

    private static final long AWAIT_GRACE_MS = 5_000;

    private final BackendExecutor backend;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final JobPoller jobPoller;
    private final RecordTracker tracker;
    private final AppMetrics metrics;
    private final ExecutorService rowExecutor;
    private final int syncThreshold;
    private final int rowConcurrency;
    private final Duration defaultWait;

    public ExecutionEngine(
            BackendExecutor backend,
            RateLimiter rateLimiter,
            RetryPolicy retryPolicy,
            JobPoller jobPoller,
            RecordTracker tracker,
            AppMetrics metrics,
            @Qualifier("rowExecutor") ExecutorService rowExecutor,
            @Value("${app.execution.sync-threshold:200}") int syncThreshold,
            @Value("${app.execution.row-concurrency:10}") int rowConcurrency,
            @Value("${app.execution.default-wait:PT10M}") Duration defaultWait) {
        this.backend = backend;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.jobPoller = jobPoller;
        this.tracker = tracker;
        this.metrics = metrics;
        this.rowExecutor = rowExecutor;
        this.syncThreshold = syncThreshold;
        this.rowConcurrency = Math.max(1, rowConcurrency);
        this.defaultWait = defaultWait;
        log.info("ExecutionEngine initialized: syncThreshold={}, rowConcurrency={}, defaultWait={}",
                syncThreshold, this.rowConcurrency, defaultWait);
    }

    /**
     * Mode actually used for a batch: bulk-only kinds always go BULK, AUTO picks by size.
     */
    public ExecutionMode resolveMode(OperationPlan plan, Batch batch, ExecutionMode requested) {
        if (plan.kind().forcesBulk()) {
            return ExecutionMode.BULK;
        }
        if (requested == null || requested == ExecutionMode.AUTO) {
            return batch.rowCount() < syncThreshold ? ExecutionMode.SYNCHRONOUS : ExecutionMode.BULK;
        }
        return requested;
    }

    /**
     * Execute a mutating batch.
     *
     * @param batch    records to apply
     * @param plan     plan the batch belongs to
     * @param mode     requested mode
     * @param deadline bound on every blocking wait of this batch
     * @return one outcome per record, ordered by plan index
     */
    public BatchResult execute(Batch batch, OperationPlan plan, ExecutionMode mode, Deadline deadline) {
        if (plan.kind().isRead()) {
            throw new IllegalArgumentException(plan.kind() + " plans are read with runQuery, not executed in batches");
        }
        ExecutionMode resolved = resolveMode(plan, batch, mode);
        RetryBudget budget = new RetryBudget();
        long startTime = System.currentTimeMillis();
        OperationContext.enterBatch(batch.sequence());
        try {
            log.info("Batch {}: {} {} rows on {} [{}], first index {}",
                    batch.sequence(), batch.rowCount(), plan.kind(), plan.objectName(), resolved, batch.firstIndex());

            BatchResult result = resolved == ExecutionMode.SYNCHRONOUS
                    ? runSynchronous(batch, plan, budget, deadline)
                    : runBulk(batch, plan, budget, deadline);

            long elapsed = System.currentTimeMillis() - startTime;
            metrics.recordBatchTime(resolved == ExecutionMode.BULK, elapsed);
            metrics.incrementRows(result.successCount(), result.failureCount());
            metrics.incrementRetries(result.retries());
            log.info("Batch {} done in {}ms: {} succeeded, {} failed, {} retries",
                    batch.sequence(), elapsed, result.successCount(), result.failureCount(), result.retries());
            return result;
        } finally {
            OperationContext.leaveBatch();
        }
    }

    /**
     * Same as {@link #execute}, but a batch with mixed results raises {@link PartialFailureException}.
     */
    public BatchResult executeStrict(Batch batch, OperationPlan plan, ExecutionMode mode, Deadline deadline) {
        BatchResult result = execute(batch, plan, mode, deadline);
        PartialFailureException.throwIfPartial(result);
        return result;
    }

    // ═══════════════════════════════════════════════════════════════
    // SYNCHRONOUS PER-RECORD
    // ═══════════════════════════════════════════════════════════════

    private BatchResult runSynchronous(Batch batch, OperationPlan plan, RetryBudget budget, Deadline deadline) {
        RowOutcome[] outcomes = new RowOutcome[batch.rowCount()];
        Semaphore rowSlots = new Semaphore(rowConcurrency);

        List<CompletableFuture<Void>> futures = IntStream.range(0, batch.rowCount())
                .mapToObj(pos -> CompletableFuture.runAsync(() ->
                        outcomes[pos] = runRowWithSemaphore(batch, pos, plan, rowSlots, budget, deadline), rowExecutor))
                .toList();

        // Wait for all rows
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        return new BatchResult(batch.sequence(), ExecutionMode.SYNCHRONOUS, Arrays.asList(outcomes),
                budget.retries(), null, null, false);
    }

    private RowOutcome runRowWithSemaphore(Batch batch, int pos, OperationPlan plan, Semaphore rowSlots,
                                           RetryBudget budget, Deadline deadline) {
        int index = batch.planIndex(pos);
        OperationKind operation = plan.kind().rowOperation();
        try {
            if (!rowSlots.tryAcquire(deadline.remainingMillis(), TimeUnit.MILLISECONDS)) {
                return RowOutcome.failed(index, ErrorCode.TIMED_OUT, "Deadline passed before the row was sent");
            }
            try {
                RowOutcome outcome = retryPolicy.callRow(operation + " " + plan.objectName(), index, budget, deadline,
                        () -> {
                            try (RateLimiter.Permit ignored = rateLimiter.acquire(deadline)) {
                                return backend.runSingle(operation, plan.objectName(), plan.externalIdField(),
                                        batch.records().get(pos));
                            }
                        });
                track(plan, operation, outcome);
                return outcome;
            } finally {
                rowSlots.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Row {} interrupted before completion", index);
            return RowOutcome.failed(index, ErrorCode.ABORTED, "Interrupted");
        } catch (RuntimeException e) {
            log.warn("Row {} failed unexpectedly: {}", index, e.getMessage());
            return RowOutcome.failed(index, ErrorCode.UNEXPECTED, e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // ASYNCHRONOUS BULK JOBS
    // ═══════════════════════════════════════════════════════════════

    private BatchResult runBulk(Batch batch, OperationPlan plan, RetryBudget budget, Deadline deadline) {
        OperationKind operation = plan.kind().rowOperation();
        RowOutcome[] outcomes = new RowOutcome[batch.rowCount()];
        List<Integer> pending = new ArrayList<>(IntStream.range(0, batch.rowCount()).boxed().toList());
        String jobId = null;
        JobState jobState = null;
        boolean backendStillRunning = false;
        int round = 0;

        while (!pending.isEmpty()) {
            round++;
            List<Map<String, Object>> records = pending.stream().map(batch.records()::get).toList();

            JobHandle handle;
            try {
                handle = retryPolicy.call("submit " + operation + " " + plan.objectName(), budget, deadline, () -> {
                    try (RateLimiter.Permit ignored = rateLimiter.acquire(deadline)) {
                        return backend.submitJob(operation, plan.objectName(), plan.externalIdField(), records);
                    }
                });
            } catch (RetryExhaustedException e) {
                fail(outcomes, batch, pending, ErrorCode.RETRY_EXHAUSTED, e.getMessage());
                break;
            } catch (OperationTimedOutException e) {
                fail(outcomes, batch, pending, ErrorCode.TIMED_OUT, e.getMessage());
                break;
            } catch (BackendCallException e) {
                log.warn("Batch {} job submission rejected: {} {}", batch.sequence(), e.getErrorCode(), e.getMessage());
                fail(outcomes, batch, pending, e.getErrorCode(), e.getMessage());
                break;
            }

            JobPollResult polled = await(jobPoller.track(handle, waitBudget(deadline)));
            jobId = handle.jobId();
            jobState = polled.state();
            backendStillRunning = polled.backendStillRunning();

            List<Integer> retry = new ArrayList<>();
            boolean[] reported = new boolean[pending.size()];
            for (RowOutcome result : polled.results()) {
                if (result.index() < 0 || result.index() >= pending.size()) {
                    log.warn("Job {} reported an unknown row position {}", jobId, result.index());
                    continue;
                }
                reported[result.index()] = true;
                int pos = pending.get(result.index());
                RowOutcome placed = result.withIndex(batch.planIndex(pos));
                track(plan, operation, placed);
                if (!placed.isRetryable()) {
                    outcomes[pos] = placed;
                } else if (round <= retryPolicy.getMaxRetries()) {
                    retry.add(pos);
                } else {
                    outcomes[pos] = RowOutcome.failed(placed.index(), ErrorCode.RETRY_EXHAUSTED,
                            "Retries exhausted after " + round + " jobs, last error " + placed.errorCode()
                                    + ": " + placed.errorMessage());
                }
            }
            for (int i = 0; i < reported.length; i++) {
                if (!reported[i]) {
                    int pos = pending.get(i);
                    outcomes[pos] = unreported(batch.planIndex(pos), polled);
                }
            }

            if (!retry.isEmpty()) {
                log.info("Batch {}: resubmitting {} retryable row(s) after job {}", batch.sequence(), retry.size(), jobId);
                try {
                    retryPolicy.pause("follow-up job for batch " + batch.sequence(), round,
                            firstRetryableCode(polled), budget, deadline);
                } catch (OperationTimedOutException e) {
                    fail(outcomes, batch, retry, ErrorCode.TIMED_OUT, e.getMessage());
                    break;
                }
            }
            pending = retry;
        }

        return new BatchResult(batch.sequence(), ExecutionMode.BULK, Arrays.asList(outcomes), budget.retries(),
                jobId, jobState, backendStillRunning);
    }

    private JobPollResult await(TrackedJob job) {
        try {
            return job.await(AWAIT_GRACE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for job {}, cancelling", job.getHandle().jobId());
            return job.cancel();
        }
    }

    private Duration waitBudget(Deadline deadline) {
        Duration remaining = deadline.remaining();
        return remaining.compareTo(defaultWait) < 0 ? remaining : defaultWait;
    }

    /**
     * Outcome for a row the job never reported on.
     */
    private static RowOutcome unreported(int index, JobPollResult polled) {
        String jobId = polled.handle().jobId();
        if (polled.state() == JobState.ABORTED && polled.backendStillRunning()) {
            return RowOutcome.failed(index, ErrorCode.TIMED_OUT,
                    "Job " + jobId + " still running on backend after wait budget; re-poll to learn its result");
        }
        if (polled.state() == JobState.ABORTED) {
            return RowOutcome.failed(index, ErrorCode.ABORTED, "Job " + jobId + " aborted");
        }
        if (polled.state() == JobState.JOB_FAILED) {
            return RowOutcome.failed(index, ErrorCode.JOB_FAILED, "Job " + jobId + " failed");
        }
        return RowOutcome.failed(index, ErrorCode.UNEXPECTED, "Job " + jobId + " reported no result for this row");
    }

    private static ErrorCode firstRetryableCode(JobPollResult polled) {
        return polled.results().stream()
                .filter(RowOutcome::isRetryable)
                .map(RowOutcome::errorCode)
                .findFirst()
                .orElse(ErrorCode.TRANSIENT_UNAVAILABLE);
    }

    private static void fail(RowOutcome[] outcomes, Batch batch, List<Integer> positions, ErrorCode code, String message) {
        for (int pos : positions) {
            outcomes[pos] = RowOutcome.failed(batch.planIndex(pos), code, message);
        }
    }

    private void track(OperationPlan plan, OperationKind operation, RowOutcome outcome) {
        if (outcome.success() && outcome.recordId() != null && outcome.action() != null
                && outcome.action() != CommitAction.NONE) {
            tracker.record(plan.operationId(), plan.objectName(), operation, outcome.action(), outcome.recordId());
        }
    }
}
