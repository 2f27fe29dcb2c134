package com.bulkops.service;

import com.bulkops.backend.BackendExecutor;
import com.bulkops.backend.CachingSchemaProvider;
import com.bulkops.config.AppMetrics;
import com.bulkops.config.OperationContext;
import com.bulkops.exception.LimitConfigurationException;
import com.bulkops.exception.PlanValidationException;
import com.bulkops.exception.RollbackException;
import com.bulkops.model.Batch;
import com.bulkops.model.BatchLimits;
import com.bulkops.model.BatchResult;
import com.bulkops.model.CleanupPattern;
import com.bulkops.model.CleanupPredicate;
import com.bulkops.model.ErrorCode;
import com.bulkops.model.ExecutionMode;
import com.bulkops.model.FailedRow;
import com.bulkops.model.GenerationPurpose;
import com.bulkops.model.JobPollResult;
import com.bulkops.model.JobState;
import com.bulkops.model.ObjectSchema;
import com.bulkops.model.OperationIntent;
import com.bulkops.model.OperationOutcome;
import com.bulkops.model.OperationPlan;
import com.bulkops.model.OperationReport;
import com.bulkops.model.RecordCounts;
import com.bulkops.model.RecordTrace;
import com.bulkops.model.RollbackMarker;
import com.bulkops.model.RollbackResult;
import com.bulkops.model.RowOutcome;
import com.bulkops.model.ScoreReport;
import com.bulkops.service.batching.LimitAwareBatcher;
import com.bulkops.service.execution.Deadline;
import com.bulkops.service.execution.ExecutionEngine;
import com.bulkops.service.execution.JobPoller;
import com.bulkops.service.execution.RateLimiter;
import com.bulkops.service.execution.RetryBudget;
import com.bulkops.service.execution.RetryPolicy;
import com.bulkops.service.execution.TrackedJob;
import com.bulkops.service.planning.RequestPlanner;
import com.bulkops.service.report.OperationReportWriter;
import com.bulkops.service.scoring.ScoringEngine;
import com.bulkops.service.testdata.TestDataFactoryRegistry;
import com.bulkops.service.tracking.CleanupQueryGenerator;
import com.bulkops.service.tracking.RecordTracker;
import com.bulkops.service.tracking.RollbackManager;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Orchestrates one bulk data operation end to end.
 *
 * Stages:
 * 1. Plan        - describe the object, validate the intent, generate test data if asked
 * 2. Pre-score   - rubric check of the plan, logged, never blocking
 * 3. Execute     - lazy batches on the batch executor, bounded in flight; reads stream the query
 * 4. Track       - collect traces, cleanup predicates, failed rows; optional auto-rollback
 * 5. Report      - post-score and the operation report (JSON Lines when a report path is set)
 *
 * Plan validation errors propagate before anything is executed. Batch-level failures only
 * fail the rows of that batch.
 */
@Service
@Slf4j
public class BulkOperationOrchestrator {

    private final CachingSchemaProvider schemaProvider;
    private final RequestPlanner planner;
    private final LimitAwareBatcher batcher;
    private final ExecutionEngine engine;
    private final JobPoller jobPoller;
    private final RecordTracker tracker;
    private final RollbackManager rollbackManager;
    private final CleanupQueryGenerator cleanupGenerator;
    private final ScoringEngine scoringEngine;
    private final TestDataFactoryRegistry testData;
    private final FailedRowPublisher failedRowPublisher;
    private final OperationReportWriter reportWriter;
    private final BackendExecutor backend;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final AppMetrics metrics;
    private final ExecutorService batchExecutor;
    private final Clock clock;
    // aborted job id -> operation that submitted it, so late commits are traced under their owner
    private final Cache<String, String> abortedJobOwners = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(Duration.ofDays(1))
            .build();

    @Value("${app.execution.batch-concurrency:4}")
    private int batchConcurrency = 4;

    @Value("${app.execution.default-wait:PT10M}")
    private Duration defaultTimeout = Duration.ofMinutes(10);

    @Value("${app.report.sample-size:10}")
    private int sampleSize = 10;

    public BulkOperationOrchestrator(
            CachingSchemaProvider schemaProvider,
            RequestPlanner planner,
            LimitAwareBatcher batcher,
            ExecutionEngine engine,
            JobPoller jobPoller,
            RecordTracker tracker,
            RollbackManager rollbackManager,
            CleanupQueryGenerator cleanupGenerator,
            ScoringEngine scoringEngine,
            TestDataFactoryRegistry testData,
            FailedRowPublisher failedRowPublisher,
            OperationReportWriter reportWriter,
            BackendExecutor backend,
            RateLimiter rateLimiter,
            RetryPolicy retryPolicy,
            AppMetrics metrics,
            @Qualifier("batchExecutor") ExecutorService batchExecutor,
            Clock clock) {
        this.schemaProvider = schemaProvider;
        this.planner = planner;
        this.batcher = batcher;
        this.engine = engine;
        this.jobPoller = jobPoller;
        this.tracker = tracker;
        this.rollbackManager = rollbackManager;
        this.cleanupGenerator = cleanupGenerator;
        this.scoringEngine = scoringEngine;
        this.testData = testData;
        this.failedRowPublisher = failedRowPublisher;
        this.reportWriter = reportWriter;
        this.backend = backend;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.batchExecutor = batchExecutor;
        this.clock = clock;
    }

    /**
     * Run with automatic mode selection, the configured batch limits and the default timeout.
     */
    public OperationReport execute(OperationIntent intent) {
        return execute(intent, ExecutionMode.AUTO, batcher.defaultLimits(), defaultTimeout);
    }

    public OperationReport execute(OperationIntent intent, ExecutionMode mode, Duration timeout) {
        return execute(intent, mode, batcher.defaultLimits(), timeout);
    }

    /**
     * @param intent  what to do
     * @param mode    AUTO, or a forced mode for every batch
     * @param limits  per-call quotas
     * @param timeout bound on every blocking wait of the operation
     * @throws PlanValidationException     the intent does not fit the schema; nothing was executed
     * @throws LimitConfigurationException the limits themselves are unusable
     */
    public OperationReport execute(OperationIntent intent, ExecutionMode mode, BatchLimits limits, Duration timeout) {
        boolean ownsContext = MDC.get(OperationContext.OPERATION_ID) == null;
        String operationId = OperationContext.ensureOperation();
        long startTime = System.currentTimeMillis();
        RollbackMarker marker = null;
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("OPERATION START: {} on {} | records: {} | mode: {}",
                    intent.kind(), intent.objectName(), intent.records().size(), mode);
            log.info("═══════════════════════════════════════════════════════════════");
            Deadline deadline = Deadline.after(timeout);

            // STAGE 1: Plan
            log.info("STAGE 1: Planning");
            ObjectSchema schema = schemaProvider.describeObject(intent.objectName());
            OperationPlan plan = withTestData(planner.plan(intent, schema)).withOperation(operationId);

            // STAGE 2: Pre-execution score
            ScoreReport preScore = scoringEngine.score(plan, null);
            log.info("STAGE 2: Pre-execution score {}/130 ({})", preScore.total(), preScore.rating());

            // STAGE 3: Execute
            log.info("STAGE 3: Execution");
            marker = plan.kind().isRead() ? null : tracker.snapshot(operationId);
            List<BatchResult> batchResults = List.of();
            long queried = 0;
            if (plan.kind().isRead()) {
                queried = runQuery(plan, deadline);
            } else {
                batchResults = runBatches(plan, mode, limits, deadline);
            }

            // STAGE 4: Tracking, cleanup, rollback
            log.info("STAGE 4: Tracking");
            List<RecordTrace> traces = marker == null ? List.of() : tracker.tracesSince(marker);
            List<CleanupPredicate> cleanup = plan.generateCleanup() && marker != null
                    ? cleanupGenerator.generate(CleanupPattern.trackedIds(plan.objectName()), marker)
                    : List.of();
            OperationOutcome outcome = new OperationOutcome(plan.records().size(), batchResults, traces, cleanup,
                    marker, queried);
            RecordCounts counts = outcome.counts();
            List<FailedRow> failedRows = outcome.rows().stream()
                    .filter(r -> !r.success())
                    .map(FailedRow::of)
                    .toList();
            failedRowPublisher.publish(plan.objectName(), failedRows);
            boolean rolledBack = plan.rollbackOnFailure() && counts.failed() > 0 && marker != null
                    && rollBackAfterFailure(marker, deadline);
            RollbackMarker reportedMarker = marker == null ? null : tracker.release(marker);

            // STAGE 5: Post-execution score and report
            ScoreReport postScore = scoringEngine.score(plan, outcome);
            List<String> abortedJobIds = batchResults.stream()
                    .filter(b -> b.jobId() != null && b.isAborted())
                    .map(BatchResult::jobId)
                    .toList();
            abortedJobIds.forEach(jobId -> abortedJobOwners.put(jobId, operationId));
            List<String> sample = traces.stream().map(RecordTrace::recordId).distinct().limit(sampleSize).toList();
            OperationReport report = new OperationReport(operationId, plan.kind(), plan.objectName(), counts, sample,
                    preScore, postScore, cleanup, reportedMarker, rolledBack, failedRows, abortedJobIds, clock.instant());
            reportWriter.write(report);

            long totalTime = System.currentTimeMillis() - startTime;
            metrics.recordOperationTime(totalTime);
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("OPERATION COMPLETE | {} {} | Total: {}ms", plan.kind(), plan.objectName(), totalTime);
            log.info("  Created: {} | Updated: {} | Deleted: {} | Failed: {} | Queried: {}",
                    counts.created(), counts.updated(), counts.deleted(), counts.failed(), counts.queried());
            log.info("  Score: {}/130 ({}) | Aborted jobs: {} | Rolled back: {}",
                    postScore.total(), postScore.rating(), abortedJobIds.size(), rolledBack);
            log.info("═══════════════════════════════════════════════════════════════");
            return report;
        } finally {
            if (marker != null) {
                tracker.release(marker);
            }
            if (ownsContext) {
                OperationContext.clear();
            }
        }
    }

    /**
     * Resume polling a job that an operation reported as aborted. Rows the job committed
     * in the meantime are recorded with the tracker, under the operation that submitted the job,
     * so they can still be rolled back with that operation's marker.
     *
     * @return the new poll result, empty when the job id is not in the archive
     */
    public Optional<JobPollResult> repollJob(String jobId, Duration wait) {
        Optional<JobPollResult> previous = jobPoller.archived(jobId);
        if (previous.isEmpty()) {
            log.warn("Job {} is not in the job archive", jobId);
            return Optional.empty();
        }
        Optional<TrackedJob> tracked = jobPoller.repoll(jobId, wait);
        if (tracked.isEmpty()) {
            return Optional.empty();
        }
        JobPollResult result;
        try {
            result = tracked.get().await(0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = tracked.get().cancel();
        }
        // rows are traced only once, the first time a poll result carries them
        if (result.state() == JobState.JOB_COMPLETE && previous.get().results().isEmpty()) {
            String owner = abortedJobOwners.getIfPresent(jobId);
            for (RowOutcome row : result.results()) {
                if (row.success() && row.recordId() != null) {
                    tracker.record(owner, result.handle().objectName(), result.handle().kind(), row.action(), row.recordId());
                }
            }
        }
        log.info("Re-polled job {}: {} ({} results)", jobId, result.state(), result.results().size());
        return Optional.of(result);
    }

    public RollbackResult rollback(RollbackMarker marker) {
        return rollbackManager.rollback(marker);
    }

    public RollbackResult rollback(RollbackMarker marker, Duration timeout) {
        return rollbackManager.rollback(marker, timeout);
    }

    public List<CleanupPredicate> cleanupPredicates(CleanupPattern pattern) {
        return cleanupGenerator.generate(pattern);
    }

    // ═══════════════════════════════════════════════════════════════
    // STAGES
    // ═══════════════════════════════════════════════════════════════

    private OperationPlan withTestData(OperationPlan plan) {
        if (!plan.bulkTriggerTest() || !plan.records().isEmpty() || plan.kind().isRead()) {
            return plan;
        }
        if (!testData.isRegistered(plan.objectName())) {
            throw new PlanValidationException("Bulk trigger test on " + plan.objectName()
                    + " has no records and no registered test data factory");
        }
        List<Map<String, Object>> generated =
                testData.generate(plan.objectName(), plan.recordCount(), GenerationPurpose.BULK_PROCESSING);
        return plan.withRecords(generated);
    }

    private long runQuery(OperationPlan plan, Deadline deadline) {
        long count = retryPolicy.call("query " + plan.objectName(), new RetryBudget(), deadline, () -> {
            try (RateLimiter.Permit ignored = rateLimiter.acquire(deadline);
                 Stream<Map<String, Object>> rows = backend.runQuery(plan.queryText())) {
                return rows.count();
            }
        });
        log.info("Query on {} returned {} row(s)", plan.objectName(), count);
        return count;
    }

    /**
     * Feed lazily produced batches to the batch executor, at most {@code batchConcurrency} in flight.
     * An oversized record fails alone; batching resumes after it.
     */
    private List<BatchResult> runBatches(OperationPlan plan, ExecutionMode mode, BatchLimits limits, Deadline deadline) {
        Semaphore inFlight = new Semaphore(Math.max(1, batchConcurrency));
        List<CompletableFuture<BatchResult>> futures = new ArrayList<>();
        List<BatchResult> results = new ArrayList<>();
        int startIndex = 0;
        int nextSequence = 0;
        boolean interrupted = false;

        while (!interrupted) {
            Iterator<Batch> batches = batcher.split(plan, limits, startIndex, nextSequence).iterator();
            try {
                while (batches.hasNext()) {
                    Batch batch = batches.next();
                    nextSequence = batch.sequence() + 1;
                    try {
                        inFlight.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.warn("Interrupted while scheduling batch {}, remaining rows are aborted", batch.sequence());
                        results.add(failedBatch(batch.sequence(), mode,
                                IntStream.range(batch.firstIndex(), plan.records().size()),
                                ErrorCode.ABORTED, "Operation interrupted before this row was scheduled"));
                        interrupted = true;
                        break;
                    }
                    futures.add(CompletableFuture
                            .supplyAsync(() -> engine.execute(batch, plan, mode, deadline), batchExecutor)
                            .handle((result, error) -> {
                                inFlight.release();
                                if (error == null) {
                                    return result;
                                }
                                Throwable cause = error.getCause() != null ? error.getCause() : error;
                                log.error("Batch {} failed as a whole: {}", batch.sequence(), cause.getMessage());
                                return failedBatch(batch.sequence(), mode,
                                        IntStream.range(batch.firstIndex(), batch.firstIndex() + batch.rowCount()),
                                        ErrorCode.UNEXPECTED, cause.getMessage());
                            }));
                }
                break;
            } catch (LimitConfigurationException e) {
                if (e.getRecordIndex() < 0) {
                    throw e;
                }
                log.warn("Record {} skipped: {}", e.getRecordIndex(), e.getMessage());
                results.add(failedBatch(nextSequence++, mode, IntStream.of(e.getRecordIndex()),
                        ErrorCode.LIMIT_CONFIGURATION, e.getMessage()));
                startIndex = e.getRecordIndex() + 1;
            }
        }

        // Wait for all batches
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        futures.forEach(f -> results.add(f.join()));
        results.sort(Comparator.comparingInt(BatchResult::sequence));
        return results;
    }

    private boolean rollBackAfterFailure(RollbackMarker marker, Deadline deadline) {
        log.warn("Rows failed and rollback on failure is set, rolling back to trace {}", marker.sequence());
        try {
            RollbackResult result = rollbackManager.rollback(marker, deadline.remaining());
            log.info("Auto-rollback undid {} trace(s){}", result.compensated().size(),
                    result.viaSavepoint() ? " via savepoint" : "");
            return true;
        } catch (RollbackException e) {
            log.error("Auto-rollback incomplete: {} trace(s) left in place", e.getFailedTraces().size());
            return false;
        }
    }

    private static BatchResult failedBatch(int sequence, ExecutionMode mode, IntStream indexes, ErrorCode code,
                                           String message) {
        List<RowOutcome> rows = indexes.mapToObj(i -> RowOutcome.failed(i, code, message)).toList();
        return new BatchResult(sequence, mode, rows, 0, null, null, false);
    }
}
