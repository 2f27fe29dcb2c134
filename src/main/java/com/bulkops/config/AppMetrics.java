package com.bulkops.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Application metrics for bulk operations.
 * 
 * Key metrics:
 * - bulkops.operation.time  → End-to-end orchestrated operation time
 * - bulkops.batch.time      → Per-batch execution time (tag: mode)
 * - bulkops.job.poll.time   → Time from job submission to terminal state
 * - bulkops.rows.succeeded  → Rows committed by the backend
 * - bulkops.rows.failed     → Rows that failed (any error code)
 * - bulkops.retries         → Retries spent on rate-limited/transient failures
 * - bulkops.jobs.aborted    → Jobs aborted locally (timeout or cancel)
 */
@Component
@Getter
public class AppMetrics {

    // Timers
    private final Timer operationTimer;
    private final Timer syncBatchTimer;
    private final Timer bulkBatchTimer;
    private final Timer jobPollTimer;

    // Counters
    private final Counter rowsSucceededCounter;
    private final Counter rowsFailedCounter;
    private final Counter retriesCounter;
    private final Counter jobsAbortedCounter;
    private final Counter compensationsCounter;
    private final Counter schemaCacheHitsCounter;
    private final Counter schemaCacheMissesCounter;

    public AppMetrics(MeterRegistry registry) {
        // ═══════════════════════════════════════════════════════════════
        // TIMERS - Track latency (count, total, max, mean)
        // ═══════════════════════════════════════════════════════════════

        this.operationTimer = Timer.builder("bulkops.operation.time")
                .description("End-to-end orchestrated operation time")
                .register(registry);

        this.syncBatchTimer = Timer.builder("bulkops.batch.time")
                .description("Batch execution time")
                .tag("mode", "synchronous")
                .register(registry);

        this.bulkBatchTimer = Timer.builder("bulkops.batch.time")
                .description("Batch execution time")
                .tag("mode", "bulk")
                .register(registry);

        this.jobPollTimer = Timer.builder("bulkops.job.poll.time")
                .description("Time from job submission to terminal state")
                .register(registry);

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS - Track counts
        // ═══════════════════════════════════════════════════════════════

        this.rowsSucceededCounter = Counter.builder("bulkops.rows.succeeded")
                .description("Rows committed by the backend")
                .register(registry);

        this.rowsFailedCounter = Counter.builder("bulkops.rows.failed")
                .description("Rows that failed")
                .register(registry);

        this.retriesCounter = Counter.builder("bulkops.retries")
                .description("Retries after rate-limited or transient failures")
                .register(registry);

        this.jobsAbortedCounter = Counter.builder("bulkops.jobs.aborted")
                .description("Jobs aborted locally by timeout or cancel")
                .register(registry);

        this.compensationsCounter = Counter.builder("bulkops.rollback.compensations")
                .description("Compensating calls issued by rollback")
                .register(registry);

        this.schemaCacheHitsCounter = Counter.builder("bulkops.schema.cache.hits")
                .description("Object descriptions served from cache")
                .register(registry);

        this.schemaCacheMissesCounter = Counter.builder("bulkops.schema.cache.misses")
                .description("Object descriptions fetched from the backend")
                .register(registry);
    }

    // ═══════════════════════════════════════════════════════════════
    // TIMING METHODS
    // ═══════════════════════════════════════════════════════════════

    public void recordOperationTime(long millis) {
        operationTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordBatchTime(boolean bulk, long millis) {
        (bulk ? bulkBatchTimer : syncBatchTimer).record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordJobPollTime(long millis) {
        jobPollTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    // ═══════════════════════════════════════════════════════════════
    // COUNTER METHODS
    // ═══════════════════════════════════════════════════════════════

    public void incrementRows(long succeeded, long failed) {
        rowsSucceededCounter.increment(succeeded);
        rowsFailedCounter.increment(failed);
    }

    public void incrementRetries(int count) {
        retriesCounter.increment(count);
    }

    public void incrementJobsAborted() {
        jobsAbortedCounter.increment();
    }

    public void incrementCompensations(int count) {
        compensationsCounter.increment(count);
    }

    public void incrementSchemaCacheHits() {
        schemaCacheHitsCounter.increment();
    }

    public void incrementSchemaCacheMisses() {
        schemaCacheMissesCounter.increment();
    }
}
