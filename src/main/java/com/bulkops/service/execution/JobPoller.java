package com.bulkops.service.execution;

import com.bulkops.backend.BackendExecutor;
import com.bulkops.config.AppMetrics;
import com.bulkops.exception.BackendCallException;
import com.bulkops.model.JobHandle;
import com.bulkops.model.JobPollResult;
import com.bulkops.model.JobState;
import com.bulkops.model.JobStatus;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives asynchronous jobs to a terminal state.
 *
 * Polls run on a shared scheduler, so one job's poll loop never blocks another job or batch.
 * The interval starts at {@code initialInterval} and grows by {@code backoffMultiplier}
 * up to {@code maxInterval}. When the wait budget runs out the job is reported ABORTED
 * locally while possibly still running on the backend; callers can re-poll it later by id.
 * Terminal results are archived for later lookup.
 */
@Component
@Slf4j
public class JobPoller {

    private final BackendExecutor executor;
    private final ScheduledExecutorService scheduler;
    private final Cache<String, JobPollResult> jobArchive;
    private final AppMetrics metrics;
    private final Duration initialInterval;
    private final Duration maxInterval;
    private final double backoffMultiplier;

    public JobPoller(
            BackendExecutor executor,
            @Qualifier("jobPollScheduler") ScheduledExecutorService scheduler,
            @Qualifier("jobArchiveCache") Cache<String, JobPollResult> jobArchive,
            AppMetrics metrics,
            @Value("${app.poller.initial-interval:PT1S}") Duration initialInterval,
            @Value("${app.poller.max-interval:PT30S}") Duration maxInterval,
            @Value("${app.poller.backoff-multiplier:1.5}") double backoffMultiplier) {
        this.executor = executor;
        this.scheduler = scheduler;
        this.jobArchive = jobArchive;
        this.metrics = metrics;
        this.initialInterval = initialInterval;
        this.maxInterval = maxInterval;
        this.backoffMultiplier = Math.max(1.0, backoffMultiplier);
        log.info("JobPoller initialized: initialInterval={}, maxInterval={}, multiplier={}",
                initialInterval, maxInterval, this.backoffMultiplier);
    }

    /**
     * Start polling a submitted job. Returns immediately.
     *
     * @param handle handle acknowledged by the backend
     * @param wait   polling budget
     */
    public TrackedJob track(JobHandle handle, Duration wait) {
        TrackedJob job = new TrackedJob(handle, Deadline.after(wait), this);
        job.acknowledge();
        long startedAt = System.currentTimeMillis();
        job.future().whenComplete((result, error) -> {
            metrics.recordJobPollTime(System.currentTimeMillis() - startedAt);
            if (result != null) {
                jobArchive.put(handle.jobId(), result);
                if (result.state() == JobState.ABORTED) {
                    metrics.incrementJobsAborted();
                }
            }
        });
        log.info("Tracking job {} ({} {} rows on {}) for up to {}",
                handle.jobId(), handle.kind(), handle.rowCount(), handle.objectName(), wait);
        schedule(job, initialInterval.toMillis(), Map.copyOf(mdc()));
        return job;
    }

    /**
     * Resume polling a job known from the archive, typically one aborted by timeout.
     */
    public Optional<TrackedJob> repoll(String jobId, Duration wait) {
        return archived(jobId).map(previous -> track(previous.handle(), wait));
    }

    public Optional<JobPollResult> archived(String jobId) {
        return Optional.ofNullable(jobArchive.getIfPresent(jobId));
    }

    // ═══════════════════════════════════════════════════════════════
    // POLL LOOP
    // ═══════════════════════════════════════════════════════════════

    private void schedule(TrackedJob job, long delayMillis, Map<String, String> context) {
        if (job.isDone()) {
            return;
        }
        long bounded = Math.max(0, Math.min(delayMillis, job.deadline().remainingMillis()));
        try {
            job.scheduled(scheduler.schedule(() -> pollOnce(job, delayMillis, context), bounded, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.warn("Poll scheduler rejected job {}: {}", job.getHandle().jobId(), e.getMessage());
            job.finish(JobState.ABORTED, List.of(), !job.getBackendState().isTerminal());
        }
    }

    private void pollOnce(TrackedJob job, long currentInterval, Map<String, String> context) {
        if (job.isDone()) {
            return;
        }
        MDC.setContextMap(context);
        try {
            if (job.deadline().isExpired()) {
                boolean stillRunning = !job.getBackendState().isTerminal();
                if (job.finish(JobState.ABORTED, List.of(), stillRunning)) {
                    log.warn("Job {} wait budget exhausted after {} polls; backend state {} (still running: {})",
                            job.getHandle().jobId(), job.getPolls(), job.getBackendState(), stillRunning);
                }
                return;
            }
            JobStatus status;
            try {
                status = executor.pollJob(job.getHandle());
            } catch (BackendCallException e) {
                if (e.isRetryable()) {
                    log.warn("Poll of job {} failed transiently: {}", job.getHandle().jobId(), e.getMessage());
                    schedule(job, nextInterval(currentInterval), context);
                    return;
                }
                log.error("Poll of job {} failed: {}", job.getHandle().jobId(), e.getMessage());
                job.finish(JobState.JOB_FAILED, List.of(), false);
                return;
            }
            job.observed(status.state());
            switch (status.state()) {
                case JOB_COMPLETE -> {
                    if (job.finish(JobState.JOB_COMPLETE, status.results(), false)) {
                        log.info("Job {} complete after {} polls ({} results)",
                                job.getHandle().jobId(), job.getPolls(), status.results().size());
                    }
                }
                case JOB_FAILED -> {
                    if (job.finish(JobState.JOB_FAILED, status.results(), false)) {
                        log.warn("Job {} failed on backend: {}", job.getHandle().jobId(), status.message());
                    }
                }
                case ABORTED -> job.finish(JobState.ABORTED, status.results(), false);
                default -> schedule(job, nextInterval(currentInterval), context);
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error polling job {}", job.getHandle().jobId(), e);
            job.finish(JobState.JOB_FAILED, List.of(), !job.getBackendState().isTerminal());
        } finally {
            MDC.clear();
        }
    }

    long nextInterval(long currentMillis) {
        return Math.min((long) Math.ceil(currentMillis * backoffMultiplier), maxInterval.toMillis());
    }

    /**
     * Cancellation path of {@link TrackedJob#cancel()}: request backend abort, then verify once.
     */
    void cancelOnBackend(TrackedJob job) {
        String jobId = job.getHandle().jobId();
        try {
            boolean accepted = executor.cancelJob(job.getHandle());
            log.info("Cancel requested for job {} (accepted: {})", jobId, accepted);
        } catch (RuntimeException e) {
            log.warn("Cancel request for job {} failed: {}", jobId, e.getMessage());
        }
        try {
            JobStatus last = executor.pollJob(job.getHandle());
            job.observed(last.state());
            // results of a job that completed before the abort still describe committed rows
            job.finish(JobState.ABORTED, last.state() == JobState.JOB_COMPLETE ? last.results() : List.of(),
                    !last.state().isTerminal());
            log.info("Job {} aborted locally; backend reports {}", jobId, last.state());
        } catch (RuntimeException e) {
            log.warn("Verification poll for cancelled job {} failed: {}", jobId, e.getMessage());
            job.finish(JobState.ABORTED, List.of(), true);
        }
    }

    private static Map<String, String> mdc() {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return context == null ? Map.of() : context;
    }
}
