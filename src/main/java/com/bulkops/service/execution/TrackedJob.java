package com.bulkops.service.execution;

import com.bulkops.model.JobHandle;
import com.bulkops.model.JobPollResult;
import com.bulkops.model.JobState;
import com.bulkops.model.RowOutcome;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A job being polled. Local state follows
 * QUEUED → IN_PROGRESS → {JOB_COMPLETE | JOB_FAILED | ABORTED}; the result future completes
 * exactly once, when the local state becomes terminal.
 */
public final class TrackedJob {

    private final JobHandle handle;
    private final Deadline deadline;
    private final CompletableFuture<JobPollResult> result = new CompletableFuture<>();
    private final JobPoller poller;

    private JobState localState = JobState.QUEUED;
    private JobState backendState = JobState.QUEUED;
    private int polls;
    private ScheduledFuture<?> nextPoll;

    TrackedJob(JobHandle handle, Deadline deadline, JobPoller poller) {
        this.handle = handle;
        this.deadline = deadline;
        this.poller = poller;
    }

    public JobHandle getHandle() {
        return handle;
    }

    public synchronized JobState getLocalState() {
        return localState;
    }

    public synchronized JobState getBackendState() {
        return backendState;
    }

    public synchronized int getPolls() {
        return polls;
    }

    public CompletableFuture<JobPollResult> future() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Block the calling thread until the job reaches a local terminal state.
     * Cancels the job if the result does not arrive within the deadline plus {@code grace}.
     */
    public JobPollResult await(long graceMillis) throws InterruptedException {
        try {
            return result.get(deadline.remainingMillis() + graceMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return cancel();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Polling of job " + handle.jobId() + " failed", e.getCause());
        }
    }

    /**
     * Stop polling and report ABORTED. Backend cancellation is requested and then verified
     * with one last poll; the result tells whether the backend may still be running.
     */
    public JobPollResult cancel() {
        synchronized (this) {
            if (result.isDone()) {
                return result.join();
            }
            if (nextPoll != null) {
                nextPoll.cancel(false);
            }
        }
        poller.cancelOnBackend(this);
        return result.join();
    }

    // ═══════════════════════════════════════════════════════════════
    // STATE TRANSITIONS (called by JobPoller)
    // ═══════════════════════════════════════════════════════════════

    synchronized void acknowledge() {
        if (localState == JobState.QUEUED) {
            localState = JobState.IN_PROGRESS;
        }
    }

    synchronized void observed(JobState state) {
        polls++;
        backendState = state;
    }

    synchronized void scheduled(ScheduledFuture<?> future) {
        this.nextPoll = future;
    }

    Deadline deadline() {
        return deadline;
    }

    /**
     * @return true if this call made the job terminal
     */
    synchronized boolean finish(JobState terminal, List<RowOutcome> results, boolean backendStillRunning) {
        if (result.isDone()) {
            return false;
        }
        localState = terminal;
        return result.complete(new JobPollResult(handle, terminal, results, backendState, backendStillRunning, polls));
    }
}
