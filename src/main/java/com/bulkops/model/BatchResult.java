package com.bulkops.model;

import java.util.List;

/**
 * Merged row outcomes of one batch, ordered by plan index.
 *
 * @param sequence            batch sequence within the plan
 * @param mode                mode actually used
 * @param rows                one outcome per record of the batch
 * @param retries             retries spent by this batch
 * @param jobId               last bulk job id, null for synchronous batches
 * @param jobState            final local job state, null for synchronous batches
 * @param backendStillRunning true when a job was abandoned locally but may still run remotely
 */
public record BatchResult(
    int sequence,
    ExecutionMode mode,
    List<RowOutcome> rows,
    int retries,
    String jobId,
    JobState jobState,
    boolean backendStillRunning
) {
    public BatchResult {
        rows = List.copyOf(rows);
    }

    public long successCount() {
        return rows.stream().filter(RowOutcome::success).count();
    }

    public long failureCount() {
        return rows.size() - successCount();
    }

    public boolean isPartialFailure() {
        long failures = failureCount();
        return failures > 0 && failures < rows.size();
    }

    public boolean isAborted() {
        return jobState == JobState.ABORTED
                || rows.stream().anyMatch(r -> r.errorCode() == ErrorCode.TIMED_OUT || r.errorCode() == ErrorCode.ABORTED);
    }
}
