package com.bulkops.model;

/**
 * Lifecycle of an asynchronous bulk job.
 * <pre>
 * QUEUED --submit ack--> IN_PROGRESS --poll:success--> JOB_COMPLETE
 *                        IN_PROGRESS --poll:failure--> JOB_FAILED
 * any     --timeout/cancel--> ABORTED
 * </pre>
 */
public enum JobState {
    QUEUED,
    IN_PROGRESS,
    JOB_COMPLETE,
    JOB_FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == JOB_COMPLETE || this == JOB_FAILED || this == ABORTED;
    }
}
