package com.bulkops.model;

import java.util.List;

/**
 * Local view of a job once polling stopped.
 *
 * @param handle              the job
 * @param state               local state, always terminal
 * @param results             row results as reported by the backend (batch positions)
 * @param backendState        last state observed on the backend
 * @param backendStillRunning true when the job was aborted locally while the backend kept running
 * @param polls               number of polls issued
 */
public record JobPollResult(
    JobHandle handle,
    JobState state,
    List<RowOutcome> results,
    JobState backendState,
    boolean backendStillRunning,
    int polls
) {
    public JobPollResult {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
