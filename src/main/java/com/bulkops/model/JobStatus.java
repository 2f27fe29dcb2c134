package com.bulkops.model;

import java.util.List;

/**
 * Backend answer to a poll. Results are only present once the job is terminal;
 * their indexes are positions within the submitted batch.
 */
public record JobStatus(JobState state, List<RowOutcome> results, String message) {

    public JobStatus {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static JobStatus of(JobState state) {
        return new JobStatus(state, List.of(), null);
    }
}
