package com.bulkops.exception;

import com.bulkops.model.ErrorCode;
import com.bulkops.model.RecordTrace;

import java.util.List;
import java.util.Map;

/**
 * One or more compensating actions failed. Lists every trace that could not be undone.
 */
public class RollbackException extends BulkOperationException {

    private final transient Map<RecordTrace, String> failures;
    private final transient List<RecordTrace> compensated;

    public RollbackException(Map<RecordTrace, String> failures, List<RecordTrace> compensated) {
        super(ErrorCode.UNEXPECTED, failures.size() + " trace(s) could not be rolled back; "
                + compensated.size() + " compensated");
        this.failures = Map.copyOf(failures);
        this.compensated = List.copyOf(compensated);
    }

    /**
     * @return trace to failure reason for every trace left in place
     */
    public Map<RecordTrace, String> getFailures() {
        return failures;
    }

    public List<RecordTrace> getFailedTraces() {
        return failures.keySet().stream()
                .sorted((a, b) -> Long.compare(b.sequence(), a.sequence()))
                .toList();
    }

    public List<RecordTrace> getCompensated() {
        return compensated;
    }
}
