package com.bulkops.model;

import java.util.List;

/**
 * Everything an executed plan produced; input to post-execution scoring.
 *
 * @param inputCount        records in the plan
 * @param batchResults      one result per executed batch
 * @param traces            traces recorded by this operation
 * @param cleanupPredicates generated cleanup predicates, empty when not requested
 * @param rollbackMarker    marker taken before the first batch
 * @param queriedCount      rows read by QUERY/BULK_EXPORT plans
 */
public record OperationOutcome(
    int inputCount,
    List<BatchResult> batchResults,
    List<RecordTrace> traces,
    List<CleanupPredicate> cleanupPredicates,
    RollbackMarker rollbackMarker,
    long queriedCount
) {
    public OperationOutcome {
        batchResults = List.copyOf(batchResults);
        traces = List.copyOf(traces);
        cleanupPredicates = List.copyOf(cleanupPredicates);
    }

    public List<RowOutcome> rows() {
        return batchResults.stream().flatMap(b -> b.rows().stream()).toList();
    }

    public RecordCounts counts() {
        return RecordCounts.from(rows(), queriedCount);
    }
}
