package com.bulkops.model;

import java.time.Instant;
import java.util.List;

/**
 * The single persisted artifact of an orchestrated operation.
 */
public record OperationReport(
    String operationId,
    OperationKind operationKind,
    String objectName,
    RecordCounts counts,
    List<String> sampleRecordIds,
    ScoreReport preExecutionScore,
    ScoreReport scoreReport,
    List<CleanupPredicate> cleanupPredicates,
    RollbackMarker rollbackMarker,
    boolean rolledBack,
    List<FailedRow> failedRows,
    List<String> abortedJobIds,
    Instant completedAt
) {
    public OperationReport {
        sampleRecordIds = List.copyOf(sampleRecordIds);
        cleanupPredicates = List.copyOf(cleanupPredicates);
        failedRows = List.copyOf(failedRows);
        abortedJobIds = List.copyOf(abortedJobIds);
    }
}
