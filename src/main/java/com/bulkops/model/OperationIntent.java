package com.bulkops.model;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * A caller's request before validation. Replaces interactive question-and-answer
 * with a single configuration object handed to the planner.
 *
 * @param kind             loosely spelled operation kind, see {@link OperationKind#normalize}
 * @param objectName       target object
 * @param records          candidate records, may be empty for queries or generated test data
 * @param queryText        query for QUERY/BULK_EXPORT
 * @param externalIdField  matching field for UPSERT
 * @param chunkSizeHint    preferred rows per batch, null for the configured default
 * @param count            requested record count for generated data, null when unspecified
 * @param purpose          free-text statement of why the operation runs
 * @param bulkTriggerTest  true when the operation exists to exercise bulk-processing logic
 * @param generateCleanup  produce cleanup predicates after execution
 * @param rollbackOnFailure roll back to the operation's marker when any row fails
 */
@Builder(toBuilder = true)
public record OperationIntent(
    String kind,
    String objectName,
    List<Map<String, Object>> records,
    String queryText,
    String externalIdField,
    Integer chunkSizeHint,
    Integer count,
    String purpose,
    boolean bulkTriggerTest,
    boolean generateCleanup,
    boolean rollbackOnFailure
) {
    public OperationIntent {
        records = records == null ? List.of() : records;
    }
}
