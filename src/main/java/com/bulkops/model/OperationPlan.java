package com.bulkops.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, normalized plan produced by the request planner.
 * Immutable once handed to the batcher.
 *
 * Carries the schema it was validated against, so scoring never looks the object up again,
 * and the id of the operation that executes it, so every committed row is traced to its owner.
 */
public record OperationPlan(
    OperationKind kind,
    String objectName,
    List<Map<String, Object>> records,
    String queryText,
    String externalIdField,
    int chunkSizeHint,
    int recordCount,
    String purpose,
    boolean bulkTriggerTest,
    boolean generateCleanup,
    boolean rollbackOnFailure,
    ObjectSchema schema,
    String operationId
) {
    public OperationPlan {
        records = records.stream()
                .map(r -> Collections.unmodifiableMap(new LinkedHashMap<>(r)))
                .toList();
    }

    public OperationPlan(OperationKind kind, String objectName, List<Map<String, Object>> records, String queryText,
                         String externalIdField, int chunkSizeHint, int recordCount, String purpose,
                         boolean bulkTriggerTest, boolean generateCleanup, boolean rollbackOnFailure) {
        this(kind, objectName, records, queryText, externalIdField, chunkSizeHint, recordCount, purpose,
                bulkTriggerTest, generateCleanup, rollbackOnFailure, null, null);
    }

    public boolean hasQuery() {
        return queryText != null && !queryText.isBlank();
    }

    public boolean hasPurpose() {
        return purpose != null && !purpose.isBlank();
    }

    /** Same plan carrying the given records, used when test data is generated after planning. */
    public OperationPlan withRecords(List<Map<String, Object>> generated) {
        return new OperationPlan(kind, objectName, generated, queryText, externalIdField, chunkSizeHint,
                generated.size(), purpose, bulkTriggerTest, generateCleanup, rollbackOnFailure, schema, operationId);
    }

    public OperationPlan withOperation(String id) {
        return new OperationPlan(kind, objectName, records, queryText, externalIdField, chunkSizeHint,
                recordCount, purpose, bulkTriggerTest, generateCleanup, rollbackOnFailure, schema, id);
    }

    public OperationPlan withSchema(ObjectSchema described) {
        return new OperationPlan(kind, objectName, records, queryText, externalIdField, chunkSizeHint,
                recordCount, purpose, bulkTriggerTest, generateCleanup, rollbackOnFailure, described, operationId);
    }
}
