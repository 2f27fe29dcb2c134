package com.bulkops.service.planning;

import com.bulkops.exception.MissingRequiredFieldException;
import com.bulkops.exception.PlanValidationException;
import com.bulkops.exception.SchemaMismatchException;
import com.bulkops.model.FieldDescriptor;
import com.bulkops.model.ObjectSchema;
import com.bulkops.model.OperationIntent;
import com.bulkops.model.OperationKind;
import com.bulkops.model.OperationPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Turns an {@link OperationIntent} into a validated, normalized {@link OperationPlan}.
 * Fails fast: any schema violation aborts the operation before a single batch runs.
 */
@Service
@Slf4j
public class RequestPlanner {

    private final int batchBoundary;
    private final int defaultChunkSize;

    public RequestPlanner(
            @Value("${app.planner.batch-boundary:250}") int batchBoundary,
            @Value("${app.batch.max-rows:10000}") int defaultChunkSize) {
        this.batchBoundary = batchBoundary;
        this.defaultChunkSize = defaultChunkSize;
    }

    public int getBatchBoundary() {
        return batchBoundary;
    }

    /**
     * @throws PlanValidationException        unknown field, missing query or invalid kind
     * @throws MissingRequiredFieldException  required field (or {@code Id}) absent
     * @throws SchemaMismatchException        UPSERT without a usable external-id field
     */
    public OperationPlan plan(OperationIntent intent, ObjectSchema schema) {
        OperationKind kind;
        try {
            kind = OperationKind.normalize(intent.kind());
        } catch (IllegalArgumentException e) {
            throw new PlanValidationException(e.getMessage());
        }
        if (intent.objectName() != null && !intent.objectName().equals(schema.name())) {
            throw new PlanValidationException("Intent targets " + intent.objectName()
                    + " but schema describes " + schema.name());
        }
        List<Map<String, Object>> records = intent.records();

        if (kind.isRead()) {
            if (intent.queryText() == null || intent.queryText().isBlank()) {
                throw new PlanValidationException(kind + " requires query text");
            }
        } else {
            validateFields(schema, records);
            if (kind == OperationKind.UPSERT) {
                validateExternalId(schema, intent.externalIdField());
            } else if (intent.externalIdField() != null && !schema.hasField(intent.externalIdField())) {
                throw new PlanValidationException("Unknown external-id field " + intent.externalIdField()
                        + " on " + schema.name(), intent.externalIdField(), -1);
            }
            if (kind.createsRecords()) {
                validateRequired(schema, records);
            }
            if (kind.requiresId()) {
                requireField(schema.name(), records, ObjectSchema.ID_FIELD);
            }
        }

        int chunkSize = intent.chunkSizeHint() == null ? defaultChunkSize : intent.chunkSizeHint();
        if (chunkSize <= 0) {
            throw new PlanValidationException("Chunk size hint must be positive: " + chunkSize);
        }

        OperationPlan plan = new OperationPlan(kind, schema.name(), records, intent.queryText(),
                intent.externalIdField(), chunkSize, resolveCount(intent), intent.purpose(),
                intent.bulkTriggerTest(), intent.generateCleanup(), intent.rollbackOnFailure(), schema, null);
        log.info("Planned {} on {}: {} record(s), chunk size {}, bulk trigger test: {}",
                kind, plan.objectName(), plan.recordCount(), chunkSize, plan.bulkTriggerTest());
        return plan;
    }

    /**
     * Explicit count, else the supplied records, else one above the batch boundary for bulk trigger tests.
     */
    int resolveCount(OperationIntent intent) {
        if (intent.count() != null) {
            if (intent.count() < 0) {
                throw new PlanValidationException("Record count must not be negative: " + intent.count());
            }
            return intent.count();
        }
        if (!intent.records().isEmpty()) {
            return intent.records().size();
        }
        return intent.bulkTriggerTest() ? batchBoundary + 1 : 0;
    }

    private static void validateFields(ObjectSchema schema, List<Map<String, Object>> records) {
        for (int i = 0; i < records.size(); i++) {
            for (String field : records.get(i).keySet()) {
                if (!schema.hasField(field)) {
                    throw new PlanValidationException("Unknown field " + field + " on " + schema.name()
                            + " record " + i, field, i);
                }
            }
        }
    }

    private static void validateRequired(ObjectSchema schema, List<Map<String, Object>> records) {
        for (FieldDescriptor field : schema.requiredFields()) {
            requireField(schema.name(), records, field.name());
        }
    }

    private static void requireField(String objectName, List<Map<String, Object>> records, String field) {
        for (int i = 0; i < records.size(); i++) {
            Object value = records.get(i).get(field);
            if (value == null || (value instanceof String s && s.isBlank())) {
                throw new MissingRequiredFieldException(objectName, field, i);
            }
        }
    }

    private static void validateExternalId(ObjectSchema schema, String externalIdField) {
        if (externalIdField == null || externalIdField.isBlank()) {
            throw new SchemaMismatchException("UPSERT on " + schema.name() + " requires an external-id field", null);
        }
        FieldDescriptor field = schema.field(externalIdField)
                .orElseThrow(() -> new SchemaMismatchException("External-id field " + externalIdField
                        + " does not exist on " + schema.name(), externalIdField));
        if (!field.externalId()) {
            throw new SchemaMismatchException("Field " + externalIdField + " on " + schema.name()
                    + " is not declared as an external id", externalIdField);
        }
    }
}
