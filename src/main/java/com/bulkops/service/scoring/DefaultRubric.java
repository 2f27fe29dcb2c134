package com.bulkops.service.scoring;

import com.bulkops.model.BatchResult;
import com.bulkops.model.ErrorCode;
import com.bulkops.model.FieldDescriptor;
import com.bulkops.model.ObjectSchema;
import com.bulkops.model.OperationKind;
import com.bulkops.model.OperationOutcome;
import com.bulkops.model.OperationPlan;
import com.bulkops.model.RowOutcome;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import static com.bulkops.model.RubricCategory.BULK_SAFETY;
import static com.bulkops.model.RubricCategory.CLEANUP_ISOLATION;
import static com.bulkops.model.RubricCategory.DATA_INTEGRITY;
import static com.bulkops.model.RubricCategory.DOCUMENTATION;
import static com.bulkops.model.RubricCategory.QUERY_EFFICIENCY;
import static com.bulkops.model.RubricCategory.SECURITY;
import static com.bulkops.model.RubricCategory.TEST_COVERAGE;
import static com.bulkops.service.scoring.ScoringRule.when;

/**
 * The fixed quality rubric. Positive rules of a category add up to exactly its maximum.
 *
 * Rules that need an outcome (BS-03, DI-03, TC-03, CI-03) contribute nothing before execution;
 * CI-01 and CI-02 credit a requested cleanup or rollback until the outcome shows what happened.
 * Every rule reads only the plan and the outcome; schema checks use the schema the plan was validated against.
 */
@Component
public class DefaultRubric {

    private static final Pattern SELECT_ALL = Pattern.compile("(?i)SELECT\\s+\\*|FIELDS\\s*\\(\\s*ALL\\s*\\)");
    private static final Pattern BOUNDED = Pattern.compile("(?i)\\b(WHERE|LIMIT)\\b");
    private static final Pattern LEADING_WILDCARD = Pattern.compile("(?i)\\bLIKE\\s+'%");
    private static final Pattern ACCESS_ENFORCED = Pattern.compile("(?i)\\bWITH\\s+(SECURITY_ENFORCED|USER_MODE)\\b");

    private final int batchBoundary;
    private final int maxRowsPerCall;
    private final SensitiveDataDetector detector;
    private final List<ScoringRule> rules;

    public DefaultRubric(
            @Value("${app.planner.batch-boundary:250}") int batchBoundary,
            @Value("${app.batch.max-rows:10000}") int maxRowsPerCall,
            SensitiveDataDetector detector) {
        this.batchBoundary = batchBoundary;
        this.maxRowsPerCall = maxRowsPerCall;
        this.detector = detector;
        this.rules = List.of(
                // Query efficiency (25)
                when("QE-01", QUERY_EFFICIENCY, 10, "Query selects explicit fields",
                        (plan, outcome) -> !plan.hasQuery() || !SELECT_ALL.matcher(plan.queryText()).find()),
                when("QE-02", QUERY_EFFICIENCY, 8, "Query is bounded by WHERE or LIMIT",
                        (plan, outcome) -> !plan.hasQuery() || isBounded(plan)),
                when("QE-03", QUERY_EFFICIENCY, 7, "Unbounded reads use bulk export",
                        (plan, outcome) -> !(plan.kind() == OperationKind.QUERY && plan.hasQuery() && !isBounded(plan))),
                when("QE-04", QUERY_EFFICIENCY, -10, "Leading-wildcard LIKE defeats indexes",
                        (plan, outcome) -> plan.hasQuery() && LEADING_WILDCARD.matcher(plan.queryText()).find()),

                // Bulk safety (25)
                when("BS-01", BULK_SAFETY, 10, "Chunk size within the per-call row quota",
                        (plan, outcome) -> plan.chunkSizeHint() <= this.maxRowsPerCall),
                when("BS-02", BULK_SAFETY, 8, "Bulk trigger test crosses the batch boundary",
                        (plan, outcome) -> !plan.bulkTriggerTest() || plan.recordCount() > this.batchBoundary),
                when("BS-03", BULK_SAFETY, 7, "No row exhausted its retries",
                        (plan, outcome) -> outcome != null && !hasRowError(outcome, ErrorCode.RETRY_EXHAUSTED)),
                when("BS-04", BULK_SAFETY, -10, "A batch timed out or was aborted",
                        (plan, outcome) -> outcome != null
                                && outcome.batchResults().stream().anyMatch(BatchResult::isAborted)),

                // Data integrity (20)
                when("DI-01", DATA_INTEGRITY, 8, "Every record carries its required fields",
                        (plan, outcome) -> carriesRequiredFields(plan)),
                when("DI-02", DATA_INTEGRITY, 6, "No duplicate records or external ids",
                        (plan, outcome) -> !hasDuplicates(plan)),
                when("DI-03", DATA_INTEGRITY, 6, "No failed rows",
                        (plan, outcome) -> outcome != null && outcome.counts().failed() == 0),
                when("DI-04", DATA_INTEGRITY, -10, "A row referenced a missing parent",
                        (plan, outcome) -> outcome != null && hasRowError(outcome, ErrorCode.INVALID_REFERENCE)),

                // Security (20)
                when("SE-01", SECURITY, 10, "Plan only touches declared fields",
                        (plan, outcome) -> touchesDeclaredFieldsOnly(plan)),
                when("SE-02", SECURITY, 10, "Query enforces field-level access",
                        (plan, outcome) -> !plan.hasQuery() || ACCESS_ENFORCED.matcher(plan.queryText()).find()),
                when("SE-03", SECURITY, -10, "Sensitive data pattern in record values",
                        (plan, outcome) -> containsSensitiveData(plan)),

                // Test coverage (15)
                when("TC-01", TEST_COVERAGE, 5, "Record count crosses the batch boundary",
                        (plan, outcome) -> plan.recordCount() > this.batchBoundary),
                when("TC-02", TEST_COVERAGE, 5, "Record set contains edge-case values",
                        (plan, outcome) -> containsEdgeCases(plan)),
                when("TC-03", TEST_COVERAGE, 5, "Outcome counts reconcile with the input",
                        (plan, outcome) -> outcome != null && reconciles(plan, outcome)),

                // Cleanup and isolation (15)
                when("CI-01", CLEANUP_ISOLATION, 5, "Cleanup predicate generated",
                        (plan, outcome) -> outcome == null ? plan.generateCleanup() : !outcome.cleanupPredicates().isEmpty()),
                when("CI-02", CLEANUP_ISOLATION, 5, "Rollback marker taken",
                        (plan, outcome) -> outcome == null ? plan.rollbackOnFailure() : outcome.rollbackMarker() != null),
                when("CI-03", CLEANUP_ISOLATION, 5, "Every committed row is traced",
                        (plan, outcome) -> outcome != null && outcome.traces().size() == outcome.counts().mutated()),

                // Documentation (10)
                when("DO-01", DOCUMENTATION, 5, "Purpose documented",
                        (plan, outcome) -> plan.hasPurpose()),
                when("DO-02", DOCUMENTATION, 5, "Purpose names the target object",
                        (plan, outcome) -> plan.hasPurpose() && plan.purpose().toLowerCase(Locale.ROOT)
                                .contains(plan.objectName().toLowerCase(Locale.ROOT)))
        );
    }

    public List<ScoringRule> rules() {
        return rules;
    }

    // ═══════════════════════════════════════════════════════════════
    // RULE HELPERS
    // ═══════════════════════════════════════════════════════════════

    private static boolean isBounded(OperationPlan plan) {
        return BOUNDED.matcher(plan.queryText()).find();
    }

    private static boolean hasRowError(OperationOutcome outcome, ErrorCode code) {
        return outcome.rows().stream().anyMatch(r -> r.errorCode() == code);
    }

    private boolean carriesRequiredFields(OperationPlan plan) {
        if (plan.kind().isRead() || plan.kind() == OperationKind.DELETE) {
            return true;
        }
        if (plan.kind().requiresId()) {
            return plan.records().stream().allMatch(r -> present(r.get(ObjectSchema.ID_FIELD)));
        }
        ObjectSchema schema = plan.schema();
        if (schema == null) {
            return false;
        }
        for (FieldDescriptor field : schema.requiredFields()) {
            if (!plan.records().stream().allMatch(r -> present(r.get(field.name())))) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasDuplicates(OperationPlan plan) {
        Set<Map<String, Object>> seenRecords = new HashSet<>();
        Set<Object> seenExternalIds = new HashSet<>();
        for (Map<String, Object> record : plan.records()) {
            if (!seenRecords.add(record)) {
                return true;
            }
            if (plan.externalIdField() != null) {
                Object externalId = record.get(plan.externalIdField());
                if (externalId != null && !seenExternalIds.add(externalId)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean touchesDeclaredFieldsOnly(OperationPlan plan) {
        if (plan.records().isEmpty()) {
            return true;
        }
        ObjectSchema schema = plan.schema();
        return schema != null && plan.records().stream()
                .flatMap(r -> r.keySet().stream())
                .allMatch(schema::hasField);
    }

    private boolean containsSensitiveData(OperationPlan plan) {
        if (plan.hasQuery() && detector.classify(plan.queryText()).isPresent()) {
            return true;
        }
        return plan.records().stream()
                .flatMap(r -> r.values().stream())
                .filter(Objects::nonNull)
                .anyMatch(detector::isSensitive);
    }

    private static boolean containsEdgeCases(OperationPlan plan) {
        return plan.records().stream()
                .flatMap(r -> r.values().stream())
                .anyMatch(v -> v == null || (v instanceof String s && s.isEmpty()));
    }

    private static boolean reconciles(OperationPlan plan, OperationOutcome outcome) {
        if (plan.kind().isRead()) {
            return outcome.rows().isEmpty();
        }
        List<RowOutcome> rows = outcome.rows();
        return outcome.counts().total() == outcome.inputCount() && rows.size() == outcome.inputCount();
    }

    private static boolean present(Object value) {
        return value != null && !(value instanceof String s && s.isBlank());
    }
}
