package com.bulkops.service.planning;

import com.bulkops.TestSchemas;
import com.bulkops.exception.MissingRequiredFieldException;
import com.bulkops.exception.PlanValidationException;
import com.bulkops.exception.SchemaMismatchException;
import com.bulkops.model.OperationIntent;
import com.bulkops.model.OperationKind;
import com.bulkops.model.OperationPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RequestPlanner.
 *
 * Tests verify:
 * - Loose operation kinds normalize
 * - Unknown fields, missing required fields and bad external ids are rejected with their location
 * - Record counts resolve from the intent
 */
class RequestPlannerTest {

    private RequestPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new RequestPlanner(250, 10_000);
    }

    @Test
    @DisplayName("Should normalize loosely spelled kinds and keep the records")
    void shouldBuildPlan() {
        // Given
        OperationIntent intent = OperationIntent.builder()
                .kind("bulk-import")
                .objectName("Widget")
                .records(TestSchemas.widgets(3))
                .purpose("Load Widget fixtures")
                .build();

        // When
        OperationPlan plan = planner.plan(intent, TestSchemas.widget());

        // Then
        assertThat(plan.kind()).isEqualTo(OperationKind.BULK_IMPORT);
        assertThat(plan.records()).hasSize(3);
        assertThat(plan.recordCount()).isEqualTo(3);
        assertThat(plan.chunkSizeHint()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("Should reject Widget inserts missing Name, naming the field")
    void shouldRejectMissingRequiredField() {
        // Given
        List<Map<String, Object>> records = List.of(
                Map.of("Quantity", 1), Map.of("Quantity", 2), Map.of("Quantity", 3));
        OperationIntent intent = OperationIntent.builder().kind("insert").objectName("Widget").records(records).build();

        // When / Then
        assertThatThrownBy(() -> planner.plan(intent, TestSchemas.widget()))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasMessageContaining("Name")
                .satisfies(e -> {
                    PlanValidationException pve = (PlanValidationException) e;
                    assertThat(pve.getFieldName()).isEqualTo("Name");
                    assertThat(pve.getRecordIndex()).isZero();
                });
    }

    @Test
    @DisplayName("Should treat blank strings as missing")
    void shouldRejectBlankRequiredField() {
        OperationIntent intent = OperationIntent.builder().kind("insert").objectName("Widget")
                .records(List.of(TestSchemas.widget(0), Map.of("Name", "  "))).build();

        assertThatThrownBy(() -> planner.plan(intent, TestSchemas.widget()))
                .isInstanceOf(MissingRequiredFieldException.class)
                .satisfies(e -> assertThat(((PlanValidationException) e).getRecordIndex()).isEqualTo(1));
    }

    @Test
    @DisplayName("Should reject fields the schema does not declare")
    void shouldRejectUnknownField() {
        OperationIntent intent = OperationIntent.builder().kind("insert").objectName("Widget")
                .records(List.of(Map.of("Name", "A", "Colour", "red"))).build();

        assertThatThrownBy(() -> planner.plan(intent, TestSchemas.widget()))
                .isInstanceOf(PlanValidationException.class)
                .satisfies(e -> assertThat(((PlanValidationException) e).getFieldName()).isEqualTo("Colour"));
    }

    @Test
    @DisplayName("Should require an existing, flagged external id for upserts")
    void shouldValidateUpsertExternalId() {
        OperationIntent.OperationIntentBuilder upsert = OperationIntent.builder().kind("upsert").objectName("Widget")
                .records(TestSchemas.widgets(1));

        assertThatThrownBy(() -> planner.plan(upsert.build(), TestSchemas.widget()))
                .isInstanceOf(SchemaMismatchException.class);
        assertThatThrownBy(() -> planner.plan(upsert.externalIdField("Serial__c").build(), TestSchemas.widget()))
                .isInstanceOf(SchemaMismatchException.class);
        assertThatThrownBy(() -> planner.plan(upsert.externalIdField("Name").build(), TestSchemas.widget()))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("not declared");
        assertThat(planner.plan(upsert.externalIdField("Code__c").build(), TestSchemas.widget()).externalIdField())
                .isEqualTo("Code__c");
    }

    @Test
    @DisplayName("Should require Id for updates and deletes")
    void shouldRequireIdForUpdate() {
        OperationIntent intent = OperationIntent.builder().kind("update").objectName("Widget")
                .records(List.of(Map.of("Quantity", 5))).build();

        assertThatThrownBy(() -> planner.plan(intent, TestSchemas.widget()))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasMessageContaining("Id");
    }

    @Test
    @DisplayName("Should require query text for reads")
    void shouldRequireQueryForReads() {
        OperationIntent intent = OperationIntent.builder().kind("query").objectName("Widget").build();

        assertThatThrownBy(() -> planner.plan(intent, TestSchemas.widget()))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("query");
    }

    @Test
    @DisplayName("Should reject unknown kinds, mismatched objects and non-positive chunk sizes")
    void shouldRejectInvalidIntents() {
        OperationIntent base = OperationIntent.builder().kind("insert").objectName("Widget")
                .records(TestSchemas.widgets(1)).build();

        assertThatThrownBy(() -> planner.plan(base.toBuilder().kind("merge").build(), TestSchemas.widget()))
                .isInstanceOf(PlanValidationException.class);
        assertThatThrownBy(() -> planner.plan(base.toBuilder().objectName("Gadget").build(), TestSchemas.widget()))
                .isInstanceOf(PlanValidationException.class);
        assertThatThrownBy(() -> planner.plan(base.toBuilder().chunkSizeHint(0).build(), TestSchemas.widget()))
                .isInstanceOf(PlanValidationException.class);
    }

    @Test
    @DisplayName("Should resolve counts from the intent, the records or the batch boundary")
    void shouldResolveCount() {
        OperationIntent empty = OperationIntent.builder().kind("insert").objectName("Widget").build();

        assertThat(planner.resolveCount(empty.toBuilder().count(12).build())).isEqualTo(12);
        assertThat(planner.resolveCount(empty.toBuilder().records(TestSchemas.widgets(4)).build())).isEqualTo(4);
        assertThat(planner.resolveCount(empty.toBuilder().bulkTriggerTest(true).build())).isEqualTo(251);
        assertThat(planner.resolveCount(empty)).isZero();
    }
}
