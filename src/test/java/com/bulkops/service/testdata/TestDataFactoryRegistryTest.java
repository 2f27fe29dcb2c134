package com.bulkops.service.testdata;

import com.bulkops.TestSchemas;
import com.bulkops.exception.MissingRequiredFieldException;
import com.bulkops.exception.UnresolvedRelationshipException;
import com.bulkops.model.EdgeCaseOptions;
import com.bulkops.model.FactorySpec;
import com.bulkops.model.FieldDescriptor;
import com.bulkops.model.FieldType;
import com.bulkops.model.GenerationPurpose;
import com.bulkops.model.ObjectSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for TestDataFactoryRegistry.
 *
 * Tests verify:
 * - Default counts per generation purpose
 * - Required fields and parent bindings on every record
 * - Reproducible output for a fixed seed
 * - Edge-case injection and per-field value rules
 */
class TestDataFactoryRegistryTest {

    private TestDataFactoryRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TestDataFactoryRegistry(new FieldValueGenerator(), 250);
    }

    @Test
    @DisplayName("Should generate one record past the batch boundary for bulk processing")
    void shouldCrossBatchBoundary() {
        // When
        List<Map<String, Object>> records = registry.generate(widgetSpec(7L), null, GenerationPurpose.BULK_PROCESSING);

        // Then
        assertThat(records).hasSize(251);
        assertThat(records).allSatisfy(r -> assertThat(r.get("Name")).isNotNull());
    }

    @Test
    @DisplayName("Should use the factory's own boundary when one is given")
    void shouldUseSpecBoundary() {
        FactorySpec spec = FactorySpec.builder()
                .objectName(TestSchemas.WIDGET)
                .schema(TestSchemas.widget())
                .batchBoundary(200)
                .build();

        assertThat(registry.generate(spec, null, GenerationPurpose.BULK_PROCESSING)).hasSize(201);
    }

    @Test
    @DisplayName("Should honor explicit counts and default general requests")
    void shouldResolveCounts() {
        FactorySpec spec = widgetSpec(1L);

        assertThat(registry.generate(spec, 5, GenerationPurpose.BULK_PROCESSING)).hasSize(5);
        assertThat(registry.generate(spec, 0, GenerationPurpose.GENERAL)).isEmpty();
        assertThat(registry.generate(spec, null, GenerationPurpose.GENERAL))
                .hasSize(TestDataFactoryRegistry.DEFAULT_GENERAL_COUNT);
        assertThatThrownBy(() -> registry.generate(spec, -1, GenerationPurpose.GENERAL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should produce identical records for the same seed")
    void shouldBeDeterministic() {
        // Given
        EdgeCaseOptions edgeCases = new EdgeCaseOptions(0.2, 0.2, 0.2);
        FactorySpec first = FactorySpec.builder().objectName(TestSchemas.WIDGET).schema(TestSchemas.widget())
                .edgeCases(edgeCases).seed(42L).build();
        FactorySpec second = FactorySpec.builder().objectName(TestSchemas.WIDGET).schema(TestSchemas.widget())
                .edgeCases(edgeCases).seed(42L).build();

        // When / Then
        assertThat(registry.generate(first, 50, GenerationPurpose.GENERAL))
                .isEqualTo(registry.generate(second, 50, GenerationPurpose.GENERAL));
        FactorySpec otherSeed = FactorySpec.builder().objectName(TestSchemas.WIDGET).schema(TestSchemas.widget())
                .edgeCases(edgeCases).seed(43L).build();
        assertThat(registry.generate(first, 50, GenerationPurpose.GENERAL))
                .isNotEqualTo(registry.generate(otherSeed, 50, GenerationPurpose.GENERAL));
    }

    @Test
    @DisplayName("Should bind required parents from the supplier")
    void shouldBindParents() {
        // Given
        Supplier<Optional<String>> parent = () -> Optional.of("001000000000001");
        FactorySpec spec = FactorySpec.builder()
                .objectName(TestSchemas.CONTACT)
                .schema(TestSchemas.contact())
                .relationshipBindings(Map.of("AccountId", parent))
                .build();

        // When
        List<Map<String, Object>> records = registry.generate(spec, 3, GenerationPurpose.GENERAL);

        // Then
        assertThat(records).allSatisfy(r -> assertThat(r)
                .containsEntry("AccountId", "001000000000001")
                .containsKeys("LastName", "Email"));
        assertThat(records.get(2).get("Email")).isEqualTo("user2@example.com");
    }

    @Test
    @DisplayName("Should fail when a required parent is not available")
    void shouldFailOnUnresolvedParent() {
        // Given
        Supplier<Optional<String>> noParent = Optional::empty;
        FactorySpec spec = FactorySpec.builder()
                .objectName(TestSchemas.CONTACT)
                .schema(TestSchemas.contact())
                .relationshipBindings(Map.of("AccountId", noParent))
                .build();

        // When / Then
        assertThatThrownBy(() -> registry.generate(spec, 1, GenerationPurpose.GENERAL))
                .isInstanceOf(UnresolvedRelationshipException.class)
                .hasMessageContaining("Contact.AccountId");
    }

    @Test
    @DisplayName("Should fail when a required field cannot be given a value")
    void shouldFailOnUnfillableRequiredField() {
        // Given
        ObjectSchema emptyPicklist = new ObjectSchema("Gadget", List.of(
                FieldDescriptor.text("Name", true, 80),
                FieldDescriptor.picklist("Tier", true, List.of())));
        ObjectSchema unflaggedReference = new ObjectSchema("Gadget", List.of(
                FieldDescriptor.text("Name", true, 80),
                new FieldDescriptor("OwnerId", FieldType.REFERENCE, true, List.of(), false, null, 18, false)));

        // When / Then
        assertThatThrownBy(() -> registry.generate(
                FactorySpec.builder().objectName("Gadget").schema(emptyPicklist).build(), 2, GenerationPurpose.GENERAL))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasMessageContaining("Tier");
        assertThatThrownBy(() -> registry.generate(
                FactorySpec.builder().objectName("Gadget").schema(unflaggedReference).build(), 2, GenerationPurpose.GENERAL))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasMessageContaining("OwnerId");
    }

    @Test
    @DisplayName("Should apply value rules and edge cases without touching required fields")
    void shouldApplyValueRulesAndEdgeCases() {
        // Given
        Map<String, IntFunction<Object>> rules = Map.of("Code__c", ordinal -> "LOAD-" + ordinal);
        FactorySpec spec = FactorySpec.builder()
                .objectName(TestSchemas.WIDGET)
                .schema(TestSchemas.widget())
                .valueRules(rules)
                .edgeCases(new EdgeCaseOptions(1.0, 1.0, 0))
                .build();

        // When
        List<Map<String, Object>> records = registry.generate(spec, 4, GenerationPurpose.GENERAL);

        // Then
        assertThat(records).allSatisfy(r -> {
            assertThat((String) r.get("Name")).hasSize(80);
            assertThat(r.get("Code__c")).isNull();
            assertThat(r.get("Quantity")).isNull();
        });
        assertThat(registry.generate(widgetSpecWithRules(rules), 2, GenerationPurpose.GENERAL))
                .extracting(r -> r.get("Code__c"))
                .containsExactly("LOAD-0", "LOAD-1");
    }

    @Test
    @DisplayName("Should look up registered factories by object name")
    void shouldGenerateFromRegisteredFactory() {
        // Given
        registry.register(widgetSpec(3L));

        // When / Then
        assertThat(registry.isRegistered(TestSchemas.WIDGET)).isTrue();
        assertThat(registry.generate(TestSchemas.WIDGET, 2, GenerationPurpose.GENERAL)).hasSize(2);
        assertThatThrownBy(() -> registry.generate("Gadget", 2, GenerationPurpose.GENERAL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(FactorySpec.builder()
                .objectName("Gadget").schema(TestSchemas.widget()).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static FactorySpec widgetSpec(long seed) {
        return FactorySpec.builder()
                .objectName(TestSchemas.WIDGET)
                .schema(TestSchemas.widget())
                .seed(seed)
                .build();
    }

    private static FactorySpec widgetSpecWithRules(Map<String, IntFunction<Object>> rules) {
        return FactorySpec.builder()
                .objectName(TestSchemas.WIDGET)
                .schema(TestSchemas.widget())
                .valueRules(rules)
                .build();
    }
}
