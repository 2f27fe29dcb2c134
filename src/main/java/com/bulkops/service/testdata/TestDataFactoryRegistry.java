package com.bulkops.service.testdata;

import com.bulkops.exception.MissingRequiredFieldException;
import com.bulkops.exception.UnresolvedRelationshipException;
import com.bulkops.model.EdgeCaseOptions;
import com.bulkops.model.FactorySpec;
import com.bulkops.model.FieldDescriptor;
import com.bulkops.model.FieldType;
import com.bulkops.model.GenerationPurpose;
import com.bulkops.model.ObjectSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Registry of per-object factories for synthetic record sets.
 *
 * Generated records always carry every schema-required field. Relationship fields take
 * their value from the factory's parent-id supplier. A configured fraction of records gets
 * edge-case values. Output is identical for identical spec, seed and count.
 */
@Service
@Slf4j
public class TestDataFactoryRegistry {

    /** Records generated when neither a count nor a bulk-processing purpose is given. */
    static final int DEFAULT_GENERAL_COUNT = 1;

    private final FieldValueGenerator generator;
    private final int defaultBatchBoundary;
    private final Map<String, FactorySpec> specs = new ConcurrentHashMap<>();

    public TestDataFactoryRegistry(
            FieldValueGenerator generator,
            @Value("${app.planner.batch-boundary:250}") int defaultBatchBoundary) {
        this.generator = generator;
        this.defaultBatchBoundary = defaultBatchBoundary;
    }

    public void register(FactorySpec spec) {
        if (spec.schema() == null || !spec.schema().name().equals(spec.objectName())) {
            throw new IllegalArgumentException("Factory for " + spec.objectName() + " needs the schema of that object");
        }
        FactorySpec previous = specs.put(spec.objectName(), spec);
        log.info("{} factory for {} ({} value rules, {} relationship bindings)",
                previous == null ? "Registered" : "Replaced", spec.objectName(),
                spec.valueRules().size(), spec.relationshipBindings().size());
    }

    public Optional<FactorySpec> factoryFor(String objectName) {
        return Optional.ofNullable(specs.get(objectName));
    }

    public boolean isRegistered(String objectName) {
        return specs.containsKey(objectName);
    }

    /**
     * Generate with the factory registered for {@code objectName}.
     *
     * @throws IllegalArgumentException if no factory is registered for the object
     */
    public List<Map<String, Object>> generate(String objectName, Integer count, GenerationPurpose purpose) {
        FactorySpec spec = factoryFor(objectName)
                .orElseThrow(() -> new IllegalArgumentException("No test data factory registered for " + objectName));
        return generate(spec, count, purpose);
    }

    /**
     * @param count   records to generate; null resolves to one above the batch boundary for
     *                {@link GenerationPurpose#BULK_PROCESSING}
     * @throws UnresolvedRelationshipException if a required parent is not available
     * @throws MissingRequiredFieldException   if no value can be produced for a required field
     */
    public List<Map<String, Object>> generate(FactorySpec spec, Integer count, GenerationPurpose purpose) {
        int total = resolveCount(spec, count, purpose);
        Random random = new Random(spec.seed());
        EdgeCaseOptions edgeCases = spec.edgeCases();
        ObjectSchema schema = spec.schema();

        List<Map<String, Object>> records = new ArrayList<>(total);
        int edgeCaseRecords = 0;
        for (int ordinal = 0; ordinal < total; ordinal++) {
            // always draw all three so later records do not depend on which toggles are set
            boolean nullOptional = random.nextDouble() < edgeCases.nullOptionalFraction();
            boolean boundaryString = random.nextDouble() < edgeCases.boundaryStringFraction();
            boolean outOfRange = random.nextDouble() < edgeCases.outOfRangeFraction();
            if (nullOptional || boundaryString || outOfRange) {
                edgeCaseRecords++;
            }

            Map<String, Object> record = new LinkedHashMap<>();
            for (FieldDescriptor field : schema.fields()) {
                if (field.type() == FieldType.ID || ObjectSchema.ID_FIELD.equals(field.name())) {
                    continue;
                }
                if (field.relationship()) {
                    bindParent(spec, field, record);
                    continue;
                }
                if (!field.required() && nullOptional) {
                    record.put(field.name(), null);
                    continue;
                }
                IntFunction<Object> rule = spec.valueRules().get(field.name());
                Object value = rule != null
                        ? rule.apply(ordinal)
                        : generator.generate(spec.objectName(), field, ordinal, random, boundaryString, outOfRange);
                if (value == null && field.required()) {
                    // e.g. a picklist without values, or a reference not flagged as a relationship
                    throw new MissingRequiredFieldException(spec.objectName(), field.name(), ordinal);
                }
                record.put(field.name(), value);
            }
            records.add(record);
        }

        log.info("Generated {} {} record(s) for {} ({} with edge cases, seed {})",
                total, spec.objectName(), purpose, edgeCaseRecords, spec.seed());
        return records;
    }

    int resolveCount(FactorySpec spec, Integer count, GenerationPurpose purpose) {
        if (count != null) {
            if (count < 0) {
                throw new IllegalArgumentException("Count must not be negative: " + count);
            }
            return count;
        }
        if (purpose == GenerationPurpose.BULK_PROCESSING) {
            int boundary = spec.batchBoundary() != null ? spec.batchBoundary() : defaultBatchBoundary;
            return boundary + 1;
        }
        return DEFAULT_GENERAL_COUNT;
    }

    private static void bindParent(FactorySpec spec, FieldDescriptor field, Map<String, Object> record) {
        Supplier<Optional<String>> binding = spec.relationshipBindings().get(field.name());
        Optional<String> parentId = binding == null ? Optional.empty() : binding.get();
        if (parentId.isPresent()) {
            record.put(field.name(), parentId.get());
        } else if (field.required()) {
            throw new UnresolvedRelationshipException(spec.objectName(), field.name(), field.relatedObject());
        }
    }
}
