package com.bulkops.model;

import lombok.Builder;

import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Recipe for synthetic records of one object.
 *
 * @param objectName           object to generate
 * @param schema               object metadata
 * @param valueRules           per-field value generators taking the record ordinal
 * @param relationshipBindings parent field name to a supplier of an already created parent id
 * @param edgeCases            edge-case injection fractions
 * @param batchBoundary        backend batch-processing boundary, null for the registry default
 * @param seed                 random seed, generation is deterministic for a given seed
 */
@Builder
public record FactorySpec(
    String objectName,
    ObjectSchema schema,
    Map<String, IntFunction<Object>> valueRules,
    Map<String, Supplier<Optional<String>>> relationshipBindings,
    EdgeCaseOptions edgeCases,
    Integer batchBoundary,
    long seed
) {
    public FactorySpec {
        valueRules = valueRules == null ? Map.of() : Map.copyOf(valueRules);
        relationshipBindings = relationshipBindings == null ? Map.of() : Map.copyOf(relationshipBindings);
        edgeCases = edgeCases == null ? EdgeCaseOptions.NONE : edgeCases;
    }
}
