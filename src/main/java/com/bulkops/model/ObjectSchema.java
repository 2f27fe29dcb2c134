package com.bulkops.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Describes an object of the remote platform: its name and ordered fields.
 * Supplied by a {@link com.bulkops.backend.SchemaProvider}; immutable per operation.
 */
public record ObjectSchema(String name, List<FieldDescriptor> fields) {

    /** Every object carries a platform-assigned identifier. */
    public static final String ID_FIELD = "Id";

    public ObjectSchema {
        fields = List.copyOf(fields);
    }

    public Optional<FieldDescriptor> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public boolean hasField(String fieldName) {
        return ID_FIELD.equals(fieldName) || field(fieldName).isPresent();
    }

    public List<FieldDescriptor> requiredFields() {
        return fields.stream().filter(FieldDescriptor::required).toList();
    }

    public Map<String, FieldDescriptor> fieldsByName() {
        Map<String, FieldDescriptor> byName = new LinkedHashMap<>();
        fields.forEach(f -> byName.put(f.name(), f));
        return byName;
    }
}
