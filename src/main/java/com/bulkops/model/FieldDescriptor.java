package com.bulkops.model;

import java.util.List;

/**
 * Metadata for a single field of an object.
 *
 * @param name           API name of the field
 * @param type           data type
 * @param required       whether inserts must supply a value
 * @param picklistValues allowed values for PICKLIST fields, empty otherwise
 * @param relationship   true for lookup/master-detail fields
 * @param relatedObject  parent object name for relationship fields, null otherwise
 * @param length         maximum length for text fields, 0 when not applicable
 * @param externalId     true when the field is flagged as an external id
 */
public record FieldDescriptor(
    String name,
    FieldType type,
    boolean required,
    List<String> picklistValues,
    boolean relationship,
    String relatedObject,
    int length,
    boolean externalId
) {
    public FieldDescriptor {
        picklistValues = picklistValues == null ? List.of() : List.copyOf(picklistValues);
    }

    public static FieldDescriptor text(String name, boolean required, int length) {
        return new FieldDescriptor(name, FieldType.STRING, required, List.of(), false, null, length, false);
    }

    public static FieldDescriptor of(String name, FieldType type, boolean required) {
        return new FieldDescriptor(name, type, required, List.of(), false, null, type.isText() ? 255 : 0, false);
    }

    public static FieldDescriptor picklist(String name, boolean required, List<String> values) {
        return new FieldDescriptor(name, FieldType.PICKLIST, required, values, false, null, 255, false);
    }

    public static FieldDescriptor reference(String name, boolean required, String relatedObject) {
        return new FieldDescriptor(name, FieldType.REFERENCE, required, List.of(), true, relatedObject, 18, false);
    }

    public static FieldDescriptor externalId(String name, int length) {
        return new FieldDescriptor(name, FieldType.STRING, false, List.of(), false, null, length, true);
    }
}
