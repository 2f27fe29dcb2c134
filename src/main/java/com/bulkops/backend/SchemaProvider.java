package com.bulkops.backend;

import com.bulkops.model.ObjectSchema;

/**
 * Metadata capability. Implementations throw
 * {@link com.bulkops.exception.SchemaMismatchException} for unknown objects.
 */
@FunctionalInterface
public interface SchemaProvider {

    ObjectSchema describeObject(String objectName);
}
