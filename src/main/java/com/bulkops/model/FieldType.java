package com.bulkops.model;

/**
 * Field data types exposed by the remote platform's object metadata.
 */
public enum FieldType {
    STRING,
    TEXTAREA,
    EMAIL,
    PHONE,
    URL,
    INTEGER,
    DOUBLE,
    CURRENCY,
    PERCENT,
    BOOLEAN,
    DATE,
    DATETIME,
    PICKLIST,
    REFERENCE,
    ID;

    public boolean isText() {
        return this == STRING || this == TEXTAREA || this == EMAIL || this == PHONE || this == URL;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == DOUBLE || this == CURRENCY || this == PERCENT;
    }
}
