package com.bulkops.model;

import java.util.Locale;

/**
 * Kinds of operations the orchestrator can plan.
 */
public enum OperationKind {
    QUERY,
    INSERT,
    UPDATE,
    DELETE,
    UPSERT,
    BULK_IMPORT,
    BULK_EXPORT,
    TREE_IMPORT;

    /**
     * Parse a loosely spelled kind: "upsert", "Bulk Import", "bulk-import", "BulkImport".
     *
     * @throws IllegalArgumentException if the text names no known kind
     */
    public static OperationKind normalize(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Operation kind is required");
        }
        String compact = text.trim().replaceAll("[\\s_\\-]", "").toUpperCase(Locale.ROOT);
        for (OperationKind kind : values()) {
            if (kind.name().replace("_", "").equals(compact)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation kind: " + text);
    }

    public boolean isRead() {
        return this == QUERY || this == BULK_EXPORT;
    }

    public boolean createsRecords() {
        return this == INSERT || this == UPSERT || this == BULK_IMPORT || this == TREE_IMPORT;
    }

    public boolean requiresId() {
        return this == UPDATE || this == DELETE;
    }

    /** Kinds that always travel as asynchronous jobs. */
    public boolean forcesBulk() {
        return this == BULK_IMPORT || this == TREE_IMPORT || this == BULK_EXPORT;
    }

    /** The mutation actually sent to the backend for each row. */
    public OperationKind rowOperation() {
        return switch (this) {
            case BULK_IMPORT, TREE_IMPORT -> INSERT;
            case BULK_EXPORT -> QUERY;
            default -> this;
        };
    }
}
