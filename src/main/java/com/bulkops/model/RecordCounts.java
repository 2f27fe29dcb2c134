package com.bulkops.model;

import java.util.Collection;

/**
 * Exact per-action row counts of an operation.
 */
public record RecordCounts(long created, long updated, long deleted, long failed, long queried) {

    public static RecordCounts from(Collection<RowOutcome> rows, long queried) {
        long created = 0;
        long updated = 0;
        long deleted = 0;
        long failed = 0;
        for (RowOutcome row : rows) {
            if (!row.success()) {
                failed++;
                continue;
            }
            switch (row.action()) {
                case CREATED -> created++;
                case UPDATED, RESTORED -> updated++;
                case DELETED -> deleted++;
                case NONE -> { }
            }
        }
        return new RecordCounts(created, updated, deleted, failed, queried);
    }

    public long mutated() {
        return created + updated + deleted;
    }

    public long total() {
        return created + updated + deleted + failed;
    }
}
