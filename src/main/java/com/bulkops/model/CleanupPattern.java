package com.bulkops.model;

import java.time.Instant;

/**
 * Selector for out-of-band cleanup of records created by earlier operations.
 */
public record CleanupPattern(
    Strategy strategy,
    String objectName,
    String fieldName,
    String namePattern,
    Instant createdFrom,
    Instant createdTo
) {
    public enum Strategy {
        BY_TRACKED_IDS,
        BY_NAME_PATTERN,
        BY_CREATED_WINDOW
    }

    public static CleanupPattern trackedIds(String objectName) {
        return new CleanupPattern(Strategy.BY_TRACKED_IDS, objectName, null, null, null, null);
    }

    public static CleanupPattern namePattern(String objectName, String fieldName, String pattern) {
        return new CleanupPattern(Strategy.BY_NAME_PATTERN, objectName, fieldName, pattern, null, null);
    }

    public static CleanupPattern createdWindow(String objectName, Instant from, Instant to) {
        return new CleanupPattern(Strategy.BY_CREATED_WINDOW, objectName, null, null, from, to);
    }
}
