package com.bulkops.model;

/**
 * Independently scored dimensions of operation quality and their maxima.
 */
public enum RubricCategory {
    QUERY_EFFICIENCY(25),
    BULK_SAFETY(25),
    DATA_INTEGRITY(20),
    SECURITY(20),
    TEST_COVERAGE(15),
    CLEANUP_ISOLATION(15),
    DOCUMENTATION(10);

    private final int max;

    RubricCategory(int max) {
        this.max = max;
    }

    public int max() {
        return max;
    }

    public int clamp(int points) {
        return Math.max(0, Math.min(max, points));
    }

    public static int totalMax() {
        int total = 0;
        for (RubricCategory category : values()) {
            total += category.max;
        }
        return total;
    }
}
