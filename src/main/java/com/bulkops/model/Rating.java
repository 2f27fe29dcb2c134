package com.bulkops.model;

/**
 * Reporting bands for a score total. Never used to block execution.
 */
public enum Rating {
    EXCELLENT(117),
    VERY_GOOD(104),
    GOOD(91),
    NEEDS_WORK(78),
    CRITICAL(0);

    private final int threshold;

    Rating(int threshold) {
        this.threshold = threshold;
    }

    public int threshold() {
        return threshold;
    }

    public static Rating forTotal(int total) {
        for (Rating rating : values()) {
            if (total >= rating.threshold) {
                return rating;
            }
        }
        return CRITICAL;
    }
}
