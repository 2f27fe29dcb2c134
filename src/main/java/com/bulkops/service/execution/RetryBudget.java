package com.bulkops.service.execution;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retry counter owned by exactly one batch execution.
 */
public final class RetryBudget {

    private final AtomicInteger retries = new AtomicInteger();

    void recordRetry() {
        retries.incrementAndGet();
    }

    public int retries() {
        return retries.get();
    }
}
