package com.bulkops.model;

/**
 * Per-call quota for a single batch.
 */
public record BatchLimits(int maxRowsPerBatch, long maxBytesPerBatch) {}
