package com.bulkops.model;

/**
 * How a batch is sent to the backend.
 */
public enum ExecutionMode {
    /** Synchronous below the configured threshold, bulk job otherwise. */
    AUTO,
    /** One call per record. */
    SYNCHRONOUS,
    /** The whole batch as one asynchronous job. */
    BULK
}
