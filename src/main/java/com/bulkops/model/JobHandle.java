package com.bulkops.model;

/**
 * Identity of a job submitted to the backend.
 */
public record JobHandle(String jobId, String objectName, OperationKind kind, int rowCount) {}
