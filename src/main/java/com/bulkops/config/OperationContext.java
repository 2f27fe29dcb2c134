package com.bulkops.config;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Logging context for orchestrated operations.
 * Puts the operation id and the current batch id into the MDC so every log line,
 * including those from worker threads, can be correlated.
 */
public final class OperationContext {

    public static final String OPERATION_ID = "operationId";
    public static final String BATCH_ID = "batchId";

    private OperationContext() {}

    /**
     * Reuse the operation id already in the MDC or start a new one.
     */
    public static String ensureOperation() {
        String operationId = MDC.get(OPERATION_ID);
        if (operationId == null || operationId.isEmpty()) {
            operationId = generateOperationId();
            MDC.put(OPERATION_ID, operationId);
        }
        return operationId;
    }

    /**
     * @return the operation id in the MDC, null outside an operation
     */
    public static String currentOperation() {
        String operationId = MDC.get(OPERATION_ID);
        return operationId == null || operationId.isEmpty() ? null : operationId;
    }

    public static void enterBatch(int sequence) {
        MDC.put(BATCH_ID, String.valueOf(sequence));
    }

    public static void leaveBatch() {
        MDC.remove(BATCH_ID);
    }

    public static String generateOperationId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static void clear() {
        MDC.remove(OPERATION_ID);
        MDC.remove(BATCH_ID);
    }
}
