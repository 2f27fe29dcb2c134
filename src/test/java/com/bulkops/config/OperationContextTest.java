package com.bulkops.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;

class OperationContextTest {

    @BeforeEach
    void before() {
        OperationContext.clear();
    }

    @AfterEach
    void after() {
        OperationContext.clear();
    }

    @Test
    void ensureOperation_createsIdOnceAndReusesIt() {
        String first = OperationContext.ensureOperation();
        String second = OperationContext.ensureOperation();

        assertThat(first).hasSize(16).matches("[0-9a-f]+");
        assertThat(second).isEqualTo(first);
        assertThat(MDC.get(OperationContext.OPERATION_ID)).isEqualTo(first);
    }

    @Test
    void enterAndLeaveBatch_onlyTouchBatchId() {
        String operationId = OperationContext.ensureOperation();

        OperationContext.enterBatch(3);
        assertThat(MDC.get(OperationContext.BATCH_ID)).isEqualTo("3");

        OperationContext.leaveBatch();
        assertThat(MDC.get(OperationContext.BATCH_ID)).isNull();
        assertThat(MDC.get(OperationContext.OPERATION_ID)).isEqualTo(operationId);
    }
}
