package com.bulkops.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;

import java.util.List;
import java.util.concurrent.*;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ContextConfiguration(classes = {ExecutorConfig.class})
class ExecutorConfigTest {

    @Autowired
    @Qualifier("batchExecutor")
    private ExecutorService batchExecutor;

    @Autowired
    @Qualifier("rowExecutor")
    private ExecutorService rowExecutor;

    @Autowired
    @Qualifier("jobPollScheduler")
    private ScheduledExecutorService jobPollScheduler;

    @BeforeEach
    void setUp() {
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void shouldPropagateOperationIdToBatchExecutor() throws Exception {
        String operationId = OperationContext.ensureOperation();

        Future<String> future = batchExecutor.submit(() -> MDC.get(OperationContext.OPERATION_ID));

        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(operationId);
    }

    @Test
    void shouldPropagateBatchIdToRowExecutorWithRunAsync() throws Exception {
        OperationContext.ensureOperation();
        OperationContext.enterBatch(7);

        CompletableFuture<String> seen = new CompletableFuture<>();
        CompletableFuture.runAsync(() -> seen.complete(MDC.get(OperationContext.BATCH_ID)), rowExecutor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen.get()).isEqualTo("7");
    }

    @Test
    void shouldPropagateMdcWithInvokeAll() throws Exception {
        String operationId = OperationContext.ensureOperation();

        List<Callable<String>> tasks = IntStream.range(0, 5)
                .mapToObj(i -> (Callable<String>) () -> MDC.get(OperationContext.OPERATION_ID))
                .toList();
        List<Future<String>> futures = rowExecutor.invokeAll(tasks, 5, TimeUnit.SECONDS);

        for (Future<String> future : futures) {
            assertThat(future.get()).isEqualTo(operationId);
        }
    }

    @Test
    void shouldClearMdcOnWorkerAfterTask() throws Exception {
        OperationContext.ensureOperation();
        batchExecutor.submit(() -> MDC.get(OperationContext.OPERATION_ID)).get(5, TimeUnit.SECONDS);
        OperationContext.clear();

        // the worker must not carry the previous task's context
        List<Future<String>> leftovers = batchExecutor.invokeAll(IntStream.range(0, 8)
                .mapToObj(i -> (Callable<String>) () -> MDC.get(OperationContext.OPERATION_ID))
                .toList());

        for (Future<String> leftover : leftovers) {
            assertThat(leftover.get()).isNull();
        }
    }

    @Test
    void shouldRunScheduledPolls() throws Exception {
        ScheduledFuture<String> scheduled = jobPollScheduler.schedule(() -> "polled", 10, TimeUnit.MILLISECONDS);

        assertThat(scheduled.get(5, TimeUnit.SECONDS)).isEqualTo("polled");
    }
}
