package com.bulkops;

import com.bulkops.backend.BackendExecutor;
import com.bulkops.backend.inmemory.InMemoryBackend;
import com.bulkops.model.ObjectSchema;
import com.bulkops.model.OperationIntent;
import com.bulkops.model.OperationReport;
import com.bulkops.service.BulkOperationOrchestrator;
import com.github.benmanes.caffeine.cache.Cache;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full application context on the in-memory backend.
 */
@SpringBootTest
class BulkDataOrchestratorApplicationTest {

    @Autowired
    private BulkOperationOrchestrator orchestrator;

    @Autowired
    private BackendExecutor backendExecutor;

    @Autowired
    private InMemoryBackend backend;

    @Autowired
    @Qualifier("schemaCache")
    private Cache<String, ObjectSchema> schemaCache;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Should wire the orchestrator against the in-memory backend and run an insert")
    void shouldRunInsertThroughWiredContext() {
        // Given
        backend.registerSchema(TestSchemas.widget());
        OperationIntent intent = OperationIntent.builder()
                .kind("insert")
                .objectName("Widget")
                .records(TestSchemas.widgets(3))
                .purpose("Smoke test Widget insert")
                .build();

        // When
        OperationReport report = orchestrator.execute(intent);

        // Then
        assertThat(backendExecutor).isSameAs(backend);
        assertThat(report.counts().created()).isEqualTo(3);
        assertThat(schemaCache.getIfPresent("Widget")).isNotNull();
        assertThat(meterRegistry.get("bulkops.rows.succeeded").counter().count()).isGreaterThanOrEqualTo(3.0);
    }
}
