package com.bulkops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bulk Data Operation Orchestrator.
 *
 * Runs against the in-memory backend unless app.backend.in-memory.enabled=false
 * and another BackendExecutor / SchemaProvider pair is on the classpath.
 */
@SpringBootApplication
public class BulkDataOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulkDataOrchestratorApplication.class, args);
    }
}
