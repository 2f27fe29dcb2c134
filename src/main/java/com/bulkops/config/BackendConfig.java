package com.bulkops.config;

import com.bulkops.backend.inmemory.InMemoryBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Backend wiring.
 * The in-memory backend is active unless app.backend.in-memory.enabled=false,
 * in which case a backend integration must contribute its own
 * BackendExecutor and SchemaProvider beans.
 */
@Configuration
@Slf4j
public class BackendConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "app.backend.in-memory.enabled", havingValue = "true", matchIfMissing = true)
    public InMemoryBackend inMemoryBackend(Clock clock) {
        log.warn("Using IN-MEMORY backend: data is not persisted");
        return new InMemoryBackend(clock);
    }
}
