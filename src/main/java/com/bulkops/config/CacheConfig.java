package com.bulkops.config;

import com.bulkops.model.JobPollResult;
import com.bulkops.model.ObjectSchema;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine cache configuration.
 * 
 * Two caches:
 * 1. SCHEMA CACHE - Object descriptions from the metadata capability
 *    - TTL: 30 minutes (metadata changes are rare within a session)
 * 
 * 2. JOB ARCHIVE - Terminal bulk jobs, keyed by job id
 *    - Lets callers look up or re-poll jobs after the operation returned
 *    - TTL: 24 hours
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.cache.schema.max-size:500}")
    private int schemaMaxSize;

    @Value("${app.cache.schema.ttl-minutes:30}")
    private int schemaTtlMinutes;

    @Value("${app.cache.jobs.max-size:10000}")
    private int jobsMaxSize;

    @Value("${app.cache.jobs.ttl-minutes:1440}")
    private int jobsTtlMinutes;

    @Bean
    public Cache<String, ObjectSchema> schemaCache() {
        log.info("Creating schema cache: maxSize={}, ttl={}m", schemaMaxSize, schemaTtlMinutes);
        return Caffeine.newBuilder()
                .maximumSize(schemaMaxSize)
                .expireAfterWrite(Duration.ofMinutes(schemaTtlMinutes))
                .recordStats()
                .build();
    }

    @Bean
    public Cache<String, JobPollResult> jobArchiveCache() {
        log.info("Creating job archive cache: maxSize={}, ttl={}m", jobsMaxSize, jobsTtlMinutes);
        return Caffeine.newBuilder()
                .maximumSize(jobsMaxSize)
                .expireAfterWrite(Duration.ofMinutes(jobsTtlMinutes))
                .recordStats()
                .build();
    }
}
