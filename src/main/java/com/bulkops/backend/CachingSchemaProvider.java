package com.bulkops.backend;

import com.bulkops.config.AppMetrics;
import com.bulkops.model.ObjectSchema;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Cache-aside wrapper in front of the external {@link SchemaProvider}.
 * Metadata rarely changes within a session, so each object is described once per TTL.
 */
@Service
@Slf4j
public class CachingSchemaProvider {

    private final SchemaProvider delegate;
    private final Cache<String, ObjectSchema> schemaCache;
    private final AppMetrics metrics;

    public CachingSchemaProvider(SchemaProvider delegate,
                                 @Qualifier("schemaCache") Cache<String, ObjectSchema> schemaCache,
                                 AppMetrics metrics) {
        this.delegate = delegate;
        this.schemaCache = schemaCache;
        this.metrics = metrics;
    }

    public ObjectSchema describeObject(String objectName) {
        ObjectSchema cached = schemaCache.getIfPresent(objectName);
        if (cached != null) {
            metrics.incrementSchemaCacheHits();
            return cached;
        }
        metrics.incrementSchemaCacheMisses();
        log.debug("Describing object {} (cache miss)", objectName);
        ObjectSchema schema = delegate.describeObject(objectName);
        schemaCache.put(objectName, schema);
        return schema;
    }

    public void evict(String objectName) {
        schemaCache.invalidate(objectName);
    }
}
