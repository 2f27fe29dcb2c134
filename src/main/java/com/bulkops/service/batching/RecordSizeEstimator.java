package com.bulkops.service.batching;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Estimates the serialized size of a record as its JSON length in bytes plus a fixed per-row overhead.
 */
@Component
public class RecordSizeEstimator {

    private final ObjectMapper objectMapper;
    private final int rowOverheadBytes;

    public RecordSizeEstimator(
            ObjectMapper objectMapper,
            @Value("${app.batch.row-overhead-bytes:2}") int rowOverheadBytes) {
        this.objectMapper = objectMapper;
        this.rowOverheadBytes = rowOverheadBytes;
    }

    public long estimate(Map<String, Object> record) {
        try {
            return objectMapper.writeValueAsBytes(record).length + (long) rowOverheadBytes;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }
}
