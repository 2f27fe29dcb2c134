package com.bulkops.service.batching;

import com.bulkops.exception.LimitConfigurationException;
import com.bulkops.model.Batch;
import com.bulkops.model.BatchLimits;
import com.bulkops.model.OperationPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Splits a plan's records into batches that respect per-call row and byte quotas.
 *
 * Greedy first fit: records are added to the current batch until the next one would
 * break either limit, then a new batch starts. A record is never split.
 * The returned sequence is lazy and restartable: each {@code iterator()} call
 * regenerates the same batches from the immutable plan.
 */
@Component
@Slf4j
public class LimitAwareBatcher {

    private final RecordSizeEstimator estimator;
    private final BatchLimits defaultLimits;

    public LimitAwareBatcher(
            RecordSizeEstimator estimator,
            @Value("${app.batch.max-rows:10000}") int maxRows,
            @Value("${app.batch.max-bytes:10485760}") long maxBytes) {
        this.estimator = estimator;
        this.defaultLimits = new BatchLimits(maxRows, maxBytes);
        log.info("LimitAwareBatcher initialized with maxRows: {}, maxBytes: {}", maxRows, maxBytes);
    }

    public BatchLimits defaultLimits() {
        return defaultLimits;
    }

    public Iterable<Batch> split(OperationPlan plan, BatchLimits limits) {
        return split(plan, limits, 0, 0);
    }

    public Iterable<Batch> split(OperationPlan plan, BatchLimits limits, int startIndex) {
        return split(plan, limits, startIndex, 0);
    }

    /**
     * @param startIndex    plan index of the first record to batch, used to resume past an oversized record
     * @param firstSequence sequence number given to the first batch
     * @throws LimitConfigurationException immediately for non-positive limits; from the iterator
     *                                     when it reaches a record larger than {@code maxBytesPerBatch}
     */
    public Iterable<Batch> split(OperationPlan plan, BatchLimits limits, int startIndex, int firstSequence) {
        if (limits.maxRowsPerBatch() <= 0 || limits.maxBytesPerBatch() <= 0) {
            throw new LimitConfigurationException("Batch limits must be positive: " + limits);
        }
        if (startIndex < 0 || startIndex > plan.records().size()) {
            throw new IllegalArgumentException("Start index " + startIndex + " outside plan of "
                    + plan.records().size() + " records");
        }
        int rowLimit = Math.min(limits.maxRowsPerBatch(), plan.chunkSizeHint());
        long byteLimit = limits.maxBytesPerBatch();
        return () -> new BatchIterator(plan.records(), rowLimit, byteLimit, startIndex, firstSequence);
    }

    private final class BatchIterator implements Iterator<Batch> {

        private final List<Map<String, Object>> records;
        private final int rowLimit;
        private final long byteLimit;
        private int position;
        private int sequence;

        BatchIterator(List<Map<String, Object>> records, int rowLimit, long byteLimit, int startIndex, int firstSequence) {
            this.records = records;
            this.rowLimit = rowLimit;
            this.byteLimit = byteLimit;
            this.position = startIndex;
            this.sequence = firstSequence;
        }

        @Override
        public boolean hasNext() {
            return position < records.size();
        }

        @Override
        public Batch next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int first = position;
            List<Map<String, Object>> slice = new ArrayList<>();
            long bytes = 0;
            while (position < records.size() && slice.size() < rowLimit) {
                long size = estimator.estimate(records.get(position));
                if (size > byteLimit) {
                    if (!slice.isEmpty()) {
                        // close what we have; the next call reports the oversized record
                        break;
                    }
                    throw new LimitConfigurationException("Record " + position + " is estimated at " + size
                            + " bytes, above the per-batch limit of " + byteLimit, position);
                }
                if (bytes + size > byteLimit) {
                    break;
                }
                slice.add(records.get(position));
                bytes += size;
                position++;
            }
            return new Batch(sequence++, first, slice, bytes);
        }
    }
}
