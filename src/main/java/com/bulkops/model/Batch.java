package com.bulkops.model;

import java.util.List;
import java.util.Map;

/**
 * Ordered, contiguous slice of a plan's records.
 *
 * @param sequence       zero-based position of the batch within its plan
 * @param firstIndex     plan index of the first record in this batch
 * @param records        the records
 * @param estimatedBytes estimated serialized size of all records
 */
public record Batch(int sequence, int firstIndex, List<Map<String, Object>> records, long estimatedBytes) {

    public Batch {
        records = List.copyOf(records);
    }

    public int rowCount() {
        return records.size();
    }

    /** Plan index of the record at the given batch position. */
    public int planIndex(int position) {
        return firstIndex + position;
    }
}
