package com.bulkops.model;

/**
 * Why test data is generated; drives the default record count.
 */
public enum GenerationPurpose {
    GENERAL,
    /** Must cross the backend's internal batch boundary so bulk-processing logic runs. */
    BULK_PROCESSING
}
