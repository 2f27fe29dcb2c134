package com.bulkops.backend;

import com.bulkops.exception.CapabilityNotSupportedException;
import com.bulkops.model.JobHandle;
import com.bulkops.model.JobStatus;
import com.bulkops.model.OperationKind;
import com.bulkops.model.RecordTrace;
import com.bulkops.model.RowOutcome;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Execution capability supplied by the backend-integration layer.
 * Authentication, target selection and wire encoding live behind this interface.
 * <p>
 * Row-level failures are returned as {@link RowOutcome}s. Failures of a call as a whole
 * are thrown as {@link com.bulkops.exception.BackendCallException}.
 */
public interface BackendExecutor {

    /**
     * Apply one operation to one record.
     *
     * @param operation       INSERT, UPDATE, DELETE or UPSERT
     * @param objectName      target object
     * @param externalIdField matching field for UPSERT, null otherwise
     * @param record          field values; must contain {@code Id} for UPDATE and DELETE
     * @return the outcome, with index 0
     */
    RowOutcome runSingle(OperationKind operation, String objectName, String externalIdField,
                         Map<String, Object> record);

    /**
     * Submit records as one asynchronous job.
     *
     * @return handle used to poll the job
     */
    JobHandle submitJob(OperationKind operation, String objectName, String externalIdField,
                        List<Map<String, Object>> records);

    JobStatus pollJob(JobHandle handle);

    /**
     * Ask the backend to abort a job.
     *
     * @return true if the backend accepted the request, which does not guarantee the job stopped
     */
    boolean cancelJob(JobHandle handle);

    /**
     * Run a query. The stream is lazy and finite; callers must close it.
     */
    Stream<Map<String, Object>> runQuery(String queryText);

    default boolean supportsSavepoints() {
        return false;
    }

    /**
     * @return savepoint id
     */
    default String setSavepoint() {
        throw new CapabilityNotSupportedException("savepoint");
    }

    default void rollbackToSavepoint(String savepointId) {
        throw new CapabilityNotSupportedException("savepoint");
    }

    /**
     * Discard a savepoint that will not be rolled back to. Unknown ids are ignored.
     */
    default void releaseSavepoint(String savepointId) {
        throw new CapabilityNotSupportedException("savepoint");
    }

    /**
     * Undo a deletion or an update using backend-held history (recycle bin, before-image).
     * A missing record is reported with {@link com.bulkops.model.ErrorCode#NOT_FOUND}.
     */
    default RowOutcome restore(RecordTrace trace) {
        throw new CapabilityNotSupportedException("restore");
    }
}
