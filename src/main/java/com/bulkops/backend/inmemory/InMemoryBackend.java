package com.bulkops.backend.inmemory;

import com.bulkops.backend.BackendExecutor;
import com.bulkops.backend.SchemaProvider;
import com.bulkops.exception.BackendCallException;
import com.bulkops.exception.SchemaMismatchException;
import com.bulkops.model.CommitAction;
import com.bulkops.model.ErrorCode;
import com.bulkops.model.FieldDescriptor;
import com.bulkops.model.JobHandle;
import com.bulkops.model.JobState;
import com.bulkops.model.JobStatus;
import com.bulkops.model.ObjectSchema;
import com.bulkops.model.OperationKind;
import com.bulkops.model.RecordTrace;
import com.bulkops.model.RowOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * In-memory implementation of the backend capabilities for dry runs and tests.
 * Thread-safe: every public method holds the instance monitor.
 * <p>
 * Behaves like a record-oriented platform: generated ids, required-field and reference
 * validation, external-id uniqueness, recycle bin for deletes, before-images for updates,
 * savepoints, asynchronous jobs that finish after a configurable number of polls,
 * and programmable faults. Data is lost when the application stops.
 */
@Slf4j
public class InMemoryBackend implements BackendExecutor, SchemaProvider {

    private static final Pattern FROM_CLAUSE = Pattern.compile("\\bFROM\\s+(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIMIT_CLAUSE = Pattern.compile("\\bLIMIT\\s+(\\d+)", Pattern.CASE_INSENSITIVE);

    private final Clock clock;
    private final Map<String, ObjectSchema> schemas = new HashMap<>();
    private final Map<String, Map<String, Map<String, Object>>> liveRecords = new HashMap<>();
    private final Map<String, Map<String, Object>> recycleBin = new HashMap<>();
    private final Map<String, Deque<Map<String, Object>>> beforeImages = new HashMap<>();
    private final Map<String, JobRun> jobs = new HashMap<>();
    private final Map<String, Snapshot> savepoints = new LinkedHashMap<>();
    private final AtomicLong idSequence = new AtomicLong(1);
    private final AtomicLong jobSequence = new AtomicLong(1);
    private final AtomicLong savepointSequence = new AtomicLong(1);
    private final AtomicLong mutations = new AtomicLong();

    // ═══════════════════════════════════════════════════════════════
    // FAULT INJECTION
    // ═══════════════════════════════════════════════════════════════

    private final List<RowRejection> rowRejections = new ArrayList<>();
    private ErrorCode transientRowCode = ErrorCode.RATE_LIMITED;
    private int transientRowFailures;
    private ErrorCode submissionCode = ErrorCode.TRANSIENT_UNAVAILABLE;
    private int submissionFailures;
    private int queryFailures;
    private int jobLatencyPolls = 1;
    private boolean stallJobs;
    private boolean honorCancel = true;
    private String failJobsMessage;

    public InMemoryBackend(Clock clock) {
        this.clock = clock;
    }

    public synchronized InMemoryBackend registerSchema(ObjectSchema schema) {
        schemas.put(schema.name(), schema);
        liveRecords.computeIfAbsent(schema.name(), k -> new LinkedHashMap<>());
        return this;
    }

    @Override
    public synchronized ObjectSchema describeObject(String objectName) {
        ObjectSchema schema = schemas.get(objectName);
        if (schema == null) {
            throw new SchemaMismatchException("Unknown object: " + objectName, null);
        }
        return schema;
    }

    /** Reject every row matching the predicate with a non-retryable code. */
    public synchronized void rejectWhen(Predicate<Map<String, Object>> matcher, ErrorCode code) {
        rowRejections.add(new RowRejection(matcher, code));
    }

    /** Fail the next {@code times} row applications (synchronous or inside jobs) with the given code. */
    public synchronized void failNextRows(ErrorCode code, int times) {
        this.transientRowCode = code;
        this.transientRowFailures = times;
    }

    /** Throw from the next {@code times} job submissions. */
    public synchronized void failNextSubmissions(ErrorCode code, int times) {
        this.submissionCode = code;
        this.submissionFailures = times;
    }

    public synchronized void failNextQueries(int times) {
        this.queryFailures = times;
    }

    /** Polls a job needs after the first one before it completes. */
    public synchronized void setJobLatencyPolls(int polls) {
        this.jobLatencyPolls = polls;
    }

    /** Jobs stay IN_PROGRESS forever. */
    public synchronized void setStallJobs(boolean stall) {
        this.stallJobs = stall;
    }

    /** When false, cancel requests are acknowledged but ignored. */
    public synchronized void setHonorCancel(boolean honor) {
        this.honorCancel = honor;
    }

    /** Every job ends JOB_FAILED with this message; null restores normal behavior. */
    public synchronized void setFailJobs(String message) {
        this.failJobsMessage = message;
    }

    // ═══════════════════════════════════════════════════════════════
    // SYNCHRONOUS CALLS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public synchronized RowOutcome runSingle(OperationKind operation, String objectName, String externalIdField,
                                             Map<String, Object> record) {
        return apply(operation, objectName, externalIdField, record, 0);
    }

    @Override
    public synchronized Stream<Map<String, Object>> runQuery(String queryText) {
        if (queryFailures > 0) {
            queryFailures--;
            throw new BackendCallException(ErrorCode.TRANSIENT_UNAVAILABLE, "Query service unavailable");
        }
        Matcher from = FROM_CLAUSE.matcher(queryText);
        if (!from.find()) {
            throw new BackendCallException(ErrorCode.VALIDATION_FAILED, "Malformed query: " + queryText);
        }
        String objectName = from.group(1);
        Map<String, Map<String, Object>> rows = liveRecords.getOrDefault(objectName, Map.of());
        List<Map<String, Object>> copy = rows.values().stream().map(r -> (Map<String, Object>) new LinkedHashMap<>(r)).toList();
        Matcher limit = LIMIT_CLAUSE.matcher(queryText);
        Stream<Map<String, Object>> stream = copy.stream();
        return limit.find() ? stream.limit(Long.parseLong(limit.group(1))) : stream;
    }

    // ═══════════════════════════════════════════════════════════════
    // ASYNCHRONOUS JOBS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public synchronized JobHandle submitJob(OperationKind operation, String objectName, String externalIdField,
                                            List<Map<String, Object>> records) {
        if (submissionFailures > 0) {
            submissionFailures--;
            throw new BackendCallException(submissionCode, "Job submission rejected: " + submissionCode);
        }
        String jobId = "750" + String.format("%012d", jobSequence.getAndIncrement());
        JobHandle handle = new JobHandle(jobId, objectName, operation, records.size());
        jobs.put(jobId, new JobRun(handle, externalIdField, List.copyOf(records)));
        log.debug("Job {} queued: {} {} rows on {}", jobId, operation, records.size(), objectName);
        return handle;
    }

    @Override
    public synchronized JobStatus pollJob(JobHandle handle) {
        JobRun run = jobs.get(handle.jobId());
        if (run == null) {
            throw new BackendCallException(ErrorCode.NOT_FOUND, "Unknown job " + handle.jobId());
        }
        if (run.state.isTerminal()) {
            return new JobStatus(run.state, run.results, run.message);
        }
        run.polls++;
        if (run.state == JobState.QUEUED) {
            run.state = JobState.IN_PROGRESS;
            return JobStatus.of(run.state);
        }
        if (stallJobs || run.polls <= jobLatencyPolls) {
            return JobStatus.of(run.state);
        }
        if (failJobsMessage != null) {
            run.state = JobState.JOB_FAILED;
            run.message = failJobsMessage;
            return new JobStatus(run.state, List.of(), run.message);
        }
        List<RowOutcome> results = new ArrayList<>(run.records.size());
        for (int i = 0; i < run.records.size(); i++) {
            results.add(apply(run.handle.kind(), run.handle.objectName(), run.externalIdField, run.records.get(i), i));
        }
        run.results = List.copyOf(results);
        run.state = JobState.JOB_COMPLETE;
        return new JobStatus(run.state, run.results, null);
    }

    @Override
    public synchronized boolean cancelJob(JobHandle handle) {
        JobRun run = jobs.get(handle.jobId());
        if (run == null || run.state.isTerminal()) {
            return false;
        }
        if (honorCancel) {
            run.state = JobState.ABORTED;
            run.message = "Aborted by request";
        }
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // SAVEPOINTS AND RESTORE
    // ═══════════════════════════════════════════════════════════════

    @Override
    public boolean supportsSavepoints() {
        return true;
    }

    @Override
    public synchronized String setSavepoint() {
        String id = "sp-" + savepointSequence.getAndIncrement();
        savepoints.put(id, new Snapshot(deepCopy(liveRecords), copyRecords(recycleBin), copyImages(beforeImages)));
        return id;
    }

    @Override
    public synchronized void rollbackToSavepoint(String savepointId) {
        Snapshot snapshot = savepoints.get(savepointId);
        if (snapshot == null) {
            throw new BackendCallException(ErrorCode.NOT_FOUND, "Unknown savepoint " + savepointId);
        }
        liveRecords.clear();
        liveRecords.putAll(deepCopy(snapshot.live()));
        recycleBin.clear();
        recycleBin.putAll(copyRecords(snapshot.recycleBin()));
        beforeImages.clear();
        beforeImages.putAll(copyImages(snapshot.beforeImages()));
        // later savepoints no longer describe reachable states
        boolean after = false;
        for (var it = savepoints.keySet().iterator(); it.hasNext(); ) {
            String key = it.next();
            if (after) {
                it.remove();
            }
            after = after || key.equals(savepointId);
        }
        mutations.incrementAndGet();
        log.debug("Rolled back to savepoint {}", savepointId);
    }

    @Override
    public synchronized void releaseSavepoint(String savepointId) {
        if (savepoints.remove(savepointId) != null) {
            log.debug("Released savepoint {}", savepointId);
        }
    }

    public synchronized int savepointCount() {
        return savepoints.size();
    }

    @Override
    public synchronized RowOutcome restore(RecordTrace trace) {
        Map<String, Map<String, Object>> rows = liveRecords.computeIfAbsent(trace.objectName(), k -> new LinkedHashMap<>());
        String id = trace.recordId();
        if (trace.action() == CommitAction.DELETED) {
            Map<String, Object> deleted = recycleBin.remove(id);
            if (deleted == null) {
                return RowOutcome.failed(0, ErrorCode.NOT_FOUND, "Record " + id + " not in recycle bin");
            }
            rows.put(id, deleted);
            mutations.incrementAndGet();
            return RowOutcome.committed(0, id, CommitAction.RESTORED);
        }
        if (trace.action() == CommitAction.UPDATED) {
            Deque<Map<String, Object>> images = beforeImages.get(id);
            if (images == null || images.isEmpty() || !rows.containsKey(id)) {
                return RowOutcome.failed(0, ErrorCode.NOT_FOUND, "No before-image for record " + id);
            }
            rows.put(id, images.pop());
            mutations.incrementAndGet();
            return RowOutcome.committed(0, id, CommitAction.RESTORED);
        }
        return RowOutcome.failed(0, ErrorCode.VALIDATION_FAILED, "Cannot restore a " + trace.action() + " trace");
    }

    // ═══════════════════════════════════════════════════════════════
    // INSPECTION
    // ═══════════════════════════════════════════════════════════════

    public synchronized int count(String objectName) {
        return liveRecords.getOrDefault(objectName, Map.of()).size();
    }

    public synchronized boolean exists(String objectName, String id) {
        return liveRecords.getOrDefault(objectName, Map.of()).containsKey(id);
    }

    public synchronized Map<String, Object> get(String objectName, String id) {
        Map<String, Object> row = liveRecords.getOrDefault(objectName, Map.of()).get(id);
        return row == null ? null : new LinkedHashMap<>(row);
    }

    /** Number of state changes applied so far. */
    public long mutationCount() {
        return mutations.get();
    }

    // ═══════════════════════════════════════════════════════════════
    // ROW APPLICATION
    // ═══════════════════════════════════════════════════════════════

    private RowOutcome apply(OperationKind operation, String objectName, String externalIdField,
                             Map<String, Object> record, int index) {
        for (RowRejection rejection : rowRejections) {
            if (rejection.matcher().test(record)) {
                return RowOutcome.failed(index, rejection.code(), "Rejected: " + rejection.code());
            }
        }
        if (transientRowFailures > 0) {
            transientRowFailures--;
            return RowOutcome.failed(index, transientRowCode, "Temporarily unable to process: " + transientRowCode);
        }
        Map<String, Map<String, Object>> rows = liveRecords.computeIfAbsent(objectName, k -> new LinkedHashMap<>());
        return switch (operation) {
            case INSERT, BULK_IMPORT, TREE_IMPORT -> insert(objectName, rows, record, index);
            case UPDATE -> update(objectName, rows, record, index);
            case DELETE -> delete(rows, record, index);
            case UPSERT -> upsert(objectName, rows, externalIdField, record, index);
            default -> RowOutcome.failed(index, ErrorCode.VALIDATION_FAILED, "Unsupported row operation " + operation);
        };
    }

    private RowOutcome insert(String objectName, Map<String, Map<String, Object>> rows,
                              Map<String, Object> record, int index) {
        RowOutcome invalid = validate(objectName, rows, record, index, true, null);
        if (invalid != null) {
            return invalid;
        }
        String id = nextId(objectName);
        Map<String, Object> stored = new LinkedHashMap<>(record);
        stored.put(ObjectSchema.ID_FIELD, id);
        stored.put("CreatedDate", clock.instant().toString());
        rows.put(id, stored);
        mutations.incrementAndGet();
        return RowOutcome.committed(index, id, CommitAction.CREATED);
    }

    private RowOutcome update(String objectName, Map<String, Map<String, Object>> rows,
                              Map<String, Object> record, int index) {
        String id = (String) record.get(ObjectSchema.ID_FIELD);
        Map<String, Object> existing = id == null ? null : rows.get(id);
        if (existing == null) {
            return RowOutcome.failed(index, ErrorCode.NOT_FOUND, "No " + objectName + " with Id " + id);
        }
        RowOutcome invalid = validate(objectName, rows, record, index, false, id);
        if (invalid != null) {
            return invalid;
        }
        beforeImages.computeIfAbsent(id, k -> new ArrayDeque<>()).push(new LinkedHashMap<>(existing));
        existing.putAll(record);
        mutations.incrementAndGet();
        return RowOutcome.committed(index, id, CommitAction.UPDATED);
    }

    private RowOutcome delete(Map<String, Map<String, Object>> rows, Map<String, Object> record, int index) {
        String id = (String) record.get(ObjectSchema.ID_FIELD);
        Map<String, Object> removed = id == null ? null : rows.remove(id);
        if (removed == null) {
            return RowOutcome.failed(index, ErrorCode.NOT_FOUND, "Entity is deleted or does not exist: " + id);
        }
        recycleBin.put(id, removed);
        mutations.incrementAndGet();
        return RowOutcome.committed(index, id, CommitAction.DELETED);
    }

    private RowOutcome upsert(String objectName, Map<String, Map<String, Object>> rows, String externalIdField,
                              Map<String, Object> record, int index) {
        Object key = externalIdField == null ? null : record.get(externalIdField);
        if (key == null) {
            return RowOutcome.failed(index, ErrorCode.VALIDATION_FAILED, "Missing external id " + externalIdField);
        }
        for (Map<String, Object> existing : rows.values()) {
            if (key.equals(existing.get(externalIdField))) {
                String id = (String) existing.get(ObjectSchema.ID_FIELD);
                RowOutcome invalid = validate(objectName, rows, record, index, false, id);
                if (invalid != null) {
                    return invalid;
                }
                beforeImages.computeIfAbsent(id, k -> new ArrayDeque<>()).push(new LinkedHashMap<>(existing));
                existing.putAll(record);
                mutations.incrementAndGet();
                return RowOutcome.committed(index, id, CommitAction.UPDATED);
            }
        }
        return insert(objectName, rows, record, index);
    }

    private RowOutcome validate(String objectName, Map<String, Map<String, Object>> rows,
                                Map<String, Object> record, int index, boolean requireAll, String selfId) {
        ObjectSchema schema = schemas.get(objectName);
        if (schema == null) {
            return null;
        }
        for (FieldDescriptor field : schema.fields()) {
            Object value = record.get(field.name());
            if (requireAll && field.required() && value == null) {
                return RowOutcome.failed(index, ErrorCode.VALIDATION_FAILED, "Required fields are missing: [" + field.name() + "]");
            }
            if (value != null && field.relationship() && field.relatedObject() != null
                    && !liveRecords.getOrDefault(field.relatedObject(), Map.of()).containsKey(String.valueOf(value))) {
                return RowOutcome.failed(index, ErrorCode.INVALID_REFERENCE,
                        "Invalid reference " + field.name() + "=" + value);
            }
            if (value != null && field.externalId()) {
                for (Map<String, Object> other : rows.values()) {
                    if (value.equals(other.get(field.name())) && !Objects.equals(selfId, other.get(ObjectSchema.ID_FIELD))) {
                        return RowOutcome.failed(index, ErrorCode.DUPLICATE_VALUE,
                                "Duplicate value found: " + field.name() + "=" + value);
                    }
                }
            }
        }
        return null;
    }

    private String nextId(String objectName) {
        String prefix = (objectName + "xxx").substring(0, 3).toLowerCase(Locale.ROOT);
        return prefix + String.format("%012d", idSequence.getAndIncrement());
    }

    private static Map<String, Map<String, Map<String, Object>>> deepCopy(Map<String, Map<String, Map<String, Object>>> source) {
        Map<String, Map<String, Map<String, Object>>> copy = new HashMap<>();
        source.forEach((object, rows) -> copy.put(object, copyRecords(rows)));
        return copy;
    }

    private static Map<String, Map<String, Object>> copyRecords(Map<String, Map<String, Object>> source) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        source.forEach((id, row) -> copy.put(id, new LinkedHashMap<>(row)));
        return copy;
    }

    private static Map<String, Deque<Map<String, Object>>> copyImages(Map<String, Deque<Map<String, Object>>> source) {
        Map<String, Deque<Map<String, Object>>> copy = new HashMap<>();
        source.forEach((id, images) -> {
            Deque<Map<String, Object>> imagesCopy = new ArrayDeque<>();
            images.forEach(image -> imagesCopy.addLast(new LinkedHashMap<>(image)));
            copy.put(id, imagesCopy);
        });
        return copy;
    }

    private record RowRejection(Predicate<Map<String, Object>> matcher, ErrorCode code) {}

    private record Snapshot(Map<String, Map<String, Map<String, Object>>> live,
                            Map<String, Map<String, Object>> recycleBin,
                            Map<String, Deque<Map<String, Object>>> beforeImages) {}

    private static final class JobRun {
        private final JobHandle handle;
        private final String externalIdField;
        private final List<Map<String, Object>> records;
        private JobState state = JobState.QUEUED;
        private List<RowOutcome> results = List.of();
        private String message;
        private int polls;

        private JobRun(JobHandle handle, String externalIdField, List<Map<String, Object>> records) {
            this.handle = handle;
            this.externalIdField = externalIdField;
            this.records = records;
        }
    }
}
