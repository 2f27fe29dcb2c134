package com.bulkops.service.execution;

import com.bulkops.exception.BackendCallException;
import com.bulkops.exception.OperationTimedOutException;
import com.bulkops.exception.RetryExhaustedException;
import com.bulkops.model.ErrorCode;
import com.bulkops.model.RowOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retry wrapper for rate-limited and transient backend failures.
 * Retries up to {@code maxRetries} times with exponential backoff and jitter:
 * delay = min(base * 2^(attempt-1) + jitter, cap).
 * Non-retryable failures are surfaced on the first attempt.
 */
@Component
@Slf4j
public class RetryPolicy {

    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Sleeper sleeper;

    @Autowired
    public RetryPolicy(
            @Value("${app.execution.max-retries:3}") int maxRetries,
            @Value("${app.execution.retry-base-delay-ms:200}") long baseDelayMs,
            @Value("${app.execution.retry-max-delay-ms:30000}") long maxDelayMs) {
        this(maxRetries, baseDelayMs, maxDelayMs, Sleeper.THREAD);
    }

    public RetryPolicy(int maxRetries, long baseDelayMs, long maxDelayMs, Sleeper sleeper) {
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.sleeper = sleeper;
        log.info("RetryPolicy initialized with maxRetries: {}, baseDelayMs: {}ms, maxDelayMs: {}ms",
                maxRetries, baseDelayMs, maxDelayMs);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Run a whole-call operation, retrying retryable {@link BackendCallException}s.
     *
     * @throws RetryExhaustedException    when retryable failures outlast the retries
     * @throws OperationTimedOutException when the next backoff would pass the deadline
     * @throws BackendCallException       for non-retryable failures, unchanged
     */
    public <T> T call(String operationName, RetryBudget budget, Deadline deadline, Supplier<T> operation) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return operation.get();
            } catch (BackendCallException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt > maxRetries) {
                    log.error("Operation '{}' failed after {} attempts: {}", operationName, attempt, e.getMessage());
                    throw new RetryExhaustedException(operationName, attempt, e.getErrorCode(), e);
                }
                pause(operationName, attempt, e.getErrorCode(), budget, deadline);
            }
        }
    }

    /**
     * Run a per-row call, retrying while the outcome is retryable.
     * Never throws for backend failures: exhaustion yields a RETRY_EXHAUSTED row,
     * a passed deadline a TIMED_OUT row.
     */
    public RowOutcome callRow(String operationName, int index, RetryBudget budget, Deadline deadline,
                              Supplier<RowOutcome> operation) {
        int attempt = 0;
        while (true) {
            attempt++;
            RowOutcome outcome;
            try {
                outcome = operation.get().withIndex(index);
            } catch (BackendCallException e) {
                outcome = RowOutcome.failed(index, e.getErrorCode(), e.getMessage());
            } catch (OperationTimedOutException e) {
                return RowOutcome.failed(index, ErrorCode.TIMED_OUT, e.getMessage());
            }
            if (!outcome.isRetryable()) {
                return outcome;
            }
            if (attempt > maxRetries) {
                log.warn("Row {} of '{}' still {} after {} attempts", index, operationName, outcome.errorCode(), attempt);
                return RowOutcome.failed(index, ErrorCode.RETRY_EXHAUSTED,
                        "Retries exhausted after " + attempt + " attempts, last error " + outcome.errorCode()
                                + ": " + outcome.errorMessage());
            }
            try {
                pause(operationName, attempt, outcome.errorCode(), budget, deadline);
            } catch (OperationTimedOutException e) {
                return RowOutcome.failed(index, ErrorCode.TIMED_OUT, e.getMessage());
            }
        }
    }

    /**
     * Backoff for the given attempt (1-based), jitter included.
     */
    long backoffMillis(int attempt) {
        // exponential backoff: base * 2^(attempt-1)
        long baseDelay = baseDelayMs * (1L << Math.min(attempt - 1, 30));
        long jitter = baseDelay > 0 ? ThreadLocalRandom.current().nextLong(0, Math.min(1000L, baseDelay)) : 0;
        return Math.min(baseDelay + jitter, maxDelayMs);
    }

    void pause(String operationName, int attempt, ErrorCode code, RetryBudget budget, Deadline deadline) {
        long delay = backoffMillis(attempt);
        if (deadline.remainingMillis() < delay) {
            throw new OperationTimedOutException("Deadline passes before retry " + attempt + " of '" + operationName + "'");
        }
        budget.recordRetry();
        log.warn("Operation '{}' {} (attempt {}/{}), retrying in {}ms",
                operationName, code, attempt, maxRetries + 1, delay);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new OperationTimedOutException("Interrupted during backoff of '" + operationName + "'");
        }
    }
}
