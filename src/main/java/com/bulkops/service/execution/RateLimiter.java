package com.bulkops.service.execution;

import com.bulkops.exception.OperationTimedOutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token bucket shared by every batch of every operation.
 *
 * Two quotas:
 * 1. Outstanding calls - a fair semaphore sized to the backend's concurrent-request limit.
 *    A permit is held for the duration of one backend call.
 * 2. Calls per time window (optional) - tokens refill continuously at
 *    callsPerWindow / window and are consumed on acquisition.
 *
 * Exceeding either quota blocks the caller until a token frees up or its deadline passes.
 */
@Component
@Slf4j
public class RateLimiter {

    private final Semaphore outstanding;
    private final int maxConcurrent;
    private final int callsPerWindow;
    private final long refillNanosPerToken;
    private final Sleeper sleeper;

    private double windowTokens;
    private long lastRefillNanos;

    @Autowired
    public RateLimiter(
            @Value("${app.rate-limit.max-concurrent:25}") int maxConcurrent,
            @Value("${app.rate-limit.calls-per-window:0}") int callsPerWindow,
            @Value("${app.rate-limit.window:PT24H}") Duration window) {
        this(maxConcurrent, callsPerWindow, window, Sleeper.THREAD);
    }

    public RateLimiter(int maxConcurrent, int callsPerWindow, Duration window, Sleeper sleeper) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        this.outstanding = new Semaphore(maxConcurrent, true);
        this.maxConcurrent = maxConcurrent;
        this.callsPerWindow = Math.max(0, callsPerWindow);
        this.refillNanosPerToken = this.callsPerWindow > 0 ? Math.max(1, window.toNanos() / this.callsPerWindow) : 0;
        this.windowTokens = this.callsPerWindow;
        this.lastRefillNanos = System.nanoTime();
        this.sleeper = sleeper;
        log.info("RateLimiter initialized: maxConcurrent={}, callsPerWindow={}, window={}",
                maxConcurrent, this.callsPerWindow, window);
    }

    /**
     * Block until both quotas allow one more call.
     *
     * @return permit to close once the call finished
     * @throws OperationTimedOutException if the deadline passes first
     */
    public Permit acquire(Deadline deadline) {
        acquireWindowToken(deadline);
        try {
            long waitNanos = deadline.remaining().toNanos();
            if (!outstanding.tryAcquire(waitNanos, TimeUnit.NANOSECONDS)) {
                throw new OperationTimedOutException("Timed out waiting for a backend call slot ("
                        + maxConcurrent + " outstanding)");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimedOutException("Interrupted waiting for a backend call slot");
        }
        return new Permit();
    }

    public int availablePermits() {
        return outstanding.availablePermits();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public synchronized long availableWindowTokens() {
        if (callsPerWindow == 0) {
            return Long.MAX_VALUE;
        }
        refill();
        return (long) windowTokens;
    }

    private void acquireWindowToken(Deadline deadline) {
        if (callsPerWindow == 0) {
            return;
        }
        while (true) {
            long waitNanos;
            synchronized (this) {
                refill();
                if (windowTokens >= 1) {
                    windowTokens -= 1;
                    return;
                }
                waitNanos = (long) ((1 - windowTokens) * refillNanosPerToken);
            }
            if (deadline.remaining().toNanos() < waitNanos) {
                throw new OperationTimedOutException("Call quota of " + callsPerWindow
                        + " per window exhausted; next token after deadline");
            }
            try {
                sleeper.sleep(Math.max(1, TimeUnit.NANOSECONDS.toMillis(waitNanos)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationTimedOutException("Interrupted waiting for a call-quota token");
            }
        }
    }

    private void refill() {
        long now = System.nanoTime();
        double earned = (double) (now - lastRefillNanos) / refillNanosPerToken;
        if (earned > 0) {
            windowTokens = Math.min(callsPerWindow, windowTokens + earned);
            lastRefillNanos = now;
        }
    }

    /**
     * One outstanding call. Closing twice releases once.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                outstanding.release();
            }
        }
    }
}
