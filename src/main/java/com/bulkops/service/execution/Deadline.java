package com.bulkops.service.execution;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Point in monotonic time after which a blocking wait gives up.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    private final long expiresAtNanos;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration timeout) {
        long now = System.nanoTime();
        long nanos = timeout.toNanos();
        // saturate instead of overflowing for very long budgets
        return new Deadline(nanos > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + nanos);
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return expiresAtNanos != Long.MAX_VALUE && System.nanoTime() - expiresAtNanos >= 0;
    }

    public Duration remaining() {
        if (expiresAtNanos == Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.max(0, expiresAtNanos - System.nanoTime()));
    }

    public long remainingMillis() {
        return TimeUnit.NANOSECONDS.toMillis(remaining().toNanos());
    }

    /** The earlier of this deadline and one {@code timeout} from now. */
    public Deadline min(Duration timeout) {
        Deadline other = after(timeout);
        return other.expiresAtNanos - expiresAtNanos < 0 ? other : this;
    }
}
