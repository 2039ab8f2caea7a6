package io.optracker.tracker;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lets one caller through per interval and counts the ones it turned away.
 */
class WarningThrottle {
    static final long SUPPRESSED = -1;

    private final long intervalNanos;
    private final AtomicLong nextAllowedNanos = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong(0);

    WarningThrottle(long interval, TimeUnit unit) {
        this.intervalNanos = unit.toNanos(interval);
    }

    /**
     * Returns how many calls were suppressed since the last one let through, or {@link #SUPPRESSED} if this
     * call falls inside the current interval.
     */
    long tryAcquire() {
        long now = System.nanoTime();
        while (true) {
            long next = nextAllowedNanos.get();
            if (next != Long.MIN_VALUE && now - next < 0) {
                suppressed.incrementAndGet();
                return SUPPRESSED;
            }
            if (nextAllowedNanos.compareAndSet(next, now + intervalNanos)) {
                return suppressed.getAndSet(0);
            }
        }
    }
}
