package io.optracker.tracker;

import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Preconditions;
import io.optracker.budget.MemoryBudget;
import io.optracker.budget.MemoryLimit;
import io.optracker.core.OperationDriver;
import io.optracker.error.DrainTimeoutException;
import io.optracker.error.OperationRejectedException;
import io.optracker.error.TrackerInvariantError;
import io.optracker.metrics.Metrics;
import io.optracker.metrics.OperationMetrics;
import io.optracker.retry.BackoffPolicy;
import io.optracker.retry.MultiplicativeBackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission control and registry for the mutating operations a partition has in flight.
 *
 * <p>Every successful {@link #add} must be matched by exactly one {@link #release}, usually from a
 * different thread. Admission reserves the operation's memory footprint in the tracker's budget, if
 * memory tracking was started; release credits back exactly what was reserved.
 *
 * <p>The registry lock only guards map operations. Budget, metric and logging calls all happen
 * outside it, so a concurrent {@link #waitForAllToFinish} never blocks producers.
 */
public class OperationTracker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(OperationTracker.class);

    public static final String BUDGET_NAME = "operation_tracker";
    private static final String UNKNOWN_PARTITION = "(unknown)";
    private static final long COMPLAIN_MILLIS = 1000;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, TrackedEntry> pending = new HashMap<>();
    private final BackoffPolicy drainBackoff;
    private final WarningThrottle rejectionWarnings = new WarningThrottle(1, TimeUnit.SECONDS);

    private volatile OperationMetrics metrics;
    private volatile MemoryBudget budget;
    private volatile boolean memoryTrackingStarted;

    public OperationTracker() {
        this(MultiplicativeBackoffPolicy.drainDefault());
    }

    public OperationTracker(BackoffPolicy drainBackoff) {
        this.drainBackoff = Preconditions.checkNotNull(drainBackoff, "drainBackoff");
    }

    public void startInstrumentation(MetricRegistry registry) {
        startInstrumentation(registry, "");
    }

    /** Registers the in-flight gauges and rejection counter under {@code prefix}. */
    public synchronized void startInstrumentation(MetricRegistry registry, String prefix) {
        Preconditions.checkNotNull(registry, "registry");
        Preconditions.checkState(metrics == null, "instrumentation already started");
        Preconditions.checkState(getNumPending() == 0, "instrumentation must start before any operation is admitted");
        metrics = new OperationMetrics(new Metrics(registry, prefix));
    }

    /**
     * Creates this tracker's budget as a child of {@code parent}. An unlimited limit turns memory-based
     * admission off: no node is created and every admission succeeds as far as memory is concerned.
     */
    public synchronized void startMemoryTracking(MemoryBudget parent, MemoryLimit limit) {
        Preconditions.checkNotNull(parent, "parent");
        Preconditions.checkNotNull(limit, "limit");
        Preconditions.checkState(!memoryTrackingStarted, "memory tracking already started");
        Preconditions.checkState(getNumPending() == 0, "memory tracking must start before any operation is admitted");
        memoryTrackingStarted = true;
        if (limit.isUnlimited()) {
            logger.info("Operation memory tracking disabled; no admission limit under {}", parent.name());
            return;
        }
        budget = parent.createChild(BUDGET_NAME, limit);
    }

    /**
     * Admits {@code driver}, or rejects it without touching the registry when its memory footprint
     * does not fit the budget.
     *
     * @throws OperationRejectedException if this tracker's budget, or an ancestor's, cannot hold the footprint
     * @throws TrackerInvariantError if an operation with the same id is already tracked
     */
    public void add(OperationDriver driver) throws OperationRejectedException {
        Preconditions.checkNotNull(driver, "driver");
        long footprint = driver.memoryFootprint();
        MemoryBudget b = budget;
        if (b != null && !b.tryReserve(footprint)) {
            OperationMetrics m = metrics;
            if (m != null) m.markRejected();
            OperationRejectedException rejected = new OperationRejectedException(
                    driver.partitionId().orElse(UNKNOWN_PARTITION), b.consumption(), b.limit());
            long suppressed = rejectionWarnings.tryAcquire();
            if (suppressed != WarningThrottle.SUPPRESSED) {
                logger.warn("{} [suppressed {} similar messages]", rejected.getMessage(), suppressed);
            }
            throw rejected;
        }

        incrementCounters(driver);

        TrackedEntry previous;
        lock.lock();
        try {
            previous = pending.putIfAbsent(driver.id(), new TrackedEntry(driver, footprint));
        } finally {
            lock.unlock();
        }
        if (previous != null) {
            // undo the reservation and increments before failing
            decrementCounters(driver);
            if (b != null) b.release(footprint);
            throw invariantViolation("Operation " + driver.id() + " is already tracked: "
                    + previous.driver().describe());
        }
    }

    /**
     * Forgets {@code driver} and credits back the footprint cached when it was admitted.
     *
     * @throws TrackerInvariantError if {@code driver} is not currently tracked
     */
    public void release(OperationDriver driver) {
        Preconditions.checkNotNull(driver, "driver");
        TrackedEntry entry;
        lock.lock();
        try {
            entry = pending.get(driver.id());
            if (entry != null && entry.driver() == driver) {
                pending.remove(driver.id());
            } else {
                entry = null;
            }
        } finally {
            lock.unlock();
        }
        if (entry == null) {
            throw invariantViolation("Could not remove pending operation from registry: " + driver.describe());
        }

        decrementCounters(driver);

        MemoryBudget b = budget;
        if (b != null) b.release(entry.memoryFootprint());
    }

    /** Point-in-time copy of the tracked drivers; stale as soon as it is returned. */
    public List<OperationDriver> getPendingOperations() {
        List<OperationDriver> result;
        lock.lock();
        try {
            result = new ArrayList<>(pending.size());
            for (TrackedEntry e : pending.values()) {
                result.add(e.driver());
            }
        } finally {
            lock.unlock();
        }
        return List.copyOf(result);
    }

    /** Like {@link #getPendingOperations()}, paired with the footprint each operation was admitted with. */
    public List<TrackedEntry> getTrackedEntries() {
        lock.lock();
        try {
            return List.copyOf(pending.values());
        } finally {
            lock.unlock();
        }
    }

    public int getNumPending() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /** Blocks until nothing is tracked, however long that takes. */
    public void waitForAllToFinish() throws InterruptedException {
        try {
            waitForAllToFinish(Duration.ofNanos(Long.MAX_VALUE));
        } catch (DrainTimeoutException e) {
            throw new IllegalStateException("unbounded drain timed out", e);
        }
    }

    /**
     * Blocks until nothing is tracked or {@code timeout} has elapsed, polling with a growing backoff.
     *
     * @throws DrainTimeoutException if operations are still pending after {@code timeout}
     */
    public void waitForAllToFinish(Duration timeout) throws DrainTimeoutException, InterruptedException {
        Preconditions.checkNotNull(timeout, "timeout");
        long timeoutNanos = toNanosSaturated(timeout);
        long start = System.nanoTime();
        long waitMicros = drainBackoff.initialDelayMicros();
        long complaints = 0;
        while (true) {
            List<OperationDriver> operations = getPendingOperations();
            if (operations.isEmpty()) {
                return;
            }

            long elapsed = System.nanoTime() - start;
            if (elapsed > timeoutNanos) {
                throw new DrainTimeoutException(operations.size(), Duration.ofNanos(elapsed));
            }
            long waitedMillis = TimeUnit.NANOSECONDS.toMillis(elapsed);
            if (waitedMillis / COMPLAIN_MILLIS > complaints) {
                logger.warn("OperationTracker waiting for {} outstanding operations to complete now for {} ms",
                        operations.size(), waitedMillis);
                complaints = waitedMillis / COMPLAIN_MILLIS;
            }

            if (logger.isDebugEnabled()) {
                logger.debug("Dumping currently running operations:");
                for (OperationDriver driver : operations) {
                    logger.debug("  {}", driver.describe());
                }
            }

            long remainingMicros = TimeUnit.NANOSECONDS.toMicros(timeoutNanos - elapsed) + 1;
            TimeUnit.MICROSECONDS.sleep(Math.min(waitMicros, remainingMicros));
            waitMicros = drainBackoff.nextDelayMicros(waitMicros);
        }
    }

    public Optional<MemoryBudget> memoryBudget() { return Optional.ofNullable(budget); }

    public Optional<OperationMetrics> metrics() { return Optional.ofNullable(metrics); }

    /**
     * Tears the tracker down. Every admitted operation must have been released first.
     *
     * @throws TrackerInvariantError if operations are still registered
     */
    @Override
    public void close() {
        int remaining = getNumPending();
        if (remaining != 0) {
            throw invariantViolation("OperationTracker closed with " + remaining + " operations still pending");
        }
        MemoryBudget b = budget;
        if (b != null) b.unregisterFromParent();
    }

    private void incrementCounters(OperationDriver driver) {
        OperationMetrics m = metrics;
        if (m == null) return;
        m.increment(driver.operationType());
    }

    private void decrementCounters(OperationDriver driver) {
        OperationMetrics m = metrics;
        if (m == null) return;
        m.decrement(driver.operationType());
    }

    private static TrackerInvariantError invariantViolation(String message) {
        logger.error("{}", message);
        return new TrackerInvariantError(message);
    }

    private static long toNanosSaturated(Duration d) {
        if (d.isNegative()) return 0;
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
