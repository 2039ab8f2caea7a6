package io.optracker.loadgen;

import io.optracker.core.OperationType;
import io.optracker.error.DrainTimeoutException;
import io.optracker.error.OperationRejectedException;
import io.optracker.metrics.OperationMetrics;
import io.optracker.tracker.OperationTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Producer threads admit operations; a separate completer pool releases each one after a hold time.
 * Once producers finish, the calling thread drains the tracker.
 */
public class LoadRunner {
    private static final Logger logger = LoggerFactory.getLogger(LoadRunner.class);

    private final OperationTracker tracker;
    private final String partitionId;
    private final int threads;
    private final int opsPerThread;
    private final long footprintBytes;
    private final long holdMillis;
    private final AtomicLong ids = new AtomicLong(0);
    private final AtomicLong admitted = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);
    private final ConcurrentLinkedQueue<ScheduledFuture<?>> releases = new ConcurrentLinkedQueue<>();

    public LoadRunner(OperationTracker tracker, String partitionId, int threads, int opsPerThread,
                      long footprintBytes, long holdMillis) {
        this.tracker = Objects.requireNonNull(tracker);
        this.partitionId = Objects.requireNonNull(partitionId);
        this.threads = Math.max(1, threads);
        this.opsPerThread = Math.max(0, opsPerThread);
        this.footprintBytes = Math.max(0, footprintBytes);
        this.holdMillis = Math.max(0, holdMillis);
    }

    public LoadReport run(Duration drainTimeout) throws InterruptedException {
        long t0 = System.nanoTime();
        ExecutorService producers = Executors.newFixedThreadPool(threads);
        ScheduledExecutorService completers = Executors.newScheduledThreadPool(Math.max(1, threads / 2));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String producer = "producer-" + t;
                futures.add(producers.submit(() -> produce(producer, completers)));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("producer failed", e.getCause());
                }
            }

            boolean drained = true;
            try {
                tracker.waitForAllToFinish(drainTimeout);
            } catch (DrainTimeoutException e) {
                logger.warn("{}", e.getMessage());
                drained = false;
            }
            long releaseFailures = countReleaseFailures(drained);
            long rejectionCounter = tracker.metrics().map(OperationMetrics::rejections).orElse(0L);
            return new LoadReport(admitted.get(), rejected.get(), rejectionCounter, drained,
                    tracker.getNumPending(), releaseFailures, Duration.ofNanos(System.nanoTime() - t0));
        } finally {
            producers.shutdownNow();
            completers.shutdown();
            completers.awaitTermination(holdMillis + 1000, TimeUnit.MILLISECONDS);
        }
    }

    private void produce(String producer, ScheduledExecutorService completers) {
        OperationType[] types = OperationType.values();
        for (int i = 0; i < opsPerThread; i++) {
            OperationType type = i % 10 == 9 ? types[1 + (i / 10) % (types.length - 1)] : OperationType.WRITE;
            SyntheticOperation op = new SyntheticOperation(ids.incrementAndGet(), type, footprintBytes, partitionId, producer);
            try {
                tracker.add(op);
            } catch (OperationRejectedException e) {
                rejected.incrementAndGet();
                continue;
            }
            admitted.incrementAndGet();
            releases.add(completers.schedule(() -> tracker.release(op), holdMillis, TimeUnit.MILLISECONDS));
        }
    }

    /**
     * Counts releases that threw. After a successful drain every release has run, so each one is awaited;
     * otherwise only the ones that already finished are inspected.
     */
    private long countReleaseFailures(boolean drained) throws InterruptedException {
        long failures = 0;
        for (ScheduledFuture<?> f : releases) {
            if (!drained && !f.isDone()) continue;
            try {
                f.get(holdMillis + 1000, TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                logger.error("Release failed", e.getCause());
                failures++;
            } catch (TimeoutException e) {
                logger.error("Release did not complete after drain");
                failures++;
            }
        }
        return failures;
    }
}
