package io.optracker.tracker;

import com.codahale.metrics.MetricRegistry;
import io.optracker.budget.HierarchicalMemoryBudget;
import io.optracker.budget.MemoryBudget;
import io.optracker.budget.MemoryLimit;
import io.optracker.core.FakeOperationDriver;
import io.optracker.core.OperationDriver;
import io.optracker.core.OperationType;
import io.optracker.error.OperationRejectedException;
import io.optracker.error.TrackerInvariantError;
import io.optracker.metrics.OperationMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OperationTrackerTest {
    MetricRegistry registry;
    MemoryBudget root;
    OperationTracker tracker;

    @BeforeEach
    void setUp() {
        registry = new MetricRegistry();
        root = HierarchicalMemoryBudget.root("root", MemoryLimit.unlimited());
        tracker = new OperationTracker();
        tracker.startInstrumentation(registry);
    }

    private OperationMetrics metrics() { return tracker.metrics().orElseThrow(); }

    private long consumption() { return tracker.memoryBudget().orElseThrow().consumption(); }

    @Test
    void rejects_admission_that_crosses_the_limit_and_recovers_after_release() throws Exception {
        tracker.startMemoryTracking(root, MemoryLimit.ofBytes(1000));
        var a = FakeOperationDriver.write(600);
        var b = FakeOperationDriver.write(500);

        tracker.add(a);
        assertEquals(600, consumption());

        OperationRejectedException e = assertThrows(OperationRejectedException.class, () -> tracker.add(b));
        assertEquals(600, consumption());
        assertEquals(1, metrics().rejections());
        assertEquals(600, e.consumption());
        assertEquals(1000, e.limit());
        assertEquals("tablet-1", e.partitionId());
        assertTrue(e.getMessage().contains("tablet-1"));
        assertEquals(1, tracker.getNumPending());

        tracker.release(a);
        assertEquals(0, consumption());

        tracker.add(b);
        assertEquals(500, consumption());
        tracker.release(b);
        tracker.close();
    }

    @Test
    void release_credits_the_footprint_cached_at_admission() throws Exception {
        tracker.startMemoryTracking(root, MemoryLimit.ofBytes(10_000));
        var op = FakeOperationDriver.write(700);
        tracker.add(op);
        op.setFootprint(0);
        tracker.release(op);
        assertEquals(0, consumption());
        assertEquals(0, root.consumption());
    }

    @Test
    void add_then_release_restores_consumption_exactly() throws Exception {
        tracker.startMemoryTracking(root, MemoryLimit.ofBytes(10_000));
        var held = FakeOperationDriver.write(1234);
        tracker.add(held);
        long before = consumption();
        var op = FakeOperationDriver.of(OperationType.SNAPSHOT, 321);
        tracker.add(op);
        tracker.release(op);
        assertEquals(before, consumption());
        tracker.release(held);
    }

    @Test
    void counters_match_registry_size() throws Exception {
        tracker.startMemoryTracking(root, MemoryLimit.unlimited());
        var ops = List.of(
                FakeOperationDriver.of(OperationType.WRITE, 1),
                FakeOperationDriver.of(OperationType.WRITE, 1),
                FakeOperationDriver.of(OperationType.ALTER_SCHEMA, 1),
                FakeOperationDriver.of(OperationType.UPDATE_TRANSACTION, 1),
                FakeOperationDriver.of(OperationType.SNAPSHOT, 1),
                FakeOperationDriver.of(OperationType.TRUNCATE, 1));
        for (OperationDriver op : ops) tracker.add(op);

        assertEquals(6, tracker.getNumPending());
        assertEquals(6, metrics().inflight());
        assertEquals(2, metrics().inflight(OperationType.WRITE));
        long sum = 0;
        for (OperationType t : OperationType.values()) sum += metrics().inflight(t);
        assertEquals(6, sum);
        assertEquals(6, registry.counter(OperationMetrics.ALL_INFLIGHT).getCount());

        tracker.release(ops.get(0));
        tracker.release(ops.get(2));
        assertEquals(4, tracker.getNumPending());
        assertEquals(4, metrics().inflight());
        assertEquals(1, metrics().inflight(OperationType.WRITE));
        assertEquals(0, metrics().inflight(OperationType.ALTER_SCHEMA));

        for (OperationDriver op : ops.subList(3, 6)) tracker.release(op);
        tracker.release(ops.get(1));
        assertEquals(0, tracker.getNumPending());
        assertEquals(0, metrics().inflight());
    }

    @Test
    void unlimited_memory_tracking_admits_everything() throws Exception {
        tracker.startMemoryTracking(root, MemoryLimit.unlimited());
        assertTrue(tracker.memoryBudget().isEmpty());
        assertTrue(root.children().isEmpty());
        var big = FakeOperationDriver.write(Long.MAX_VALUE / 2);
        tracker.add(big);
        assertEquals(0, metrics().rejections());
        tracker.release(big);
    }

    @Test
    void works_without_instrumentation_or_memory_tracking() throws Exception {
        OperationTracker bare = new OperationTracker();
        var op = FakeOperationDriver.write(10);
        bare.add(op);
        assertEquals(1, bare.getNumPending());
        assertSame(op, bare.getPendingOperations().get(0));
        bare.release(op);
        bare.close();
    }

    @Test
    void ancestor_limit_rejects_even_when_tracker_budget_has_room() throws Exception {
        MemoryBudget tightRoot = HierarchicalMemoryBudget.root("root", MemoryLimit.ofBytes(100));
        tracker.startMemoryTracking(tightRoot, MemoryLimit.ofBytes(1000));
        assertThrows(OperationRejectedException.class, () -> tracker.add(FakeOperationDriver.write(200)));
        assertEquals(0, consumption());
        assertEquals(0, tightRoot.consumption());
        assertEquals(0, tracker.getNumPending());
    }

    @Test
    void rejection_without_partition_reports_unknown() {
        tracker.startMemoryTracking(root, MemoryLimit.ofBytes(10));
        var op = new FakeOperationDriver(424242, OperationType.WRITE, 20, null);
        OperationRejectedException e = assertThrows(OperationRejectedException.class, () -> tracker.add(op));
        assertEquals("(unknown)", e.partitionId());
    }

    @Test
    void snapshot_is_a_copy() throws Exception {
        var a = FakeOperationDriver.write(1);
        tracker.add(a);
        List<OperationDriver> snapshot = tracker.getPendingOperations();
        tracker.release(a);
        assertEquals(1, snapshot.size());
        assertEquals(0, tracker.getNumPending());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(a));
    }

    @Test
    void duplicate_admission_is_fatal_and_leaves_accounting_intact() throws Exception {
        tracker.startMemoryTracking(root, MemoryLimit.ofBytes(1000));
        var op = FakeOperationDriver.write(100);
        tracker.add(op);
        assertThrows(TrackerInvariantError.class, () -> tracker.add(op));
        assertEquals(100, consumption());
        assertEquals(1, metrics().inflight());
        assertEquals(1, tracker.getNumPending());
        tracker.release(op);
    }

    @Test
    void double_release_is_fatal() throws Exception {
        var other = FakeOperationDriver.write(1);
        var op = FakeOperationDriver.write(1);
        tracker.add(other);
        tracker.add(op);
        tracker.release(op);
        assertThrows(TrackerInvariantError.class, () -> tracker.release(op));
        assertEquals(1, metrics().inflight());
        tracker.release(other);
    }

    @Test
    void release_of_foreign_driver_with_same_id_is_fatal() throws Exception {
        var op = new FakeOperationDriver(9_000_001, OperationType.WRITE, 1, "tablet-1");
        var impostor = new FakeOperationDriver(9_000_001, OperationType.WRITE, 1, "tablet-1");
        tracker.add(op);
        assertThrows(TrackerInvariantError.class, () -> tracker.release(impostor));
        assertEquals(1, tracker.getNumPending());
        tracker.release(op);
    }

    @Test
    void close_with_pending_operations_is_fatal() throws Exception {
        tracker.add(FakeOperationDriver.write(1));
        assertThrows(TrackerInvariantError.class, () -> tracker.close());
    }

    @Test
    void close_unregisters_budget_from_parent() throws Exception {
        tracker.startMemoryTracking(root, MemoryLimit.ofMegabytes(1));
        assertEquals(1, root.children().size());
        assertEquals(OperationTracker.BUDGET_NAME, root.children().get(0).name());
        assertEquals(1024 * 1024, root.children().get(0).limit());
        tracker.close();
        assertTrue(root.children().isEmpty());
    }

    @Test
    void setup_calls_are_one_time() {
        tracker.startMemoryTracking(root, MemoryLimit.ofBytes(1));
        assertThrows(IllegalStateException.class, () -> tracker.startMemoryTracking(root, MemoryLimit.ofBytes(1)));
        assertThrows(IllegalStateException.class, () -> tracker.startInstrumentation(registry));
    }

    @Test
    void memory_tracking_cannot_start_after_admission() throws Exception {
        var op = FakeOperationDriver.write(100);
        tracker.add(op);

        assertThrows(IllegalStateException.class, () -> tracker.startMemoryTracking(root, MemoryLimit.ofBytes(1000)));
        assertTrue(tracker.memoryBudget().isEmpty());

        tracker.release(op);
        assertEquals(0, root.consumption());
    }

    @Test
    void instrumentation_cannot_start_after_admission() throws Exception {
        OperationTracker bare = new OperationTracker();
        var op = FakeOperationDriver.write(100);
        bare.add(op);

        assertThrows(IllegalStateException.class, () -> bare.startInstrumentation(registry));
        assertTrue(bare.metrics().isEmpty());

        bare.release(op);
        assertEquals(0, bare.getNumPending());
    }
}
