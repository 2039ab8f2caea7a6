package io.optracker.budget;

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tree of atomic byte counters. A reservation must fit under this node's limit and under every ancestor's.
 */
public class HierarchicalMemoryBudget implements MemoryBudget {
    private final String name;
    private final MemoryLimit limit;
    private final HierarchicalMemoryBudget parent;
    private final AtomicLong consumption = new AtomicLong(0);
    private final List<MemoryBudget> children = new CopyOnWriteArrayList<>();
    private boolean registered;

    private HierarchicalMemoryBudget(String name, MemoryLimit limit, HierarchicalMemoryBudget parent) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.limit = Preconditions.checkNotNull(limit, "limit");
        this.parent = parent;
        this.registered = parent != null;
    }

    public static HierarchicalMemoryBudget root(String name, MemoryLimit limit) {
        return new HierarchicalMemoryBudget(name, limit, null);
    }

    @Override
    public String name() { return name; }

    @Override
    public boolean tryReserve(long bytes) {
        Preconditions.checkArgument(bytes >= 0, "bytes to reserve must be non-negative: %s", bytes);
        if (!tryReserveLocal(bytes)) {
            return false;
        }
        if (parent != null && !parent.tryReserve(bytes)) {
            consumption.addAndGet(-bytes);
            return false;
        }
        return true;
    }

    private boolean tryReserveLocal(long bytes) {
        if (limit.isUnlimited()) {
            consumption.addAndGet(bytes);
            return true;
        }
        long max = limit.bytes();
        while (true) {
            long current = consumption.get();
            long next = current + bytes;
            if (next > max || next < current) return false;
            if (consumption.compareAndSet(current, next)) return true;
        }
    }

    @Override
    public void release(long bytes) {
        Preconditions.checkArgument(bytes >= 0, "bytes to release must be non-negative: %s", bytes);
        long after = consumption.addAndGet(-bytes);
        if (after < 0) {
            consumption.addAndGet(bytes);
            throw new IllegalStateException("budget " + name + " released " + bytes
                    + " bytes but only " + (after + bytes) + " were reserved");
        }
        if (parent != null) parent.release(bytes);
    }

    @Override
    public long consumption() { return consumption.get(); }

    @Override
    public long limit() { return limit.isUnlimited() ? -1 : limit.bytes(); }

    @Override
    public boolean hasLimit() { return !limit.isUnlimited(); }

    @Override
    public Optional<MemoryBudget> parent() { return Optional.ofNullable(parent); }

    @Override
    public List<MemoryBudget> children() { return List.copyOf(children); }

    @Override
    public MemoryBudget createChild(String childName, MemoryLimit childLimit) {
        HierarchicalMemoryBudget child = new HierarchicalMemoryBudget(childName, childLimit, this);
        children.add(child);
        return child;
    }

    @Override
    public synchronized void unregisterFromParent() {
        if (parent == null || !registered) return;
        registered = false;
        parent.children.remove(this);
    }

    @Override
    public String toString() {
        return "MemoryBudget{" + name + ", consumption=" + consumption.get() + ", limit=" + limit + "}";
    }
}
