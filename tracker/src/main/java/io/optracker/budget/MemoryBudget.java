package io.optracker.budget;

import java.util.List;
import java.util.Optional;

/**
 * MemoryBudget governs how many bytes a subtree of the process may hold at once.
 */
public interface MemoryBudget {
    String name();

    /** Reserve bytes here and in every ancestor. Return false, reserving nothing, if any limit would be exceeded. */
    boolean tryReserve(long bytes);

    /** Credit bytes back to this node and every ancestor. */
    void release(long bytes);

    long consumption();

    /** Byte limit of this node; meaningful only when {@link #hasLimit()} is true. */
    long limit();

    boolean hasLimit();

    Optional<MemoryBudget> parent();

    List<MemoryBudget> children();

    MemoryBudget createChild(String name, MemoryLimit limit);

    /** Detach from the parent's child list. Safe to call more than once. */
    void unregisterFromParent();
}
