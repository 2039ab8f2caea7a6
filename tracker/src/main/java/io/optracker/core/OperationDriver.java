package io.optracker.core;

import java.util.Optional;

/**
 * Handle for one in-flight mutating operation, supplied by whoever produced the operation.
 */
public interface OperationDriver {
    /** Stable identity; two live drivers never share one. */
    long id();

    /** Bytes currently held by the operation's request. */
    long memoryFootprint();

    OperationType operationType();

    /** Partition the operation mutates, if known. */
    default Optional<String> partitionId() { return Optional.empty(); }

    String describe();
}
