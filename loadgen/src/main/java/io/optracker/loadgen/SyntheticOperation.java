package io.optracker.loadgen;

import io.optracker.core.OperationDriver;
import io.optracker.core.OperationType;

import java.util.Optional;

/**
 * Operation with a fixed footprint, standing in for a real write or schema change.
 */
final class SyntheticOperation implements OperationDriver {
    private final long id;
    private final OperationType type;
    private final long footprint;
    private final String partitionId;
    private final String producer;

    SyntheticOperation(long id, OperationType type, long footprint, String partitionId, String producer) {
        this.id = id;
        this.type = type;
        this.footprint = footprint;
        this.partitionId = partitionId;
        this.producer = producer;
    }

    @Override public long id() { return id; }
    @Override public long memoryFootprint() { return footprint; }
    @Override public OperationType operationType() { return type; }
    @Override public Optional<String> partitionId() { return Optional.of(partitionId); }

    @Override
    public String describe() {
        return String.format("%s operation %d from %s (%d bytes)", type.displayName(), id, producer, footprint);
    }

    @Override
    public String toString() { return describe(); }
}
