package io.optracker.error;

/**
 * An operation was refused admission because its partition's memory budget, or an ancestor's, is exhausted.
 * The caller is expected to retry later.
 */
public class OperationRejectedException extends Exception {
    private final String partitionId;
    private final long consumption;
    private final long limit;

    public OperationRejectedException(String partitionId, long consumption, long limit) {
        super(String.format("Operation failed, partition %s operation memory consumption (%d) "
                + "has exceeded its limit (%d) or the limit of an ancestral budget", partitionId, consumption, limit));
        this.partitionId = partitionId;
        this.consumption = consumption;
        this.limit = limit;
    }

    public String partitionId() { return partitionId; }

    public long consumption() { return consumption; }

    public long limit() { return limit; }
}
